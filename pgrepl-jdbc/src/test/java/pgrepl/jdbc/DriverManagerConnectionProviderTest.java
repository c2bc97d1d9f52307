package pgrepl.jdbc;

import org.junit.jupiter.api.Test;
import pgrepl.ConnectivityException;
import pgrepl.Endpoint;
import pgrepl.SslMode;
import pgrepl.connect.EndpointConnector;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class DriverManagerConnectionProviderTest {
  private static final Endpoint ENDPOINT = Endpoint.builder()
      .host("replica.example.com")
      .port(6432)
      .user("admin")
      .password("s3cret")
      .database("sales")
      .sslMode(SslMode.VERIFY_FULL)
      .build();

  @Test
  void urlCarriesNoCredentials() {
    String url = DriverManagerConnectionProvider.url(ENDPOINT);

    assertEquals("jdbc:postgresql://replica.example.com:6432/sales", url);
    assertFalse(url.contains("s3cret"));
  }

  @Test
  void ipv6HostIsBracketed() {
    Endpoint v6 = ENDPOINT.toBuilder().host("fd00::12").build();
    Endpoint bracketed = ENDPOINT.toBuilder().host("[::1]").build();

    assertEquals("jdbc:postgresql://[fd00::12]:6432/sales", DriverManagerConnectionProvider.url(v6));
    assertEquals("jdbc:postgresql://[::1]:6432/sales", DriverManagerConnectionProvider.url(bracketed));
  }

  @Test
  void databaseNameIsUrlEncoded() {
    Endpoint odd = ENDPOINT.toBuilder().database("sales/eu?x=1 100%").build();

    assertEquals("jdbc:postgresql://replica.example.com:6432/sales%2Feu%3Fx%3D1%20100%25",
        DriverManagerConnectionProvider.url(odd));
  }

  @Test
  void propertiesIncludeCredentialsSslAndTimeouts() {
    Properties props = DriverManagerConnectionProvider.properties(
        ENDPOINT, Duration.ofSeconds(10), Duration.ofMillis(2500));

    assertEquals("admin", props.getProperty("user"));
    assertEquals("s3cret", props.getProperty("password"));
    assertEquals("verify-full", props.getProperty("sslmode"));
    assertEquals("pgrepl", props.getProperty("ApplicationName"));
    assertEquals("10", props.getProperty("connectTimeout"));
    assertEquals("3", props.getProperty("socketTimeout"));
  }

  @Test
  void zeroTimeoutsAreLeftToTheDriver() {
    Properties props = DriverManagerConnectionProvider.properties(ENDPOINT, Duration.ZERO, Duration.ZERO);

    assertNull(props.getProperty("connectTimeout"));
    assertNull(props.getProperty("socketTimeout"));
  }

  @Test
  void negativeSocketTimeoutRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new DriverManagerConnectionProvider(Duration.ofSeconds(-1)));
  }

  @Test
  void refusedConnectionBecomesConnectivityException() {
    Endpoint closedPort = ENDPOINT.toBuilder().host("127.0.0.1").port(1).sslMode(SslMode.DISABLE).build();
    EndpointConnector connector = new EndpointConnector(
        new DriverManagerConnectionProvider(), Duration.ofSeconds(2), Duration.ofSeconds(2));

    ConnectivityException e = assertThrows(ConnectivityException.class,
        () -> connector.connect(closedPort, "REPLICA"));

    assertEquals("127.0.0.1", e.host());
    assertFalse(e.getMessage().contains("s3cret"));
  }
}
