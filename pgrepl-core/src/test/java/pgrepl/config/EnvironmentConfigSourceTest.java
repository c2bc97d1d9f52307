package pgrepl.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import pgrepl.ConfigurationException;
import pgrepl.SetupConfig;
import pgrepl.SslMode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentConfigSourceTest {

  private static Map<String, String> required() {
    Map<String, String> env = new HashMap<>();
    env.put("AZURE_POSTGRES_PRIMARY_HOST", "primary.example.com");
    env.put("AZURE_POSTGRES_PRIMARY_USER", "admin");
    env.put("AZURE_POSTGRES_PRIMARY_PASSWORD", "s3cret");
    env.put("AZURE_POSTGRES_PRIMARY_SERVER_NAME", "products-server");
    env.put("AZURE_POSTGRES_REPLICA_HOST", "replica.example.com");
    env.put("AZURE_POSTGRES_REPLICA_USER", "admin");
    env.put("AZURE_POSTGRES_REPLICA_PASSWORD", "r3plica");
    env.put("AZURE_POSTGRES_REPLICA_SERVER_NAME", "sales-server");
    return env;
  }

  @Test
  void appliesDefaults() {
    SetupConfig config = new EnvironmentConfigSource(required()).load();

    assertEquals("primary.example.com", config.primary().host());
    assertEquals(5432, config.primary().port());
    assertEquals("products", config.primary().database());
    assertEquals("sales", config.replica().database());
    assertEquals(SslMode.REQUIRE, config.primary().sslMode());
    assertEquals(SslMode.REQUIRE, config.replica().sslMode());
    assertEquals("products-server", config.primaryServerName());
    assertEquals("sales-server", config.replicaServerName());
    assertEquals("products_publication", config.publicationName());
    assertEquals("sales_subscription", config.subscriptionName());
    assertEquals(config.primary(), config.publisher());
    assertEquals(Duration.ofSeconds(30), config.queryTimeout());
  }

  @Test
  void reportsEveryMissingVariable() {
    Map<String, String> env = required();
    env.remove("AZURE_POSTGRES_PRIMARY_PASSWORD");
    env.put("AZURE_POSTGRES_REPLICA_HOST", "  ");

    ConfigurationException e = assertThrows(ConfigurationException.class,
        () -> new EnvironmentConfigSource(env).load());

    assertEquals(List.of("AZURE_POSTGRES_PRIMARY_PASSWORD", "AZURE_POSTGRES_REPLICA_HOST"), e.missingParameters());
    assertTrue(e.getMessage().startsWith("Missing required environment variables: "));
    assertFalse(e.remediation().isEmpty());
  }

  @Test
  void readsOptionalOverrides() {
    Map<String, String> env = required();
    env.put("AZURE_POSTGRES_PRIMARY_DB", "catalog");
    env.put("AZURE_POSTGRES_REPLICA_PORT", "6432");
    env.put("AZURE_POSTGRES_SSL_MODE", "verify-full");
    env.put("REPLICATION_PUBLICATION_NAME", "catalog_pub");
    env.put("REPLICATION_SUBSCRIPTION_NAME", "catalog_sub");
    env.put("REPLICATION_QUERY_TIMEOUT_SECONDS", "5");
    env.put("REPLICATION_CONNECT_TIMEOUT_SECONDS", "3");

    SetupConfig config = new EnvironmentConfigSource(env).load();

    assertEquals("catalog", config.primary().database());
    assertEquals(6432, config.replica().port());
    assertEquals(SslMode.VERIFY_FULL, config.replica().sslMode());
    assertEquals("catalog_pub", config.publicationName());
    assertEquals("catalog_sub", config.subscriptionName());
    assertEquals(Duration.ofSeconds(5), config.queryTimeout());
    assertEquals(Duration.ofSeconds(3), config.connectTimeout());
  }

  @Test
  void publisherOverrideKeepsCredentials() {
    Map<String, String> env = required();
    env.put("REPLICATION_PUBLISHER_HOST", "10.1.2.3");

    SetupConfig config = new EnvironmentConfigSource(env).load();

    assertEquals("10.1.2.3", config.publisher().host());
    assertEquals(5432, config.publisher().port());
    assertEquals("s3cret", config.publisher().password());
    assertEquals("primary.example.com", config.primary().host());
  }

  @Test
  void rejectsMalformedValues() {
    Map<String, String> badSsl = required();
    badSsl.put("AZURE_POSTGRES_SSL_MODE", "sometimes");
    assertThrows(ConfigurationException.class, () -> new EnvironmentConfigSource(badSsl).load());

    Map<String, String> badPort = required();
    badPort.put("AZURE_POSTGRES_PRIMARY_PORT", "five");
    assertThrows(ConfigurationException.class, () -> new EnvironmentConfigSource(badPort).load());

    Map<String, String> badTimeout = required();
    badTimeout.put("REPLICATION_QUERY_TIMEOUT_SECONDS", "0");
    assertThrows(ConfigurationException.class, () -> new EnvironmentConfigSource(badTimeout).load());

    Map<String, String> badName = required();
    badName.put("REPLICATION_PUBLICATION_NAME", "products-publication");
    assertThrows(ConfigurationException.class, () -> new EnvironmentConfigSource(badName).load());

    Map<String, String> mixedCase = required();
    mixedCase.put("REPLICATION_SUBSCRIPTION_NAME", "Sales_Subscription");
    assertThrows(ConfigurationException.class, () -> new EnvironmentConfigSource(mixedCase).load());
  }

  @Test
  void environmentWinsOverDotEnv(@TempDir Path dir) throws IOException {
    Path envFile = dir.resolve(".env");
    Files.writeString(envFile, String.join("\n",
        "# credentials",
        "AZURE_POSTGRES_PRIMARY_PASSWORD=from-file",
        "AZURE_POSTGRES_REPLICA_DB=warehouse"));
    Map<String, String> env = required();

    SetupConfig config = EnvironmentConfigSource.merged(envFile, env).load();

    assertEquals("s3cret", config.primary().password());
    assertEquals("warehouse", config.replica().database());
  }

  @Test
  void missingDotEnvFallsBackToEnvironment(@TempDir Path dir) {
    SetupConfig config = EnvironmentConfigSource.merged(dir.resolve("absent.env"), required()).load();

    assertEquals("primary.example.com", config.primary().host());
  }
}
