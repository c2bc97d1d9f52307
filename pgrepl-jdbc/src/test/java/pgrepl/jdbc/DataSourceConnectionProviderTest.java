package pgrepl.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;
import pgrepl.Endpoint;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DataSourceConnectionProviderTest {
  private static final Endpoint ENDPOINT = Endpoint.builder()
      .host("primary.example.com").user("admin").password("pw").database("products").build();

  @Test
  void nullArgumentsThrow() {
    assertThrows(NullPointerException.class, () -> new DataSourceConnectionProvider(null));
    assertThrows(NullPointerException.class, () -> DataSourceConnectionProvider.of(null));
  }

  @Test
  void delegatesToDataSource() throws SQLException {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:dscp_test;DB_CLOSE_DELAY=-1");

    DataSourceConnectionProvider provider = DataSourceConnectionProvider.of(ds);

    try (Connection conn = provider.getConnection(ENDPOINT, Duration.ofSeconds(1))) {
      assertNotNull(conn);
      assertFalse(conn.isClosed());
    }
  }

  @Test
  void unknownEndpointIsAConnectionFailure() {
    DataSourceConnectionProvider provider = new DataSourceConnectionProvider(endpoint -> null);

    SQLException e = assertThrows(SQLException.class,
        () -> provider.getConnection(ENDPOINT, Duration.ofSeconds(1)));
    assertTrue(e.getMessage().contains("primary.example.com:5432"));
  }
}
