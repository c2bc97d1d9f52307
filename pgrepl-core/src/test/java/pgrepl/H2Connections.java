package pgrepl;

import org.h2.jdbcx.JdbcDataSource;
import pgrepl.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * {@link ConnectionProvider} handing out in-memory H2 connections, one database per endpoint
 * host. Remembers every connection it opened so tests can check they were closed.
 */
public final class H2Connections implements ConnectionProvider {
  private final String prefix = "h2test_" + UUID.randomUUID().toString().replace("-", "");
  public final List<Connection> opened = new ArrayList<>();
  public final List<String> attemptedHosts = new ArrayList<>();
  public final List<String> unreachableHosts = new ArrayList<>();

  @Override
  public Connection getConnection(Endpoint endpoint, Duration connectTimeout) throws SQLException {
    attemptedHosts.add(endpoint.host());
    if (unreachableHosts.contains(endpoint.host())) {
      throw new SQLException("Connection refused: " + endpoint.host());
    }
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + prefix + "_" + endpoint.host().replace('.', '_') + ";DB_CLOSE_DELAY=-1");
    Connection conn = ds.getConnection();
    opened.add(conn);
    return conn;
  }

  public boolean allClosed() throws SQLException {
    for (Connection conn : opened) {
      if (!conn.isClosed()) {
        return false;
      }
    }
    return true;
  }
}
