package pgrepl.connect;

import pgrepl.ConnectivityException;
import pgrepl.Endpoint;
import pgrepl.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Opens a connection through a {@link ConnectionProvider} and confirms it with a
 * {@code SELECT 1} round-trip before handing it out.
 *
 * <p>On failure any half-open connection is closed and a {@link ConnectivityException} naming
 * only the host is thrown. The caller owns and must close a returned connection.
 */
public final class EndpointConnector {
  private static final Logger logger = Logger.getLogger(EndpointConnector.class.getName());

  private final ConnectionProvider connectionProvider;
  private final Duration connectTimeout;
  private final Duration queryTimeout;

  public EndpointConnector(ConnectionProvider connectionProvider, Duration connectTimeout, Duration queryTimeout) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    this.queryTimeout = Objects.requireNonNull(queryTimeout, "queryTimeout");
  }

  /**
   * @param endpoint    where to connect
   * @param description role label used in log lines and errors, e.g. {@code PRIMARY}
   * @return a live connection
   * @throws ConnectivityException if the endpoint cannot be reached or authenticated
   */
  public Connection connect(Endpoint endpoint, String description) {
    Objects.requireNonNull(endpoint, "endpoint");
    logger.info("Connecting to " + description + " database at " + endpoint.host() + "...");
    Connection conn = null;
    try {
      conn = connectionProvider.getConnection(endpoint, connectTimeout);
      if (conn == null) {
        throw new SQLException("connection provider returned no connection");
      }
      ping(conn);
      logger.info("Connected successfully to " + description + " database!");
      return conn;
    } catch (SQLException | RuntimeException e) {
      ConnectivityException failure = new ConnectivityException(description, endpoint.host(), e);
      if (conn != null) {
        try {
          conn.close();
        } catch (SQLException closeFailure) {
          failure.addSuppressed(closeFailure);
        }
      }
      throw failure;
    }
  }

  private void ping(Connection conn) throws SQLException {
    try (Statement st = conn.createStatement()) {
      st.setQueryTimeout(seconds(queryTimeout));
      st.execute("SELECT 1");
    }
  }

  static int seconds(Duration timeout) {
    long s = Math.max(1L, (timeout.toMillis() + 999L) / 1000L);
    return (int) Math.min(Integer.MAX_VALUE, s);
  }
}
