package pgrepl.spi;

import pgrepl.Endpoint;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

/**
 * Opens JDBC connections to replication endpoints.
 *
 * <p>Callers are responsible for closing the returned connection. Liveness checking and error
 * translation happen in {@link pgrepl.connect.EndpointConnector}; implementations only open.
 *
 * @see pgrepl.connect.EndpointConnector
 */
@FunctionalInterface
public interface ConnectionProvider {

  /**
   * Opens a new connection to the given endpoint.
   *
   * @param endpoint       where to connect
   * @param connectTimeout upper bound for establishing the connection
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection(Endpoint endpoint, Duration connectTimeout) throws SQLException;
}
