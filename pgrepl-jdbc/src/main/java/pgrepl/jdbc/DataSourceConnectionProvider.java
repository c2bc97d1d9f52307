package pgrepl.jdbc;

import pgrepl.Endpoint;
import pgrepl.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

/**
 * {@link ConnectionProvider} backed by {@link DataSource}s, one per endpoint.
 * Delegates directly to {@link DataSource#getConnection()}; the connect timeout is left to
 * the data source's own configuration.
 *
 * @see ConnectionProvider
 */
public final class DataSourceConnectionProvider implements ConnectionProvider {
  private final Function<Endpoint, DataSource> dataSources;

  public DataSourceConnectionProvider(Function<Endpoint, DataSource> dataSources) {
    this.dataSources = Objects.requireNonNull(dataSources, "dataSources");
  }

  /**
   * Uses the same data source for every endpoint.
   */
  public static DataSourceConnectionProvider of(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    return new DataSourceConnectionProvider(endpoint -> dataSource);
  }

  @Override
  public Connection getConnection(Endpoint endpoint, Duration connectTimeout) throws SQLException {
    DataSource dataSource = dataSources.apply(endpoint);
    if (dataSource == null) {
      throw new SQLException("No data source configured for " + endpoint.host() + ":" + endpoint.port());
    }
    return dataSource.getConnection();
  }
}
