package pgrepl.jdbc;

import pgrepl.Endpoint;
import pgrepl.spi.ConnectionProvider;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * {@link ConnectionProvider} that opens unpooled connections through the PostgreSQL JDBC driver.
 *
 * <p>The driver must be on the runtime classpath; it is located via {@link DriverManager}.
 * Credentials travel as driver properties and never appear in the URL.
 */
public final class DriverManagerConnectionProvider implements ConnectionProvider {
  public static final String APPLICATION_NAME = "pgrepl";

  private final Duration socketTimeout;

  public DriverManagerConnectionProvider() {
    this(Duration.ZERO);
  }

  /**
   * @param socketTimeout read timeout for every socket operation; {@link Duration#ZERO} leaves it unset
   */
  public DriverManagerConnectionProvider(Duration socketTimeout) {
    this.socketTimeout = Objects.requireNonNull(socketTimeout, "socketTimeout");
    if (socketTimeout.isNegative()) {
      throw new IllegalArgumentException("socketTimeout must be >= 0");
    }
  }

  @Override
  public Connection getConnection(Endpoint endpoint, Duration connectTimeout) throws SQLException {
    return DriverManager.getConnection(url(endpoint), properties(endpoint, connectTimeout, socketTimeout));
  }

  static String url(Endpoint endpoint) {
    String host = endpoint.host();
    if (host.indexOf(':') >= 0 && !host.startsWith("[")) {
      host = "[" + host + "]";
    }
    return "jdbc:postgresql://" + host + ":" + endpoint.port() + "/" + encode(endpoint.database());
  }

  // The driver URL-decodes the database path segment.
  private static String encode(String database) {
    return URLEncoder.encode(database, StandardCharsets.UTF_8).replace("+", "%20");
  }

  static Properties properties(Endpoint endpoint, Duration connectTimeout, Duration socketTimeout) {
    Properties props = new Properties();
    props.setProperty("user", endpoint.user());
    props.setProperty("password", endpoint.password());
    props.setProperty("sslmode", endpoint.sslMode().value());
    props.setProperty("ApplicationName", APPLICATION_NAME);
    if (connectTimeout != null && !connectTimeout.isZero()) {
      props.setProperty("connectTimeout", Long.toString(seconds(connectTimeout)));
    }
    if (!socketTimeout.isZero()) {
      props.setProperty("socketTimeout", Long.toString(seconds(socketTimeout)));
    }
    return props;
  }

  private static long seconds(Duration duration) {
    return Math.max(1, (duration.toMillis() + 999) / 1000);
  }
}
