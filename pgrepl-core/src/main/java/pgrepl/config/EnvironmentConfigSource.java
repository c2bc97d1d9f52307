package pgrepl.config;

import pgrepl.ConfigurationException;
import pgrepl.Endpoint;
import pgrepl.SetupConfig;
import pgrepl.SslMode;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link SetupConfigSource} reading environment-style variables.
 *
 * <p>All missing required variables are reported together in one
 * {@link ConfigurationException}. Use {@link #fromSystem(Path)} to combine a {@code .env} file
 * with the process environment; real environment variables take precedence.
 */
public final class EnvironmentConfigSource implements SetupConfigSource {
  private static final Logger logger = Logger.getLogger(EnvironmentConfigSource.class.getName());

  public static final String PRIMARY_HOST = "AZURE_POSTGRES_PRIMARY_HOST";
  public static final String PRIMARY_PORT = "AZURE_POSTGRES_PRIMARY_PORT";
  public static final String PRIMARY_USER = "AZURE_POSTGRES_PRIMARY_USER";
  public static final String PRIMARY_PASSWORD = "AZURE_POSTGRES_PRIMARY_PASSWORD";
  public static final String PRIMARY_DB = "AZURE_POSTGRES_PRIMARY_DB";
  public static final String PRIMARY_SERVER_NAME = "AZURE_POSTGRES_PRIMARY_SERVER_NAME";
  public static final String REPLICA_HOST = "AZURE_POSTGRES_REPLICA_HOST";
  public static final String REPLICA_PORT = "AZURE_POSTGRES_REPLICA_PORT";
  public static final String REPLICA_USER = "AZURE_POSTGRES_REPLICA_USER";
  public static final String REPLICA_PASSWORD = "AZURE_POSTGRES_REPLICA_PASSWORD";
  public static final String REPLICA_DB = "AZURE_POSTGRES_REPLICA_DB";
  public static final String REPLICA_SERVER_NAME = "AZURE_POSTGRES_REPLICA_SERVER_NAME";
  public static final String SSL_MODE = "AZURE_POSTGRES_SSL_MODE";
  public static final String PUBLICATION_NAME = "REPLICATION_PUBLICATION_NAME";
  public static final String SUBSCRIPTION_NAME = "REPLICATION_SUBSCRIPTION_NAME";
  public static final String PUBLISHER_HOST = "REPLICATION_PUBLISHER_HOST";
  public static final String PUBLISHER_PORT = "REPLICATION_PUBLISHER_PORT";
  public static final String CONNECT_TIMEOUT_SECONDS = "REPLICATION_CONNECT_TIMEOUT_SECONDS";
  public static final String QUERY_TIMEOUT_SECONDS = "REPLICATION_QUERY_TIMEOUT_SECONDS";

  public static final String DEFAULT_PRIMARY_DB = "products";
  public static final String DEFAULT_REPLICA_DB = "sales";

  /** Variables without which no run is attempted. */
  public static final List<String> REQUIRED = List.of(
      PRIMARY_HOST, PRIMARY_USER, PRIMARY_PASSWORD, PRIMARY_SERVER_NAME,
      REPLICA_HOST, REPLICA_USER, REPLICA_PASSWORD, REPLICA_SERVER_NAME);

  private final Map<String, String> variables;

  public EnvironmentConfigSource(Map<String, String> variables) {
    this.variables = Map.copyOf(Objects.requireNonNull(variables, "variables"));
  }

  /**
   * Combines the given {@code .env} file (if it exists) with {@link System#getenv()}.
   */
  public static EnvironmentConfigSource fromSystem(Path envFile) {
    return merged(envFile, System.getenv());
  }

  /**
   * Combines the given {@code .env} file (if it exists) with an explicit environment map; the
   * map wins on conflicts.
   */
  public static EnvironmentConfigSource merged(Path envFile, Map<String, String> environment) {
    Map<String, String> merged = new HashMap<>();
    if (envFile != null && Files.isRegularFile(envFile)) {
      merged.putAll(DotEnvFile.read(envFile));
    } else {
      logger.warning(".env file not found" + (envFile != null ? " at " + envFile : "")
          + ". Using environment variables.");
    }
    merged.putAll(environment);
    return new EnvironmentConfigSource(merged);
  }

  @Override
  public SetupConfig load() {
    List<String> missing = new ArrayList<>();
    for (String name : REQUIRED) {
      if (get(name) == null) {
        missing.add(name);
      }
    }
    if (!missing.isEmpty()) {
      throw ConfigurationException.missing(missing);
    }

    SslMode sslMode = sslMode();
    Endpoint primary = endpoint(PRIMARY_HOST, PRIMARY_PORT, PRIMARY_USER, PRIMARY_PASSWORD,
        PRIMARY_DB, DEFAULT_PRIMARY_DB, sslMode);
    Endpoint replica = endpoint(REPLICA_HOST, REPLICA_PORT, REPLICA_USER, REPLICA_PASSWORD,
        REPLICA_DB, DEFAULT_REPLICA_DB, sslMode);

    SetupConfig.Builder builder = SetupConfig.builder()
        .primary(primary)
        .replica(replica)
        .primaryServerName(get(PRIMARY_SERVER_NAME))
        .replicaServerName(get(REPLICA_SERVER_NAME))
        .publicationName(getOrDefault(PUBLICATION_NAME, SetupConfig.DEFAULT_PUBLICATION_NAME))
        .subscriptionName(getOrDefault(SUBSCRIPTION_NAME, SetupConfig.DEFAULT_SUBSCRIPTION_NAME))
        .connectTimeout(seconds(CONNECT_TIMEOUT_SECONDS, SetupConfig.DEFAULT_CONNECT_TIMEOUT))
        .queryTimeout(seconds(QUERY_TIMEOUT_SECONDS, SetupConfig.DEFAULT_QUERY_TIMEOUT));

    String publisherHost = get(PUBLISHER_HOST);
    String publisherPort = get(PUBLISHER_PORT);
    if (publisherHost != null || publisherPort != null) {
      try {
        builder.publisher(primary.withAddress(
            publisherHost != null ? publisherHost : primary.host(),
            publisherPort != null ? port(PUBLISHER_PORT, publisherPort) : primary.port()));
      } catch (IllegalArgumentException e) {
        throw new ConfigurationException("Invalid publisher address: " + e.getMessage(), e);
      }
    }
    return builder.build();
  }

  private Endpoint endpoint(String host, String port, String user, String password, String db,
      String defaultDb, SslMode sslMode) {
    String portValue = get(port);
    try {
      return Endpoint.builder()
          .host(get(host))
          .port(portValue == null ? Endpoint.DEFAULT_PORT : port(port, portValue))
          .user(get(user))
          .password(get(password))
          .database(getOrDefault(db, defaultDb))
          .sslMode(sslMode)
          .build();
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid endpoint settings for " + host + ": " + e.getMessage(), e);
    }
  }

  private SslMode sslMode() {
    String value = get(SSL_MODE);
    if (value == null) {
      return SslMode.REQUIRE;
    }
    try {
      return SslMode.parse(value);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(SSL_MODE + ": " + e.getMessage(), e);
    }
  }

  private Duration seconds(String name, Duration defaultValue) {
    String value = get(name);
    if (value == null) {
      return defaultValue;
    }
    try {
      long seconds = Long.parseLong(value.trim());
      if (seconds <= 0) {
        throw new ConfigurationException(name + " must be > 0, was " + value);
      }
      return Duration.ofSeconds(seconds);
    } catch (NumberFormatException e) {
      throw new ConfigurationException(name + " is not a number: " + value, e);
    }
  }

  private static int port(String name, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException(name + " is not a port number: " + value, e);
    }
  }

  private String get(String name) {
    String value = variables.get(name);
    return value == null || value.isBlank() ? null : value;
  }

  private String getOrDefault(String name, String defaultValue) {
    String value = get(name);
    return value == null ? defaultValue : value;
  }
}
