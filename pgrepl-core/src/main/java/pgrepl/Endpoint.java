package pgrepl;

import java.util.Objects;

/**
 * Immutable connection parameters for one PostgreSQL database.
 *
 * <p>{@link #toString()} never renders the password.
 */
public final class Endpoint {
  public static final int DEFAULT_PORT = 5432;

  private final String host;
  private final int port;
  private final String user;
  private final String password;
  private final String database;
  private final SslMode sslMode;

  private Endpoint(Builder builder) {
    this.host = requireText(builder.host, "host");
    this.user = requireText(builder.user, "user");
    this.password = Objects.requireNonNull(builder.password, "password");
    this.database = requireText(builder.database, "database");
    this.sslMode = builder.sslMode == null ? SslMode.REQUIRE : builder.sslMode;
    if (builder.port <= 0 || builder.port > 65535) {
      throw new IllegalArgumentException("port must be in 1..65535, was " + builder.port);
    }
    this.port = builder.port;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String host() {
    return host;
  }

  public int port() {
    return port;
  }

  public String user() {
    return user;
  }

  public String password() {
    return password;
  }

  public String database() {
    return database;
  }

  public SslMode sslMode() {
    return sslMode;
  }

  /**
   * Returns a copy of this endpoint addressed at another host and port, keeping database,
   * credentials and SSL mode.
   */
  public Endpoint withAddress(String host, int port) {
    return toBuilder().host(host).port(port).build();
  }

  public Builder toBuilder() {
    return new Builder()
        .host(host)
        .port(port)
        .user(user)
        .password(password)
        .database(database)
        .sslMode(sslMode);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Endpoint other)) return false;
    return port == other.port
        && host.equals(other.host)
        && user.equals(other.user)
        && password.equals(other.password)
        && database.equals(other.database)
        && sslMode == other.sslMode;
  }

  @Override
  public int hashCode() {
    return Objects.hash(host, port, user, password, database, sslMode);
  }

  @Override
  public String toString() {
    return "Endpoint{" + user + "@" + host + ":" + port + "/" + database + ", sslmode=" + sslMode + "}";
  }

  private static String requireText(String value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isBlank()) {
      throw new IllegalArgumentException(name + " cannot be empty");
    }
    return value;
  }

  public static final class Builder {
    private String host;
    private int port = DEFAULT_PORT;
    private String user;
    private String password;
    private String database;
    private SslMode sslMode;

    private Builder() {
    }

    public Builder host(String host) {
      this.host = host;
      return this;
    }

    public Builder port(int port) {
      this.port = port;
      return this;
    }

    public Builder user(String user) {
      this.user = user;
      return this;
    }

    public Builder password(String password) {
      this.password = password;
      return this;
    }

    public Builder database(String database) {
      this.database = database;
      return this;
    }

    public Builder sslMode(SslMode sslMode) {
      this.sslMode = sslMode;
      return this;
    }

    public Endpoint build() {
      return new Endpoint(this);
    }
  }
}
