package pgrepl;

/**
 * An endpoint cannot be reached or refuses the credentials. The message names the host only.
 */
public final class ConnectivityException extends ReplicationSetupException {
  private final String host;

  public ConnectivityException(String description, String host, Throwable cause) {
    super("Error connecting to " + description + " PostgreSQL at " + host
        + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
    this.host = host;
  }

  public String host() {
    return host;
  }
}
