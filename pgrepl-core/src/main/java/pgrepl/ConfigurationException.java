package pgrepl;

import java.util.List;

/**
 * A required parameter is absent or a supplied one is malformed. Raised before any
 * connection attempt.
 */
public final class ConfigurationException extends ReplicationSetupException {
  private final List<String> missing;

  public ConfigurationException(String message) {
    super(message);
    this.missing = List.of();
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
    this.missing = List.of();
  }

  private ConfigurationException(String message, List<String> missing) {
    super(message);
    this.missing = List.copyOf(missing);
  }

  public static ConfigurationException missing(List<String> names) {
    return new ConfigurationException(
        "Missing required environment variables: " + String.join(", ", names), names);
  }

  /** Names of the absent parameters, if this exception reports missing ones. */
  public List<String> missingParameters() {
    return missing;
  }

  @Override
  public List<String> remediation() {
    if (missing.isEmpty()) {
      return List.of();
    }
    return List.of("Create a .env file or export the variables listed above with your PostgreSQL credentials.");
  }
}
