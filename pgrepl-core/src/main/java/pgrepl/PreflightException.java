package pgrepl;

import java.util.List;

/**
 * The primary server is not configured for logical replication, or its settings could not be
 * read.
 */
public final class PreflightException extends ReplicationSetupException {
  private final List<String> remediation;

  public PreflightException(String message, List<String> remediation) {
    super(message);
    this.remediation = List.copyOf(remediation);
  }

  public PreflightException(String message, Throwable cause) {
    super(message, cause);
    this.remediation = List.of();
  }

  @Override
  public List<String> remediation() {
    return remediation;
  }
}
