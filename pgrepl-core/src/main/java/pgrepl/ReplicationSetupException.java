package pgrepl;

import java.util.List;

/**
 * Base type for the fatal and recoverable failures of a replication setup run.
 *
 * <p>Stage components throw subclasses; only {@link ReplicationSetup} turns them into a
 * {@link SetupResult}.
 */
public abstract class ReplicationSetupException extends RuntimeException {

  protected ReplicationSetupException(String message) {
    super(message);
  }

  protected ReplicationSetupException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Operator-facing steps that fix the failure. Empty when there is nothing beyond the message.
   */
  public List<String> remediation() {
    return List.of();
  }
}
