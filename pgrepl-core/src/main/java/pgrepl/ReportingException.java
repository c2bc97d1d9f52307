package pgrepl;

/**
 * Status queries failed. Always recovered locally; never changes the outcome of a run.
 */
public final class ReportingException extends ReplicationSetupException {

  public ReportingException(String message, Throwable cause) {
    super(message, cause);
  }
}
