package pgrepl;

/**
 * States of a setup run, in their forced order. Each state is a precondition for the next;
 * any fatal error moves the run to {@link #FAILED}.
 */
public enum SetupStage {
  START,
  PRIMARY_CONNECTED,
  PREFLIGHT_PASSED,
  PUBLICATION_READY,
  REPLICA_CONNECTED,
  SUBSCRIPTION_READY,
  STATUS_REPORTED,
  DONE,
  FAILED;

  /**
   * @return the state that follows this one on the success path
   * @throws IllegalStateException for the terminal states
   */
  public SetupStage next() {
    if (this == DONE || this == FAILED) {
      throw new IllegalStateException(this + " is terminal");
    }
    return values()[ordinal() + 1];
  }

  public boolean isTerminal() {
    return this == DONE || this == FAILED;
  }
}
