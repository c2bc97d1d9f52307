package pgrepl;

/**
 * Replication objects this library creates.
 */
public enum ResourceKind {
  PUBLICATION("publication"),
  SUBSCRIPTION("subscription");

  private final String label;

  ResourceKind(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
