package pgrepl;

import java.util.Objects;

/**
 * Creating a publication or subscription failed. Earlier stages are not undone; re-running the
 * setup is the recovery path.
 */
public final class ResourceCreationException extends ReplicationSetupException {
  private final ResourceKind kind;
  private final String resourceName;

  public ResourceCreationException(ResourceKind kind, String resourceName, Throwable cause) {
    super("Error creating " + Objects.requireNonNull(kind, "kind").label() + " '" + resourceName + "'"
        + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
    this.kind = kind;
    this.resourceName = resourceName;
  }

  public ResourceKind kind() {
    return kind;
  }

  public String resourceName() {
    return resourceName;
  }
}
