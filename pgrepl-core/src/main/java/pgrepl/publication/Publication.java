package pgrepl.publication;

import java.util.Objects;

/**
 * A publication on the primary after {@link PublicationManager#ensure}.
 *
 * @param name    publication name (its identity)
 * @param exists  always {@code true} once ensured
 * @param created {@code true} if this call issued the create statement
 */
public record Publication(String name, boolean exists, boolean created) {

  public Publication {
    Objects.requireNonNull(name, "name");
  }

  static Publication existing(String name) {
    return new Publication(name, true, false);
  }

  static Publication created(String name) {
    return new Publication(name, true, true);
  }
}
