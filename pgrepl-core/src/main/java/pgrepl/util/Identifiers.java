package pgrepl.util;

import java.util.Objects;

/**
 * Validation for names interpolated into replication DDL, which cannot be bound as parameters.
 *
 * <p>Only lowercase names are accepted. PostgreSQL folds unquoted identifiers to lowercase, so
 * a mixed-case name would be stored differently from the name later looked up in the catalog.
 */
public final class Identifiers {
  public static final int MAX_LENGTH = 63;
  private static final String IDENTIFIER_PATTERN = "[a-z_][a-z0-9_]*";

  private Identifiers() {}

  public static String validate(String name) {
    Objects.requireNonNull(name, "name");
    if (!name.matches(IDENTIFIER_PATTERN)) {
      throw new IllegalArgumentException("Invalid identifier (lowercase letters, digits and '_' only): " + name);
    }
    if (name.length() > MAX_LENGTH) {
      throw new IllegalArgumentException("Identifier longer than " + MAX_LENGTH + " characters: " + name);
    }
    return name;
  }
}
