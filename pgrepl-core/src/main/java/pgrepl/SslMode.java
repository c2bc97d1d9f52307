package pgrepl;

import java.util.Locale;

/**
 * libpq {@code sslmode} values.
 */
public enum SslMode {
  DISABLE("disable"),
  ALLOW("allow"),
  PREFER("prefer"),
  REQUIRE("require"),
  VERIFY_CA("verify-ca"),
  VERIFY_FULL("verify-full");

  private final String value;

  SslMode(String value) {
    this.value = value;
  }

  /** The spelling used in connection strings and driver properties. */
  public String value() {
    return value;
  }

  /**
   * Parses a libpq spelling, case-insensitively. Underscores are accepted in place of dashes.
   *
   * @throws IllegalArgumentException if the value is not a known mode
   */
  public static SslMode parse(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("sslmode must not be empty");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    for (SslMode mode : values()) {
      if (mode.value.equals(normalized)) {
        return mode;
      }
    }
    throw new IllegalArgumentException("Unknown sslmode: " + value);
  }

  @Override
  public String toString() {
    return value;
  }
}
