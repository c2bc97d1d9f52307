package pgrepl.preflight;

import java.util.Locale;

/**
 * Server {@code wal_level} setting.
 */
public enum WalLevel {
  MINIMAL,
  REPLICA,
  LOGICAL;

  /**
   * Parses a {@code SHOW wal_level} value. The pre-9.6 names {@code archive} and
   * {@code hot_standby} read as {@link #REPLICA}.
   *
   * @throws IllegalArgumentException for any other value
   */
  public static WalLevel parse(String value) {
    if (value == null) {
      throw new IllegalArgumentException("wal_level is null");
    }
    switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "minimal":
        return MINIMAL;
      case "replica":
      case "archive":
      case "hot_standby":
        return REPLICA;
      case "logical":
        return LOGICAL;
      default:
        throw new IllegalArgumentException("Unknown wal_level: " + value);
    }
  }

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
