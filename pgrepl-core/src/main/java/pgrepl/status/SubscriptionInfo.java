package pgrepl.status;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One row of {@code pg_subscription} as shown to operators.
 *
 * @param name     subscription name
 * @param enabled  {@code subenabled}
 * @param connInfo {@code subconninfo} with any password masked
 */
public record SubscriptionInfo(String name, boolean enabled, String connInfo) {
  private static final Pattern PASSWORD = Pattern.compile("(password\\s*=\\s*)('(?:[^'\\\\]|\\\\.)*'|\\S+)");

  public SubscriptionInfo {
    Objects.requireNonNull(name, "name");
    connInfo = maskPassword(connInfo);
  }

  /**
   * Replaces the value of a {@code password=} key in a conninfo string with {@code ****}.
   */
  public static String maskPassword(String connInfo) {
    if (connInfo == null) {
      return null;
    }
    return PASSWORD.matcher(connInfo).replaceAll("$1****");
  }
}
