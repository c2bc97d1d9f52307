package pgrepl.subscription;

import pgrepl.Endpoint;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * libpq keyword/value connection string the replica uses to reach the primary, e.g.
 * {@code host=db.example.com dbname=products user=app password=secret sslmode=require}.
 *
 * <p>Values that are empty or contain whitespace, quotes or backslashes are single-quoted with
 * backslash escapes. {@link #toString()} masks the password; {@link #render()} does not.
 */
public final class ConnInfo {
  private final Map<String, String> params;

  private ConnInfo(Map<String, String> params) {
    this.params = params;
  }

  public static ConnInfo of(Endpoint endpoint) {
    Objects.requireNonNull(endpoint, "endpoint");
    Map<String, String> params = new LinkedHashMap<>();
    params.put("host", endpoint.host());
    if (endpoint.port() != Endpoint.DEFAULT_PORT) {
      params.put("port", Integer.toString(endpoint.port()));
    }
    params.put("dbname", endpoint.database());
    params.put("user", endpoint.user());
    params.put("password", endpoint.password());
    params.put("sslmode", endpoint.sslMode().value());
    return new ConnInfo(params);
  }

  public String host() {
    return params.get("host");
  }

  /** The full connection string, password included. */
  public String render() {
    return render(false);
  }

  @Override
  public String toString() {
    return render(true);
  }

  private String render(boolean maskPassword) {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, String> e : params.entrySet()) {
      if (sb.length() > 0) {
        sb.append(' ');
      }
      String value = maskPassword && e.getKey().equals("password") ? "****" : e.getValue();
      sb.append(e.getKey()).append('=').append(quote(value));
    }
    return sb.toString();
  }

  static String quote(String value) {
    boolean needsQuotes = value.isEmpty();
    for (int i = 0; i < value.length() && !needsQuotes; i++) {
      char c = value.charAt(i);
      needsQuotes = Character.isWhitespace(c) || c == '\'' || c == '\\';
    }
    if (!needsQuotes) {
      return value;
    }
    StringBuilder sb = new StringBuilder(value.length() + 2).append('\'');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == '\'' || c == '\\') {
        sb.append('\\');
      }
      sb.append(c);
    }
    return sb.append('\'').toString();
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof ConnInfo other && params.equals(other.params));
  }

  @Override
  public int hashCode() {
    return params.hashCode();
  }
}
