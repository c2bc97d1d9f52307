package pgrepl.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lightweight JDBC helper for administrative statements. Every statement is bounded by the
 * template's query timeout.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  private final int queryTimeoutSeconds;

  /**
   * @param queryTimeout per-statement timeout; {@link Duration#ZERO} disables it
   */
  public JdbcTemplate(Duration queryTimeout) {
    Objects.requireNonNull(queryTimeout, "queryTimeout");
    if (queryTimeout.isNegative()) {
      throw new IllegalArgumentException("queryTimeout must be >= 0");
    }
    this.queryTimeoutSeconds = queryTimeout.isZero() ? 0 : (int) Math.max(1, (queryTimeout.toMillis() + 999) / 1000);
  }

  int queryTimeoutSeconds() {
    return queryTimeoutSeconds;
  }

  /** Execute a statement that returns no rows (DDL or UPDATE), return rows affected. */
  public int execute(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = prepare(conn, sql, params)) {
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new CatalogException("Failed to execute statement: " + verb(sql), e);
    }
  }

  /** Execute SELECT, map rows. */
  public <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = prepare(conn, sql, params);
         ResultSet rs = ps.executeQuery()) {
      List<T> results = new ArrayList<>();
      while (rs.next()) {
        results.add(mapper.map(rs));
      }
      return results;
    } catch (SQLException e) {
      throw new CatalogException("Failed to execute query: " + verb(sql), e);
    }
  }

  /**
   * Execute a query expected to return exactly one row.
   *
   * @throws CatalogException if the query fails or returns no row
   */
  public <T> T queryForObject(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    List<T> rows = query(conn, sql, mapper, params);
    if (rows.isEmpty()) {
      throw new CatalogException("Query returned no rows: " + verb(sql), null);
    }
    return rows.get(0);
  }

  private PreparedStatement prepare(Connection conn, String sql, Object... params) throws SQLException {
    PreparedStatement ps = conn.prepareStatement(sql);
    try {
      if (queryTimeoutSeconds > 0) {
        ps.setQueryTimeout(queryTimeoutSeconds);
      }
      bindParams(ps, params);
      return ps;
    } catch (SQLException e) {
      ps.close();
      throw e;
    }
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  // First keyword only, so conninfo literals never reach an exception message.
  private static String verb(String sql) {
    String trimmed = sql.strip();
    int space = trimmed.indexOf(' ');
    String first = space < 0 ? trimmed : trimmed.substring(0, space);
    if (first.equalsIgnoreCase("CREATE") || first.equalsIgnoreCase("DROP")) {
      String[] words = trimmed.split("\\s+", 3);
      return words.length > 1 ? words[0] + " " + words[1] : first;
    }
    return first;
  }
}
