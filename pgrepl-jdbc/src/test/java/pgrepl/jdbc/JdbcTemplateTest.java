package pgrepl.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTemplateTest {
  private Connection conn;
  private final JdbcTemplate jdbc = new JdbcTemplate(Duration.ofSeconds(5));

  @BeforeEach
  void setUp() throws SQLException {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:template_test;MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
    conn = ds.getConnection();
    jdbc.execute(conn, "CREATE TABLE IF NOT EXISTS settings (name VARCHAR(64) PRIMARY KEY, setting VARCHAR(64))");
    jdbc.execute(conn, "DELETE FROM settings");
  }

  @AfterEach
  void tearDown() throws SQLException {
    conn.close();
  }

  @Test
  void executeReturnsAffectedRows() {
    assertEquals(1, jdbc.execute(conn, "INSERT INTO settings VALUES (?, ?)", "wal_level", "logical"));
    assertEquals(1, jdbc.execute(conn, "UPDATE settings SET setting = ? WHERE name = ?", "replica", "wal_level"));
  }

  @Test
  void queryMapsRowsAndBindsParameters() {
    jdbc.execute(conn, "INSERT INTO settings VALUES (?, ?)", "max_wal_senders", "10");
    jdbc.execute(conn, "INSERT INTO settings VALUES (?, ?)", "max_replication_slots", "5");

    List<String> names = jdbc.query(conn, "SELECT name FROM settings WHERE setting <> ? ORDER BY name",
        rs -> rs.getString(1), "none");

    assertEquals(List.of("max_replication_slots", "max_wal_senders"), names);
  }

  @Test
  void queryForObjectReturnsFirstRow() {
    jdbc.execute(conn, "INSERT INTO settings VALUES (?, ?)", "wal_level", "logical");

    long count = jdbc.queryForObject(conn, "SELECT COUNT(*) FROM settings WHERE name = ?",
        rs -> rs.getLong(1), "wal_level");
    assertEquals(1L, count);
  }

  @Test
  void queryForObjectWithoutRowsThrows() {
    CatalogException e = assertThrows(CatalogException.class,
        () -> jdbc.queryForObject(conn, "SELECT setting FROM settings WHERE name = ?", rs -> rs.getString(1), "x"));
    assertTrue(e.getMessage().contains("no rows"));
  }

  @Test
  void sqlErrorsAreWrappedWithoutStatementText() {
    CatalogException e = assertThrows(CatalogException.class,
        () -> jdbc.execute(conn, "CREATE SUBSCRIPTION s CONNECTION 'password=hunter2' PUBLICATION p"));

    assertInstanceOf(SQLException.class, e.getCause());
    assertEquals("Failed to execute statement: CREATE SUBSCRIPTION", e.getMessage());
  }

  @Test
  void timeoutIsRoundedUpToWholeSeconds() {
    assertEquals(2, new JdbcTemplate(Duration.ofMillis(1500)).queryTimeoutSeconds());
    assertEquals(1, new JdbcTemplate(Duration.ofMillis(1)).queryTimeoutSeconds());
    assertEquals(0, new JdbcTemplate(Duration.ZERO).queryTimeoutSeconds());
    assertThrows(IllegalArgumentException.class, () -> new JdbcTemplate(Duration.ofSeconds(-1)));
  }
}
