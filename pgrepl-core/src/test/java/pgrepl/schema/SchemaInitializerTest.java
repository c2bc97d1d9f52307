package pgrepl.schema;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import pgrepl.spi.SchemaDefiner;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class SchemaInitializerTest {
  private Connection conn;
  private StubDefiner definer;

  @BeforeEach
  void setUp() throws SQLException {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:schema_init;DB_CLOSE_DELAY=-1");
    conn = ds.getConnection();
    definer = new StubDefiner();
  }

  @AfterEach
  void tearDown() throws SQLException {
    conn.close();
  }

  @Test
  void createsWhenNothingExists() {
    SchemaInitializer initializer = new SchemaInitializer(definer, (db, tables) -> {
      throw new AssertionError("decision must not be consulted");
    });

    assertEquals(SchemaInitializer.Outcome.CREATED, initializer.prepare(conn, "primary"));
    assertEquals(List.of("create"), definer.calls);
  }

  @Test
  void recreatesWhenDecisionAgrees() {
    definer.existing.addAll(List.of("products", "orders"));
    AtomicReference<List<String>> asked = new AtomicReference<>();
    SchemaInitializer initializer = new SchemaInitializer(definer, (db, tables) -> {
      asked.set(tables);
      return true;
    });

    assertEquals(SchemaInitializer.Outcome.RECREATED, initializer.prepare(conn, "primary"));
    assertEquals(List.of("products", "orders"), asked.get());
    assertEquals(List.of("drop", "create"), definer.calls);
  }

  @Test
  void keepsExistingWhenDeclined() {
    definer.existing.add("products");
    SchemaInitializer initializer = new SchemaInitializer(definer, RecreateDecision.never());

    assertEquals(SchemaInitializer.Outcome.KEPT_EXISTING, initializer.prepare(conn, "replica"));
    assertTrue(definer.calls.isEmpty());
  }

  @Test
  void alwaysDecisionRecreates() {
    definer.existing.add("orders");

    assertEquals(SchemaInitializer.Outcome.RECREATED,
        new SchemaInitializer(definer, RecreateDecision.always()).prepare(conn, "replica"));
  }

  private static final class StubDefiner implements SchemaDefiner {
    final List<String> existing = new ArrayList<>();
    final List<String> calls = new ArrayList<>();

    @Override
    public List<String> tableNames() {
      return List.of("products", "orders");
    }

    @Override
    public List<String> existingTables(Connection conn) {
      return List.copyOf(existing);
    }

    @Override
    public void createTables(Connection conn) {
      calls.add("create");
    }

    @Override
    public void dropTables(Connection conn) {
      calls.add("drop");
    }
  }
}
