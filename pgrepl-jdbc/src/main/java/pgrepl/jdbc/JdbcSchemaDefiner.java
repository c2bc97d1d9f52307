package pgrepl.jdbc;

import pgrepl.spi.SchemaDefiner;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * {@link SchemaDefiner} for the {@code products} and {@code orders} tables that the
 * publication carries. The DDL is portable between PostgreSQL and H2 in PostgreSQL mode.
 *
 * <p>Tables are created in dependency order and dropped in reverse, so {@code orders} (which
 * references {@code products}) goes first.
 */
public final class JdbcSchemaDefiner implements SchemaDefiner {
  public static final String PRODUCTS = "products";
  public static final String ORDERS = "orders";

  private static final List<String> TABLES = List.of(PRODUCTS, ORDERS);

  private static final String CREATE_PRODUCTS = "CREATE TABLE IF NOT EXISTS products ("
      + "id INTEGER GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
      + "name VARCHAR(100) NOT NULL, "
      + "category VARCHAR(50) NOT NULL, "
      + "price DOUBLE PRECISION NOT NULL, "
      + "in_stock BOOLEAN NOT NULL DEFAULT TRUE, "
      + "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)";

  private static final String CREATE_ORDERS = "CREATE TABLE IF NOT EXISTS orders ("
      + "id INTEGER GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
      + "product_id INTEGER REFERENCES products(id), "
      + "quantity INTEGER NOT NULL, "
      + "order_date TIMESTAMP DEFAULT CURRENT_TIMESTAMP)";

  private final JdbcTemplate jdbc;

  public JdbcSchemaDefiner() {
    this(Duration.ZERO);
  }

  public JdbcSchemaDefiner(Duration queryTimeout) {
    this.jdbc = new JdbcTemplate(queryTimeout);
  }

  @Override
  public List<String> tableNames() {
    return TABLES;
  }

  @Override
  public List<String> existingTables(Connection conn) {
    Set<String> present = new HashSet<>();
    try {
      DatabaseMetaData meta = conn.getMetaData();
      try (ResultSet rs = meta.getTables(conn.getCatalog(), conn.getSchema(), "%", null)) {
        while (rs.next()) {
          present.add(rs.getString("TABLE_NAME").toLowerCase(Locale.ROOT));
        }
      }
    } catch (SQLException e) {
      throw new CatalogException("Failed to list tables", e);
    }
    List<String> existing = new ArrayList<>();
    for (String table : TABLES) {
      if (present.contains(table)) {
        existing.add(table);
      }
    }
    return existing;
  }

  @Override
  public void createTables(Connection conn) {
    jdbc.execute(conn, CREATE_PRODUCTS);
    jdbc.execute(conn, CREATE_ORDERS);
  }

  @Override
  public void dropTables(Connection conn) {
    jdbc.execute(conn, "DROP TABLE IF EXISTS " + ORDERS);
    jdbc.execute(conn, "DROP TABLE IF EXISTS " + PRODUCTS);
  }
}
