package pgrepl.spi;

import java.sql.Connection;
import java.util.List;

/**
 * Creates and drops the fixed set of application tables that replication carries.
 *
 * @see pgrepl.schema.SchemaInitializer
 */
public interface SchemaDefiner {

  /**
   * Names of the managed tables in creation order.
   */
  List<String> tableNames();

  /**
   * Names of the managed tables that currently exist on the connected database.
   */
  List<String> existingTables(Connection conn);

  /**
   * Creates the managed tables that do not exist yet.
   */
  void createTables(Connection conn);

  /**
   * Drops all managed tables, dependants first.
   */
  void dropTables(Connection conn);
}
