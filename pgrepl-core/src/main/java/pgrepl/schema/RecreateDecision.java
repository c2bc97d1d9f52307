package pgrepl.schema;

import java.util.List;

/**
 * Decides whether existing application tables may be dropped and recreated.
 */
@FunctionalInterface
public interface RecreateDecision {

  /**
   * @param database       label of the database being prepared
   * @param existingTables managed tables that already exist there
   * @return {@code true} to drop and recreate, {@code false} to keep the existing tables
   */
  boolean shouldRecreate(String database, List<String> existingTables);

  static RecreateDecision always() {
    return (database, existingTables) -> true;
  }

  static RecreateDecision never() {
    return (database, existingTables) -> false;
  }
}
