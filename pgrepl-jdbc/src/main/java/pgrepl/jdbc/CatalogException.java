package pgrepl.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by {@link JdbcTemplate},
 * {@link PostgresReplicationCatalog} and {@link JdbcSchemaDefiner}.
 */
public final class CatalogException extends RuntimeException {
  public CatalogException(String message, Throwable cause) {
    super(message, cause);
  }
}
