/**
 * Plain-JDBC implementations of the core SPIs for PostgreSQL.
 *
 * <p>{@link pgrepl.jdbc.PostgresReplicationCatalog} issues the administrative statements,
 * {@link pgrepl.jdbc.DriverManagerConnectionProvider} and
 * {@link pgrepl.jdbc.DataSourceConnectionProvider} open connections, and
 * {@link pgrepl.jdbc.JdbcSchemaDefiner} manages the replicated application tables.
 * {@link pgrepl.jdbc.JdbcTemplate} provides the shared statement helpers; every SQL failure
 * surfaces as {@link pgrepl.jdbc.CatalogException}.
 *
 * @see pgrepl.spi.ReplicationCatalog
 */
package pgrepl.jdbc;
