/**
 * Idempotent PostgreSQL logical-replication setup between a primary and a replica.
 *
 * <h2>Core Design</h2>
 * <p>{@link pgrepl.ReplicationSetup} drives a fixed sequence of stages. It connects to the
 * primary, checks that {@code wal_level} is {@code logical}, and ensures an all-tables
 * publication. It then connects to the replica, ensures a subscription bound to that
 * publication, and reads the sync status. Each stage gates the next. Creation stages detect
 * existing objects by name, so a run can be repeated safely.
 *
 * <p>Stage components live in {@link pgrepl.preflight}, {@link pgrepl.publication},
 * {@link pgrepl.subscription} and {@link pgrepl.status}; they issue SQL only through the
 * {@link pgrepl.spi.ReplicationCatalog} SPI.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>pgrepl-core</b>: stages, orchestrator, configuration, SPI (zero external deps)</li>
 *   <li><b>pgrepl-jdbc</b>: PostgreSQL catalog, connection providers, schema definer</li>
 *   <li><b>pgrepl-micrometer</b>: Micrometer {@link pgrepl.spi.MetricsExporter}</li>
 *   <li><b>pgrepl-cli</b>: command-line entry point and exit codes</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * SetupResult result = ReplicationSetup.builder()
 *     .configSource(EnvironmentConfigSource.fromSystem(Path.of(".env")))
 *     .connectionProvider(new DriverManagerConnectionProvider())
 *     .catalog(new PostgresReplicationCatalog())
 *     .build()
 *     .run();
 * result.describe().forEach(System.out::println);
 * }</pre>
 *
 * @see pgrepl.ReplicationSetup
 * @see pgrepl.SetupConfig
 * @see pgrepl.SetupResult
 */
package pgrepl;
