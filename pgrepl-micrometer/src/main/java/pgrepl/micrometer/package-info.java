/**
 * Micrometer bridge for replication setup metrics.
 *
 * <p>Pass a {@link pgrepl.micrometer.MicrometerMetricsExporter} to
 * {@link pgrepl.ReplicationSetup.Builder#metrics} to publish stage timings, run outcomes and
 * resource counts to any Micrometer registry.
 */
package pgrepl.micrometer;
