/**
 * Configuration sources for setup runs.
 *
 * <p>{@link pgrepl.config.EnvironmentConfigSource} maps the {@code AZURE_POSTGRES_*} and
 * {@code REPLICATION_*} variables, optionally seeded from a {@code .env} file, onto an immutable
 * {@link pgrepl.SetupConfig}.
 */
package pgrepl.config;
