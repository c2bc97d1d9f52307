/**
 * Service provider interfaces: connection opening, the administrative catalog, the schema
 * definer and metrics export.
 *
 * <p>{@code pgrepl-jdbc} supplies the PostgreSQL implementations; {@code pgrepl-micrometer}
 * supplies a Micrometer {@link pgrepl.spi.MetricsExporter}.
 */
package pgrepl.spi;
