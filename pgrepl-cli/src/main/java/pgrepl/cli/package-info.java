/**
 * picocli command line for replication setup.
 *
 * <p>{@code pgrepl schema} creates the application tables, {@code pgrepl setup} (the default)
 * runs the replication setup against the endpoints configured through the environment or a
 * {@code .env} file.
 */
package pgrepl.cli;
