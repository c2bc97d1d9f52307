package pgrepl.schema;

import pgrepl.Endpoint;
import pgrepl.connect.EndpointConnector;
import pgrepl.spi.SchemaDefiner;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Prepares the application tables on a primary or replica before replication is set up.
 *
 * <p>When some managed tables already exist, the injected {@link RecreateDecision} decides
 * between dropping and recreating them and keeping them as they are.
 */
public final class SchemaInitializer {
  private static final Logger logger = Logger.getLogger(SchemaInitializer.class.getName());

  /** What {@link #prepare} did. */
  public enum Outcome {
    CREATED,
    RECREATED,
    KEPT_EXISTING
  }

  private final SchemaDefiner definer;
  private final RecreateDecision decision;

  public SchemaInitializer(SchemaDefiner definer, RecreateDecision decision) {
    this.definer = Objects.requireNonNull(definer, "definer");
    this.decision = Objects.requireNonNull(decision, "decision");
  }

  /**
   * Prepares the tables over an already opened connection.
   */
  public Outcome prepare(Connection conn, String database) {
    List<String> existing = definer.existingTables(conn);
    if (!existing.isEmpty()) {
      logger.info("Tables already exist in the " + database + " database: " + existing);
      if (!decision.shouldRecreate(database, existing)) {
        logger.info("Using existing tables.");
        return Outcome.KEPT_EXISTING;
      }
      definer.dropTables(conn);
      logger.info("Tables dropped successfully!");
      definer.createTables(conn);
      logger.info("Tables created successfully!");
      return Outcome.RECREATED;
    }
    definer.createTables(conn);
    logger.info("Tables created successfully!");
    return Outcome.CREATED;
  }

  /**
   * Connects to the endpoint, prepares the tables and closes the connection.
   *
   * @throws pgrepl.ConnectivityException if the endpoint cannot be reached
   */
  public Outcome prepare(EndpointConnector connector, Endpoint endpoint, String database) {
    Connection conn = connector.connect(endpoint, database);
    try {
      return prepare(conn, database);
    } finally {
      try {
        conn.close();
      } catch (SQLException e) {
        logger.log(Level.WARNING, "Failed to close " + database + " connection", e);
      }
    }
  }
}
