package pgrepl.publication;

import pgrepl.ResourceCreationException;
import pgrepl.ResourceKind;
import pgrepl.spi.ReplicationCatalog;
import pgrepl.util.Identifiers;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ensures a named all-tables publication exists on the primary.
 *
 * <p>Idempotent: an existing publication with the same name is returned as-is and never
 * altered. Creation runs in its own transaction and is committed before returning.
 */
public final class PublicationManager {
  private static final Logger logger = Logger.getLogger(PublicationManager.class.getName());

  private final ReplicationCatalog catalog;

  public PublicationManager(ReplicationCatalog catalog) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
  }

  /**
   * @throws ResourceCreationException if the lookup or the creation fails
   */
  public Publication ensure(Connection primary, String publicationName) {
    Identifiers.validate(publicationName);
    boolean exists;
    try {
      exists = catalog.publicationExists(primary, publicationName);
    } catch (RuntimeException e) {
      throw new ResourceCreationException(ResourceKind.PUBLICATION, publicationName, e);
    }
    if (exists) {
      logger.info("Publication '" + publicationName + "' already exists.");
      return Publication.existing(publicationName);
    }

    create(primary, publicationName);
    logger.info("Successfully created publication '" + publicationName + "'");
    return Publication.created(publicationName);
  }

  private void create(Connection primary, String publicationName) {
    boolean autoCommit;
    try {
      autoCommit = primary.getAutoCommit();
      primary.setAutoCommit(false);
    } catch (SQLException e) {
      throw new ResourceCreationException(ResourceKind.PUBLICATION, publicationName, e);
    }
    try {
      catalog.createPublication(primary, publicationName);
      primary.commit();
    } catch (SQLException | RuntimeException e) {
      ResourceCreationException failure =
          new ResourceCreationException(ResourceKind.PUBLICATION, publicationName, e);
      try {
        primary.rollback();
      } catch (SQLException rollbackFailure) {
        failure.addSuppressed(rollbackFailure);
      }
      throw failure;
    } finally {
      restoreAutoCommit(primary, autoCommit);
    }
  }

  private static void restoreAutoCommit(Connection conn, boolean autoCommit) {
    try {
      conn.setAutoCommit(autoCommit);
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Failed to restore auto-commit mode", e);
    }
  }
}
