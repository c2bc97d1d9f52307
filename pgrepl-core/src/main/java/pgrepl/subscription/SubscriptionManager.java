package pgrepl.subscription;

import pgrepl.Endpoint;
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
 * Ensures a named subscription exists on the replica, bound to the primary's publication.
 *
 * <p>{@code CREATE SUBSCRIPTION} cannot run inside a transaction block, so the replica
 * connection is switched to auto-commit for the whole call and restored afterwards. The initial
 * table copy starts asynchronously on the replica; this class does not wait for it.
 */
public final class SubscriptionManager {
  private static final Logger logger = Logger.getLogger(SubscriptionManager.class.getName());

  private final ReplicationCatalog catalog;

  public SubscriptionManager(ReplicationCatalog catalog) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
  }

  /**
   * @param replica          connection to the replica
   * @param publicationName  publication on the primary to bind to
   * @param publisher        the primary as reachable from the replica
   * @param subscriptionName subscription to ensure
   * @throws ResourceCreationException if the lookup or the creation fails
   */
  public Subscription ensure(Connection replica, String publicationName, Endpoint publisher,
      String subscriptionName) {
    Identifiers.validate(publicationName);
    Identifiers.validate(subscriptionName);
    ConnInfo connInfo = ConnInfo.of(publisher);

    boolean autoCommit;
    try {
      autoCommit = replica.getAutoCommit();
      replica.setAutoCommit(true);
    } catch (SQLException e) {
      throw new ResourceCreationException(ResourceKind.SUBSCRIPTION, subscriptionName, e);
    }
    try {
      if (catalog.subscriptionExists(replica, subscriptionName)) {
        logger.info("Subscription '" + subscriptionName + "' already exists.");
        return new Subscription(subscriptionName, publicationName, connInfo, true, false);
      }
      catalog.createSubscription(replica, subscriptionName, connInfo.render(), publicationName);
      logger.info("Successfully created subscription '" + subscriptionName + "' for publication '"
          + publicationName + "' on " + connInfo.host());
      return new Subscription(subscriptionName, publicationName, connInfo, true, true);
    } catch (RuntimeException e) {
      throw new ResourceCreationException(ResourceKind.SUBSCRIPTION, subscriptionName, e);
    } finally {
      restoreAutoCommit(replica, autoCommit);
    }
  }

  private static void restoreAutoCommit(Connection conn, boolean autoCommit) {
    if (autoCommit) {
      return;
    }
    try {
      conn.setAutoCommit(false);
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Failed to restore auto-commit mode", e);
    }
  }
}
