package pgrepl.status;

import pgrepl.ReportingException;
import pgrepl.spi.ReplicationCatalog;

import java.sql.Connection;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads subscription and per-relation sync state from the replica for diagnostics.
 *
 * <p>Never throws: query failures are logged and returned as
 * {@link StatusReport#unavailable(ReportingException)}.
 */
public final class StatusReporter {
  private static final Logger logger = Logger.getLogger(StatusReporter.class.getName());

  private final ReplicationCatalog catalog;
  private final int rowLimit;

  public StatusReporter(ReplicationCatalog catalog, int rowLimit) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    if (rowLimit <= 0) {
      throw new IllegalArgumentException("rowLimit must be > 0");
    }
    this.rowLimit = rowLimit;
  }

  public StatusReport report(Connection replica) {
    try {
      List<SubscriptionInfo> subscriptions = catalog.listSubscriptions(replica);
      if (subscriptions.isEmpty()) {
        logger.info("No subscriptions found.");
        return StatusReport.noSubscriptions();
      }
      List<RelationSyncState> relations = catalog.listRelationStates(replica, rowLimit);
      if (relations.size() > rowLimit) {
        relations = relations.subList(0, rowLimit);
      }
      return StatusReport.of(subscriptions, relations);
    } catch (RuntimeException e) {
      ReportingException failure = new ReportingException("Error checking replication status", e);
      logger.log(Level.WARNING, failure.getMessage(), e);
      return StatusReport.unavailable(failure);
    }
  }
}
