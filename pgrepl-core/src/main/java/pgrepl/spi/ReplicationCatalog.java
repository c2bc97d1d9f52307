package pgrepl.spi;

import pgrepl.status.RelationSyncState;
import pgrepl.status.SubscriptionInfo;

import java.sql.Connection;
import java.time.Duration;
import java.util.List;

/**
 * Administrative SQL surface of a replication-capable database.
 *
 * <p>Implementations issue one statement per call on the connection they are given and never
 * change its transaction mode; callers decide commit and auto-commit behaviour. Failures are
 * reported as unchecked exceptions (the JDBC implementation wraps {@link java.sql.SQLException}).
 *
 * @see pgrepl.publication.PublicationManager
 * @see pgrepl.subscription.SubscriptionManager
 */
public interface ReplicationCatalog {

  /**
   * Reads a server setting ({@code SHOW <name>}).
   *
   * @param name setting name, e.g. {@code wal_level}
   * @return the setting's textual value
   */
  String showSetting(Connection conn, String name);

  /**
   * @return {@code true} if a publication with this name exists on the connected server
   */
  boolean publicationExists(Connection conn, String publicationName);

  /**
   * Issues {@code CREATE PUBLICATION <name> FOR ALL TABLES}.
   */
  void createPublication(Connection conn, String publicationName);

  /**
   * @return {@code true} if a subscription with this name exists on the connected server
   */
  boolean subscriptionExists(Connection conn, String subscriptionName);

  /**
   * Issues {@code CREATE SUBSCRIPTION <name> CONNECTION '<conninfo>' PUBLICATION <publication>}.
   * Must be called on a connection in auto-commit mode.
   */
  void createSubscription(Connection conn, String subscriptionName, String connInfo, String publicationName);

  /**
   * Lists all subscriptions on the connected server.
   */
  List<SubscriptionInfo> listSubscriptions(Connection conn);

  /**
   * Lists per-relation sync states of all subscriptions, at most {@code limit} rows.
   */
  List<RelationSyncState> listRelationStates(Connection conn, int limit);

  /**
   * Returns a catalog that bounds every statement by the given timeout. The default returns
   * this instance unchanged.
   */
  default ReplicationCatalog withQueryTimeout(Duration queryTimeout) {
    return this;
  }
}
