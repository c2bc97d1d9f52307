package pgrepl.jdbc;

import pgrepl.spi.ReplicationCatalog;
import pgrepl.status.RelationSyncState;
import pgrepl.status.SubscriptionInfo;
import pgrepl.status.SyncState;
import pgrepl.util.Identifiers;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * {@link ReplicationCatalog} for PostgreSQL 10 and later.
 *
 * <p>Replication DDL does not accept bind parameters, so object names are validated with
 * {@link Identifiers} before they are interpolated and the conninfo string is embedded as an
 * escaped literal. Existence checks bind the name as a parameter.
 *
 * <p>The skip LSN column ({@code pg_subscription.subskiplsn}) only exists from PostgreSQL 15;
 * on older servers it is reported as {@code null}.
 */
public final class PostgresReplicationCatalog implements ReplicationCatalog {
  static final int SKIP_LSN_SINCE_MAJOR_VERSION = 15;

  private static final String SQL_PUBLICATION_EXISTS =
      "SELECT COUNT(*) FROM pg_publication WHERE pubname = ?";
  private static final String SQL_SUBSCRIPTION_EXISTS =
      "SELECT COUNT(*) FROM pg_subscription WHERE subname = ?";
  private static final String SQL_LIST_SUBSCRIPTIONS =
      "SELECT subname, subenabled, subconninfo FROM pg_subscription ORDER BY subname";
  private static final String SQL_RELATION_STATES =
      "SELECT s.subname, r.srsubstate, r.srrelid::regclass AS relation_name, r.srsublsn, %s AS skip_lsn"
          + " FROM pg_subscription_rel r"
          + " JOIN pg_subscription s ON s.oid = r.srsubid"
          + " ORDER BY s.subname, r.srrelid"
          + " LIMIT ?";

  private final JdbcTemplate jdbc;

  public PostgresReplicationCatalog() {
    this(Duration.ZERO);
  }

  public PostgresReplicationCatalog(Duration queryTimeout) {
    this.jdbc = new JdbcTemplate(queryTimeout);
  }

  @Override
  public ReplicationCatalog withQueryTimeout(Duration queryTimeout) {
    return new PostgresReplicationCatalog(queryTimeout);
  }

  @Override
  public String showSetting(Connection conn, String name) {
    return jdbc.queryForObject(conn, "SHOW " + Identifiers.validate(name), rs -> rs.getString(1));
  }

  @Override
  public boolean publicationExists(Connection conn, String publicationName) {
    return count(conn, SQL_PUBLICATION_EXISTS, publicationName) > 0;
  }

  @Override
  public void createPublication(Connection conn, String publicationName) {
    jdbc.execute(conn, "CREATE PUBLICATION " + Identifiers.validate(publicationName) + " FOR ALL TABLES");
  }

  @Override
  public boolean subscriptionExists(Connection conn, String subscriptionName) {
    return count(conn, SQL_SUBSCRIPTION_EXISTS, subscriptionName) > 0;
  }

  @Override
  public void createSubscription(Connection conn, String subscriptionName, String connInfo, String publicationName) {
    Objects.requireNonNull(connInfo, "connInfo");
    jdbc.execute(conn, "CREATE SUBSCRIPTION " + Identifiers.validate(subscriptionName)
        + " CONNECTION " + literal(connInfo)
        + " PUBLICATION " + Identifiers.validate(publicationName));
  }

  @Override
  public List<SubscriptionInfo> listSubscriptions(Connection conn) {
    return jdbc.query(conn, SQL_LIST_SUBSCRIPTIONS, rs -> new SubscriptionInfo(
        rs.getString("subname"),
        rs.getBoolean("subenabled"),
        rs.getString("subconninfo")));
  }

  @Override
  public List<RelationSyncState> listRelationStates(Connection conn, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    String skipLsn = supportsSkipLsn(conn) ? "s.subskiplsn::text" : "NULL::text";
    return jdbc.query(conn, String.format(SQL_RELATION_STATES, skipLsn), rs -> {
      String code = rs.getString("srsubstate");
      return new RelationSyncState(
          rs.getString("subname"),
          rs.getString("relation_name"),
          SyncState.fromCode(code),
          code,
          rs.getString("srsublsn"),
          rs.getString("skip_lsn"));
    }, limit);
  }

  private long count(Connection conn, String sql, String name) {
    return jdbc.queryForObject(conn, sql, rs -> rs.getLong(1), name);
  }

  private static boolean supportsSkipLsn(Connection conn) {
    try {
      return conn.getMetaData().getDatabaseMajorVersion() >= SKIP_LSN_SINCE_MAJOR_VERSION;
    } catch (SQLException e) {
      throw new CatalogException("Failed to read server version", e);
    }
  }

  /**
   * Renders a value as a standard-conforming SQL string literal.
   */
  static String literal(String value) {
    return "'" + value.replace("'", "''") + "'";
  }
}
