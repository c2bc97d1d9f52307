package pgrepl;

import pgrepl.spi.ReplicationCatalog;
import pgrepl.status.RelationSyncState;
import pgrepl.status.SubscriptionInfo;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory {@link ReplicationCatalog} standing in for one primary and one replica server.
 * Records every call so tests can assert which statements would have been issued.
 */
public class StubReplicationCatalog implements ReplicationCatalog {
  public final Map<String, String> settings = new HashMap<>();
  public final Set<String> publications = new LinkedHashSet<>();
  public final Map<String, String> subscriptions = new HashMap<>();
  public final List<RelationSyncState> relationStates = new ArrayList<>();
  public final List<String> calls = new ArrayList<>();

  public int publicationCreates;
  public int subscriptionCreates;
  public String lastConnInfo;
  public Boolean autoCommitDuringSubscriptionCreate;

  public RuntimeException failCreatePublication;
  public RuntimeException failCreateSubscription;
  public RuntimeException failStatus;
  public RuntimeException failShow;

  public StubReplicationCatalog() {
    settings.put("wal_level", "logical");
    settings.put("max_replication_slots", "10");
    settings.put("max_wal_senders", "10");
  }

  @Override
  public String showSetting(Connection conn, String name) {
    calls.add("SHOW " + name);
    if (failShow != null) {
      throw failShow;
    }
    return settings.get(name);
  }

  @Override
  public boolean publicationExists(Connection conn, String publicationName) {
    calls.add("publicationExists " + publicationName);
    return publications.contains(publicationName);
  }

  @Override
  public void createPublication(Connection conn, String publicationName) {
    calls.add("CREATE PUBLICATION " + publicationName);
    if (failCreatePublication != null) {
      throw failCreatePublication;
    }
    publicationCreates++;
    publications.add(publicationName);
  }

  @Override
  public boolean subscriptionExists(Connection conn, String subscriptionName) {
    calls.add("subscriptionExists " + subscriptionName);
    return subscriptions.containsKey(subscriptionName);
  }

  @Override
  public void createSubscription(Connection conn, String subscriptionName, String connInfo, String publicationName) {
    calls.add("CREATE SUBSCRIPTION " + subscriptionName);
    try {
      autoCommitDuringSubscriptionCreate = conn.getAutoCommit();
    } catch (SQLException e) {
      throw new IllegalStateException(e);
    }
    if (failCreateSubscription != null) {
      throw failCreateSubscription;
    }
    subscriptionCreates++;
    lastConnInfo = connInfo;
    subscriptions.put(subscriptionName, publicationName);
  }

  @Override
  public List<SubscriptionInfo> listSubscriptions(Connection conn) {
    calls.add("listSubscriptions");
    if (failStatus != null) {
      throw failStatus;
    }
    List<SubscriptionInfo> result = new ArrayList<>();
    for (String name : subscriptions.keySet()) {
      result.add(new SubscriptionInfo(name, true, lastConnInfo));
    }
    return result;
  }

  @Override
  public List<RelationSyncState> listRelationStates(Connection conn, int limit) {
    calls.add("listRelationStates " + limit);
    return relationStates.size() > limit ? relationStates.subList(0, limit) : relationStates;
  }

  public long creationStatements() {
    return calls.stream().filter(c -> c.startsWith("CREATE ")).count();
  }
}
