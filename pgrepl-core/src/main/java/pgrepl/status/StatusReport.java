package pgrepl.status;

import pgrepl.ReportingException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of a status query on the replica. Either a snapshot (possibly with no subscriptions)
 * or "unavailable" carrying the recovered {@link ReportingException}.
 */
public final class StatusReport {
  private final List<SubscriptionInfo> subscriptions;
  private final List<RelationSyncState> relations;
  private final ReportingException failure;

  private StatusReport(List<SubscriptionInfo> subscriptions, List<RelationSyncState> relations,
      ReportingException failure) {
    this.subscriptions = List.copyOf(subscriptions);
    this.relations = List.copyOf(relations);
    this.failure = failure;
  }

  public static StatusReport of(List<SubscriptionInfo> subscriptions, List<RelationSyncState> relations) {
    return new StatusReport(subscriptions, relations, null);
  }

  public static StatusReport noSubscriptions() {
    return new StatusReport(List.of(), List.of(), null);
  }

  public static StatusReport unavailable(ReportingException failure) {
    return new StatusReport(List.of(), List.of(), failure);
  }

  public List<SubscriptionInfo> subscriptions() {
    return subscriptions;
  }

  /** Per-relation states, capped at the configured row limit. */
  public List<RelationSyncState> relations() {
    return relations;
  }

  /** {@code true} when the query succeeded and the replica has no subscriptions at all. */
  public boolean hasNoSubscriptions() {
    return failure == null && subscriptions.isEmpty();
  }

  public boolean isAvailable() {
    return failure == null;
  }

  public Optional<ReportingException> failure() {
    return Optional.ofNullable(failure);
  }

  /**
   * Multi-line operator summary.
   */
  public List<String> describe() {
    if (failure != null) {
      return List.of("Replication status unavailable: " + failure.getMessage());
    }
    if (subscriptions.isEmpty()) {
      return List.of("No subscriptions found.");
    }
    List<String> lines = new ArrayList<>();
    lines.add("Subscription Status:");
    for (SubscriptionInfo s : subscriptions) {
      lines.add("Name: " + s.name());
      lines.add("Enabled: " + s.enabled());
      lines.add("Connection: " + s.connInfo());
    }
    if (!relations.isEmpty()) {
      lines.add("Replication Details (top " + relations.size() + " relations):");
      for (RelationSyncState r : relations) {
        lines.add("Subscription: " + r.subscriptionName() + ", State: " + r.state()
            + ", Relation: " + r.relationName());
      }
    }
    return lines;
  }
}
