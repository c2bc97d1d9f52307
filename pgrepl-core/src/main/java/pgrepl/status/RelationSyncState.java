package pgrepl.status;

import java.util.Objects;

/**
 * Sync state of one table under one subscription.
 *
 * @param subscriptionName owning subscription
 * @param relationName     table name as rendered by {@code regclass}
 * @param state            folded state
 * @param stateCode        raw {@code srsubstate} code
 * @param syncLsn          {@code srsublsn}; {@code null} while not yet known
 * @param skipLsn          the subscription's {@code subskiplsn}; {@code null} when unset or unsupported by the server
 */
public record RelationSyncState(
    String subscriptionName,
    String relationName,
    SyncState state,
    String stateCode,
    String syncLsn,
    String skipLsn) {

  public RelationSyncState {
    Objects.requireNonNull(subscriptionName, "subscriptionName");
    Objects.requireNonNull(relationName, "relationName");
    Objects.requireNonNull(state, "state");
  }
}
