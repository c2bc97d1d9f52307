package pgrepl.preflight;

import java.util.Objects;

/**
 * Replication-related server settings read from the primary. Re-read on every run.
 */
public record ReplicationConfig(WalLevel walLevel, int maxReplicationSlots, int maxWalSenders) {

  public ReplicationConfig {
    Objects.requireNonNull(walLevel, "walLevel");
  }
}
