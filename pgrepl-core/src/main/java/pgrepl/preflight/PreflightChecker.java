package pgrepl.preflight;

import pgrepl.PreflightException;
import pgrepl.spi.ReplicationCatalog;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Inspects the primary's server settings for logical-replication readiness. Read-only.
 *
 * <p>Readiness depends on {@code wal_level} alone. {@code max_replication_slots} and
 * {@code max_wal_senders} below the recommended values only produce warnings.
 */
public final class PreflightChecker {
  private static final Logger logger = Logger.getLogger(PreflightChecker.class.getName());

  static final String WAL_LEVEL = "wal_level";
  static final String MAX_REPLICATION_SLOTS = "max_replication_slots";
  static final String MAX_WAL_SENDERS = "max_wal_senders";

  private final ReplicationCatalog catalog;
  private final int minReplicationSlots;
  private final int minWalSenders;

  public PreflightChecker(ReplicationCatalog catalog, int minReplicationSlots, int minWalSenders) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.minReplicationSlots = minReplicationSlots;
    this.minWalSenders = minWalSenders;
  }

  /**
   * Reads the three settings and evaluates them.
   *
   * @throws PreflightException if a setting cannot be read or parsed
   */
  public PreflightReport check(Connection primary) {
    ReplicationConfig config = read(primary);
    boolean ready = config.walLevel() == WalLevel.LOGICAL;
    if (!ready) {
      logger.warning("wal_level is set to '" + config.walLevel().value() + "' instead of 'logical'");
    }

    List<String> warnings = new ArrayList<>();
    if (config.maxReplicationSlots() < minReplicationSlots) {
      warnings.add("max_replication_slots is set to " + config.maxReplicationSlots()
          + " (recommended at least " + minReplicationSlots + "); consider increasing it in the server parameters");
    }
    if (config.maxWalSenders() < minWalSenders) {
      warnings.add("max_wal_senders is set to " + config.maxWalSenders()
          + " (recommended at least " + minWalSenders + "); consider increasing it in the server parameters");
    }
    for (String warning : warnings) {
      logger.warning(warning);
    }
    if (ready) {
      logger.info("Logical replication is properly configured.");
    }
    return new PreflightReport(config, ready, warnings);
  }

  private ReplicationConfig read(Connection primary) {
    String walLevel = setting(primary, WAL_LEVEL);
    String slots = setting(primary, MAX_REPLICATION_SLOTS);
    String senders = setting(primary, MAX_WAL_SENDERS);
    try {
      return new ReplicationConfig(WalLevel.parse(walLevel), parseInt(MAX_REPLICATION_SLOTS, slots),
          parseInt(MAX_WAL_SENDERS, senders));
    } catch (IllegalArgumentException e) {
      throw new PreflightException("Error checking replication settings: " + e.getMessage(), e);
    }
  }

  private String setting(Connection primary, String name) {
    try {
      return catalog.showSetting(primary, name);
    } catch (RuntimeException e) {
      throw new PreflightException("Error checking replication settings: cannot read " + name, e);
    }
  }

  private static int parseInt(String name, String value) {
    try {
      return Integer.parseInt(value == null ? "" : value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " is not an integer: " + value, e);
    }
  }
}
