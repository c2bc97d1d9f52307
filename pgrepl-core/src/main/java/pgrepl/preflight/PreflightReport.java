package pgrepl.preflight;

import java.util.List;
import java.util.Objects;

/**
 * Result of a preflight check.
 *
 * @param config   the settings that were read
 * @param ready    {@code true} iff {@code wal_level} is {@code logical}
 * @param warnings advisory capacity findings; never affect {@code ready}
 */
public record PreflightReport(ReplicationConfig config, boolean ready, List<String> warnings) {

  public PreflightReport {
    Objects.requireNonNull(config, "config");
    warnings = List.copyOf(warnings);
  }
}
