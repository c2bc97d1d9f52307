package pgrepl.spi;

import pgrepl.ResourceKind;
import pgrepl.SetupStage;

import java.time.Duration;

/**
 * Observability hook for exporting setup-run counters and timings to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Records how long a stage took, whether it passed or failed.
   */
  void recordStageDuration(SetupStage stage, Duration duration);

  /**
   * Increments the count of runs that reached {@link SetupStage#DONE}.
   */
  void incrementRunSucceeded();

  /**
   * Increments the count of failed runs.
   *
   * @param failedStage the stage that was being entered when the run failed
   */
  void incrementRunFailed(SetupStage failedStage);

  /**
   * Increments the count of replication objects created by a run.
   */
  void incrementResourceCreated(ResourceKind kind);

  /**
   * Increments the count of replication objects found already present.
   */
  void incrementResourceExisting(ResourceKind kind);

  /**
   * Records the number of advisory warnings from the latest preflight check.
   */
  default void recordPreflightWarnings(int warnings) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void recordStageDuration(SetupStage stage, Duration duration) {
    }

    @Override
    public void incrementRunSucceeded() {
    }

    @Override
    public void incrementRunFailed(SetupStage failedStage) {
    }

    @Override
    public void incrementResourceCreated(ResourceKind kind) {
    }

    @Override
    public void incrementResourceExisting(ResourceKind kind) {
    }
  }
}
