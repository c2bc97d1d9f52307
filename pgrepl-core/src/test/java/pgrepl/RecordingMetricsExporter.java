package pgrepl;

import pgrepl.spi.MetricsExporter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public final class RecordingMetricsExporter implements MetricsExporter {
  public final List<SetupStage> timedStages = new ArrayList<>();
  public final Map<ResourceKind, Integer> created = new EnumMap<>(ResourceKind.class);
  public final Map<ResourceKind, Integer> existing = new EnumMap<>(ResourceKind.class);
  public int succeeded;
  public final List<SetupStage> failedAt = new ArrayList<>();
  public int preflightWarnings = -1;

  @Override
  public void recordStageDuration(SetupStage stage, Duration duration) {
    timedStages.add(stage);
  }

  @Override
  public void incrementRunSucceeded() {
    succeeded++;
  }

  @Override
  public void incrementRunFailed(SetupStage failedStage) {
    failedAt.add(failedStage);
  }

  @Override
  public void incrementResourceCreated(ResourceKind kind) {
    created.merge(kind, 1, Integer::sum);
  }

  @Override
  public void incrementResourceExisting(ResourceKind kind) {
    existing.merge(kind, 1, Integer::sum);
  }

  @Override
  public void recordPreflightWarnings(int warnings) {
    preflightWarnings = warnings;
  }
}
