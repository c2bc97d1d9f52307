package pgrepl.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import pgrepl.ResourceKind;
import pgrepl.SetupStage;
import pgrepl.spi.MetricsExporter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>All meters are registered up front, one per stage or resource kind, so a scrape shows
 * zeros before the first run.
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code pgrepl.stage.duration} (tag {@code stage}) time spent entering each stage</li>
 * </ul>
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code pgrepl.run.succeeded} runs that reached DONE</li>
 *   <li>{@code pgrepl.run.failed} (tag {@code stage}) failed runs by failing stage</li>
 *   <li>{@code pgrepl.resource.created} (tag {@code kind}) publications and subscriptions created</li>
 *   <li>{@code pgrepl.resource.existing} (tag {@code kind}) publications and subscriptions found in place</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code pgrepl.preflight.warnings} advisory warnings from the latest preflight check</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
  public static final String DEFAULT_PREFIX = "pgrepl";

  private final MeterRegistry registry;
  private final Map<SetupStage, Timer> stageDurations = new EnumMap<>(SetupStage.class);
  private final Map<SetupStage, Counter> runsFailed = new EnumMap<>(SetupStage.class);
  private final Map<ResourceKind, Counter> resourcesCreated = new EnumMap<>(ResourceKind.class);
  private final Map<ResourceKind, Counter> resourcesExisting = new EnumMap<>(ResourceKind.class);
  private final Counter runsSucceeded;
  private final Gauge preflightWarningsGauge;
  private final AtomicInteger preflightWarnings = new AtomicInteger();
  private final List<Meter> meters = new ArrayList<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "pgrepl"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * Creates an exporter with a custom metric name prefix, e.g. one per replicated database pair.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "sales.pgrepl"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;

    for (SetupStage stage : SetupStage.values()) {
      if (stage == SetupStage.FAILED) {
        continue;
      }
      stageDurations.put(stage, track(Timer.builder(namePrefix + ".stage.duration")
          .description("Time spent entering a setup stage")
          .tag("stage", tag(stage))
          .register(registry)));
      runsFailed.put(stage, track(Counter.builder(namePrefix + ".run.failed")
          .description("Setup runs that failed at a stage")
          .tag("stage", tag(stage))
          .register(registry)));
    }
    for (ResourceKind kind : ResourceKind.values()) {
      resourcesCreated.put(kind, track(Counter.builder(namePrefix + ".resource.created")
          .description("Replication objects created")
          .tag("kind", tag(kind))
          .register(registry)));
      resourcesExisting.put(kind, track(Counter.builder(namePrefix + ".resource.existing")
          .description("Replication objects found already present")
          .tag("kind", tag(kind))
          .register(registry)));
    }
    this.runsSucceeded = track(Counter.builder(namePrefix + ".run.succeeded")
        .description("Setup runs that completed")
        .register(registry));
    this.preflightWarningsGauge = track(Gauge.builder(namePrefix + ".preflight.warnings", preflightWarnings,
            AtomicInteger::get)
        .description("Advisory warnings from the latest preflight check")
        .register(registry));
  }

  @Override
  public void recordStageDuration(SetupStage stage, Duration duration) {
    if (closed) return;
    Timer timer = stageDurations.get(stage);
    if (timer != null) {
      timer.record(duration);
    }
  }

  @Override
  public void incrementRunSucceeded() {
    if (closed) return;
    runsSucceeded.increment();
  }

  @Override
  public void incrementRunFailed(SetupStage failedStage) {
    if (closed) return;
    Counter counter = runsFailed.get(failedStage);
    if (counter != null) {
      counter.increment();
    }
  }

  @Override
  public void incrementResourceCreated(ResourceKind kind) {
    if (closed) return;
    resourcesCreated.get(kind).increment();
  }

  @Override
  public void incrementResourceExisting(ResourceKind kind) {
    if (closed) return;
    resourcesExisting.get(kind).increment();
  }

  @Override
  public void recordPreflightWarnings(int warnings) {
    if (closed) return;
    preflightWarnings.set(warnings);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }

  private <M extends Meter> M track(M meter) {
    meters.add(meter);
    return meter;
  }

  private static String tag(Enum<?> value) {
    return value.name().toLowerCase(Locale.ROOT);
  }
}
