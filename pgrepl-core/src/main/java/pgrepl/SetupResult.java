package pgrepl;

import pgrepl.preflight.PreflightReport;
import pgrepl.publication.Publication;
import pgrepl.status.StatusReport;
import pgrepl.subscription.Subscription;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of one {@link ReplicationSetup#run()}: the final state, the stages passed, what each
 * stage produced and, on failure, the error with its remediation.
 */
public final class SetupResult {
  private final SetupStage finalStage;
  private final SetupStage failedStage;
  private final List<SetupStage> reached;
  private final RuntimeException error;
  private final PreflightReport preflight;
  private final Publication publication;
  private final Subscription subscription;
  private final StatusReport status;

  private SetupResult(Builder b, SetupStage finalStage, SetupStage failedStage, RuntimeException error) {
    this.finalStage = finalStage;
    this.failedStage = failedStage;
    this.reached = List.copyOf(b.reached);
    this.error = error;
    this.preflight = b.preflight;
    this.publication = b.publication;
    this.subscription = b.subscription;
    this.status = b.status;
  }

  static Builder builder() {
    return new Builder();
  }

  /** {@link SetupStage#DONE} or {@link SetupStage#FAILED}. */
  public SetupStage finalStage() {
    return finalStage;
  }

  public boolean succeeded() {
    return finalStage == SetupStage.DONE;
  }

  /** Process exit code: 0 on success, 1 on any fatal failure. */
  public int exitCode() {
    return succeeded() ? 0 : 1;
  }

  /**
   * The stage the run could not reach. {@link SetupStage#START} means the configuration could
   * not be loaded.
   */
  public Optional<SetupStage> failedStage() {
    return Optional.ofNullable(failedStage);
  }

  /** Stages passed, in order. */
  public List<SetupStage> reachedStages() {
    return reached;
  }

  public Optional<RuntimeException> error() {
    return Optional.ofNullable(error);
  }

  public List<String> remediation() {
    if (error instanceof ReplicationSetupException e) {
      return e.remediation();
    }
    return List.of();
  }

  public Optional<PreflightReport> preflight() {
    return Optional.ofNullable(preflight);
  }

  public Optional<Publication> publication() {
    return Optional.ofNullable(publication);
  }

  public Optional<Subscription> subscription() {
    return Optional.ofNullable(subscription);
  }

  public Optional<StatusReport> status() {
    return Optional.ofNullable(status);
  }

  /**
   * Operator summary: the error and remediation on failure, the status and follow-up notes on
   * success.
   */
  public List<String> describe() {
    List<String> lines = new ArrayList<>();
    if (!succeeded()) {
      lines.add("Replication setup failed at " + failedStage + ": "
          + (error != null ? error.getMessage() : "unknown error"));
      List<String> steps = remediation();
      for (int i = 0; i < steps.size(); i++) {
        lines.add((i + 1) + ". " + steps.get(i));
      }
      return lines;
    }
    if (status != null) {
      lines.addAll(status.describe());
    }
    lines.add("Replication setup completed successfully!");
    lines.add("Notes:");
    lines.add("1. Initial data synchronization may take some time depending on data volume");
    lines.add("2. To monitor replication lag, query: pg_stat_replication on primary");
    lines.add("3. To check replication status, query: pg_stat_subscription on replica");
    return lines;
  }

  @Override
  public String toString() {
    return "SetupResult{" + finalStage + (failedStage != null ? " at " + failedStage : "") + "}";
  }

  static final class Builder {
    private final List<SetupStage> reached = new ArrayList<>();
    private PreflightReport preflight;
    private Publication publication;
    private Subscription subscription;
    private StatusReport status;

    private Builder() {
    }

    Builder reached(SetupStage stage) {
      reached.add(stage);
      return this;
    }

    Builder preflight(PreflightReport preflight) {
      this.preflight = preflight;
      return this;
    }

    Builder publication(Publication publication) {
      this.publication = publication;
      return this;
    }

    Builder subscription(Subscription subscription) {
      this.subscription = subscription;
      return this;
    }

    Builder status(StatusReport status) {
      this.status = status;
      return this;
    }

    SetupResult done() {
      return new SetupResult(this, SetupStage.DONE, null, null);
    }

    SetupResult failed(SetupStage failedStage, RuntimeException error) {
      return new SetupResult(this, SetupStage.FAILED, failedStage, error);
    }
  }
}
