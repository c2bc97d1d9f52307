package pgrepl;

import pgrepl.config.SetupConfigSource;
import pgrepl.connect.EndpointConnector;
import pgrepl.preflight.PreflightChecker;
import pgrepl.preflight.PreflightReport;
import pgrepl.publication.Publication;
import pgrepl.publication.PublicationManager;
import pgrepl.spi.ConnectionProvider;
import pgrepl.spi.MetricsExporter;
import pgrepl.spi.ReplicationCatalog;
import pgrepl.status.StatusReport;
import pgrepl.status.StatusReporter;
import pgrepl.subscription.Subscription;
import pgrepl.subscription.SubscriptionManager;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the replication setup stages for one primary/replica pair, strictly in order:
 * <pre>
 * START → PRIMARY_CONNECTED → PREFLIGHT_PASSED → PUBLICATION_READY
 *       → REPLICA_CONNECTED → SUBSCRIPTION_READY → STATUS_REPORTED → DONE
 * </pre>
 *
 * <p>The first fatal error ends the run in {@link SetupStage#FAILED}. Nothing is retried and
 * nothing created by an earlier stage is undone; because publication and subscription creation
 * are idempotent, re-running is the recovery path. Status reporting failures are not fatal.
 *
 * <p>The primary connection is held across the preflight and publication stages and closed
 * before the replica is contacted; the replica connection is held across the subscription and
 * status stages. Both are closed on every path.
 *
 * <p>Create instances via {@link #builder()}. Instances keep no state between runs; each run
 * reloads the configuration and re-reads the server settings.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * ReplicationSetup setup = ReplicationSetup.builder()
 *     .configSource(EnvironmentConfigSource.fromSystem(Path.of(".env")))
 *     .connectionProvider(new DriverManagerConnectionProvider())
 *     .catalog(new PostgresReplicationCatalog())
 *     .build();
 * SetupResult result = setup.run();
 * System.exit(result.exitCode());
 * }</pre>
 */
public final class ReplicationSetup {
  private static final Logger logger = Logger.getLogger(ReplicationSetup.class.getName());

  static final String PRIMARY = "PRIMARY";
  static final String REPLICA = "REPLICA";

  private final SetupConfigSource configSource;
  private final ConnectionProvider connectionProvider;
  private final ReplicationCatalog catalog;
  private final MetricsExporter metrics;

  private ReplicationSetup(Builder builder) {
    this.configSource = Objects.requireNonNull(builder.configSource, "configSource");
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.catalog = Objects.requireNonNull(builder.catalog, "catalog");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Executes one full run. Never throws for stage failures; inspect the returned result.
   */
  public SetupResult run() {
    Run run = new Run();
    try {
      SetupConfig config = configSource.load();
      run.reached(SetupStage.START);
      logger.info("Replication setup: " + config.primaryServerName() + " -> " + config.replicaServerName());

      ReplicationCatalog runCatalog = catalog.withQueryTimeout(config.queryTimeout());
      EndpointConnector connector =
          new EndpointConnector(connectionProvider, config.connectTimeout(), config.queryTimeout());

      Publication publication = preparePrimary(run, config, connector, runCatalog);
      prepareReplica(run, config, connector, runCatalog, publication);

      metrics.incrementRunSucceeded();
      logger.info("Replication setup completed successfully!");
      return run.result.done();
    } catch (RuntimeException e) {
      return run.fail(e);
    }
  }

  private Publication preparePrimary(Run run, SetupConfig config, EndpointConnector connector,
      ReplicationCatalog runCatalog) {
    Connection primary = connector.connect(config.primary(), PRIMARY);
    try {
      run.reached(SetupStage.PRIMARY_CONNECTED);

      PreflightReport preflight = new PreflightChecker(runCatalog, config.minReplicationSlots(),
          config.minWalSenders()).check(primary);
      run.result.preflight(preflight);
      metrics.recordPreflightWarnings(preflight.warnings().size());
      if (!preflight.ready()) {
        throw notReady(config, preflight);
      }
      run.reached(SetupStage.PREFLIGHT_PASSED);

      Publication publication = new PublicationManager(runCatalog).ensure(primary, config.publicationName());
      run.result.publication(publication);
      count(ResourceKind.PUBLICATION, publication.created());
      run.reached(SetupStage.PUBLICATION_READY);
      return publication;
    } finally {
      close(primary, PRIMARY);
    }
  }

  private void prepareReplica(Run run, SetupConfig config, EndpointConnector connector,
      ReplicationCatalog runCatalog, Publication publication) {
    Connection replica = connector.connect(config.replica(), REPLICA);
    try {
      run.reached(SetupStage.REPLICA_CONNECTED);

      Subscription subscription = new SubscriptionManager(runCatalog)
          .ensure(replica, publication.name(), config.publisher(), config.subscriptionName());
      run.result.subscription(subscription);
      count(ResourceKind.SUBSCRIPTION, subscription.created());
      run.reached(SetupStage.SUBSCRIPTION_READY);

      StatusReport status = new StatusReporter(runCatalog, config.statusRowLimit()).report(replica);
      run.result.status(status);
      run.reached(SetupStage.STATUS_REPORTED);
    } finally {
      close(replica, REPLICA);
    }
  }

  private static PreflightException notReady(SetupConfig config, PreflightReport preflight) {
    return new PreflightException(
        "Logical replication is not properly configured on the primary server '"
            + config.primaryServerName() + "' (wal_level=" + preflight.config().walLevel().value() + ")",
        List.of(
            "Set wal_level to 'logical' in the server parameters of " + config.primaryServerName(),
            "Increase max_replication_slots (recommended: 10)",
            "Increase max_wal_senders (recommended: 10)",
            "Restart the server; these parameters only take effect after a restart"));
  }

  private void count(ResourceKind kind, boolean created) {
    if (created) {
      metrics.incrementResourceCreated(kind);
    } else {
      metrics.incrementResourceExisting(kind);
    }
  }

  private static void close(Connection conn, String description) {
    try {
      conn.close();
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Failed to close " + description + " connection", e);
    }
  }

  /** Tracks the stage being attempted and its timing. */
  private final class Run {
    final SetupResult.Builder result = SetupResult.builder();
    SetupStage attempting = SetupStage.START;
    long startedAt = System.nanoTime();

    void reached(SetupStage stage) {
      metrics.recordStageDuration(stage, Duration.ofNanos(System.nanoTime() - startedAt));
      result.reached(stage);
      logger.fine("Reached " + stage);
      attempting = stage.next();
      startedAt = System.nanoTime();
    }

    SetupResult fail(RuntimeException e) {
      metrics.recordStageDuration(attempting, Duration.ofNanos(System.nanoTime() - startedAt));
      metrics.incrementRunFailed(attempting);
      if (e instanceof ReplicationSetupException) {
        logger.severe("Replication setup failed at " + attempting + ": " + e.getMessage());
      } else {
        logger.log(Level.SEVERE, "Replication setup failed at " + attempting, e);
      }
      return result.failed(attempting, e);
    }
  }

  public static final class Builder {
    private SetupConfigSource configSource;
    private ConnectionProvider connectionProvider;
    private ReplicationCatalog catalog;
    private MetricsExporter metrics;

    private Builder() {
    }

    public Builder configSource(SetupConfigSource configSource) {
      this.configSource = configSource;
      return this;
    }

    /** Shorthand for {@code configSource(SetupConfigSource.of(config))}. */
    public Builder config(SetupConfig config) {
      this.configSource = SetupConfigSource.of(config);
      return this;
    }

    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    public Builder catalog(ReplicationCatalog catalog) {
      this.catalog = catalog;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public ReplicationSetup build() {
      return new ReplicationSetup(this);
    }
  }
}
