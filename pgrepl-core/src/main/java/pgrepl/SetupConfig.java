package pgrepl;

import pgrepl.util.Identifiers;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable configuration for one replication setup run: both endpoints, the replication
 * object names, timeouts and advisory thresholds.
 *
 * <p>Create instances via {@link #builder()}; {@link Builder#build()} validates the values and
 * throws {@link ConfigurationException} on the first problem.
 *
 * @see pgrepl.config.EnvironmentConfigSource
 */
public final class SetupConfig {
  public static final String DEFAULT_PUBLICATION_NAME = "products_publication";
  public static final String DEFAULT_SUBSCRIPTION_NAME = "sales_subscription";
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
  public static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofSeconds(30);
  public static final int DEFAULT_MIN_REPLICATION_SLOTS = 5;
  public static final int DEFAULT_MIN_WAL_SENDERS = 10;
  public static final int DEFAULT_STATUS_ROW_LIMIT = 10;

  private final Endpoint primary;
  private final Endpoint replica;
  private final Endpoint publisher;
  private final String primaryServerName;
  private final String replicaServerName;
  private final String publicationName;
  private final String subscriptionName;
  private final Duration connectTimeout;
  private final Duration queryTimeout;
  private final int minReplicationSlots;
  private final int minWalSenders;
  private final int statusRowLimit;

  private SetupConfig(Builder builder) {
    if (builder.primary == null) {
      throw new ConfigurationException("primary endpoint is required");
    }
    if (builder.replica == null) {
      throw new ConfigurationException("replica endpoint is required");
    }
    this.primary = builder.primary;
    this.replica = builder.replica;
    this.publisher = builder.publisher == null ? builder.primary : builder.publisher;
    this.primaryServerName = builder.primaryServerName == null ? primary.host() : builder.primaryServerName;
    this.replicaServerName = builder.replicaServerName == null ? replica.host() : builder.replicaServerName;
    this.publicationName = identifier(builder.publicationName, "publication name");
    this.subscriptionName = identifier(builder.subscriptionName, "subscription name");
    this.connectTimeout = positive(builder.connectTimeout, "connectTimeout");
    this.queryTimeout = positive(builder.queryTimeout, "queryTimeout");
    if (builder.minReplicationSlots < 0 || builder.minWalSenders < 0) {
      throw new ConfigurationException("recommended thresholds must be >= 0");
    }
    if (builder.statusRowLimit <= 0) {
      throw new ConfigurationException("statusRowLimit must be > 0");
    }
    this.minReplicationSlots = builder.minReplicationSlots;
    this.minWalSenders = builder.minWalSenders;
    this.statusRowLimit = builder.statusRowLimit;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Endpoint primary() {
    return primary;
  }

  public Endpoint replica() {
    return replica;
  }

  /**
   * The primary as the replica reaches it. Same as {@link #primary()} unless an override was
   * configured (private networks, NAT).
   */
  public Endpoint publisher() {
    return publisher;
  }

  /** Diagnostic label of the primary server. */
  public String primaryServerName() {
    return primaryServerName;
  }

  /** Diagnostic label of the replica server. */
  public String replicaServerName() {
    return replicaServerName;
  }

  public String publicationName() {
    return publicationName;
  }

  public String subscriptionName() {
    return subscriptionName;
  }

  public Duration connectTimeout() {
    return connectTimeout;
  }

  public Duration queryTimeout() {
    return queryTimeout;
  }

  public int minReplicationSlots() {
    return minReplicationSlots;
  }

  public int minWalSenders() {
    return minWalSenders;
  }

  public int statusRowLimit() {
    return statusRowLimit;
  }

  public Builder toBuilder() {
    Builder b = new Builder()
        .primary(primary)
        .replica(replica)
        .primaryServerName(primaryServerName)
        .replicaServerName(replicaServerName)
        .publicationName(publicationName)
        .subscriptionName(subscriptionName)
        .connectTimeout(connectTimeout)
        .queryTimeout(queryTimeout)
        .minReplicationSlots(minReplicationSlots)
        .minWalSenders(minWalSenders)
        .statusRowLimit(statusRowLimit);
    if (!publisher.equals(primary)) {
      b.publisher(publisher);
    }
    return b;
  }

  @Override
  public String toString() {
    return "SetupConfig{primary=" + primary + ", replica=" + replica
        + ", publication=" + publicationName + ", subscription=" + subscriptionName + "}";
  }

  private static String identifier(String value, String what) {
    try {
      return Identifiers.validate(value);
    } catch (NullPointerException | IllegalArgumentException e) {
      throw new ConfigurationException("Invalid " + what + ": " + value, e);
    }
  }

  private static Duration positive(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isZero() || value.isNegative()) {
      throw new ConfigurationException(name + " must be positive");
    }
    return value;
  }

  public static final class Builder {
    private Endpoint primary;
    private Endpoint replica;
    private Endpoint publisher;
    private String primaryServerName;
    private String replicaServerName;
    private String publicationName = DEFAULT_PUBLICATION_NAME;
    private String subscriptionName = DEFAULT_SUBSCRIPTION_NAME;
    private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
    private Duration queryTimeout = DEFAULT_QUERY_TIMEOUT;
    private int minReplicationSlots = DEFAULT_MIN_REPLICATION_SLOTS;
    private int minWalSenders = DEFAULT_MIN_WAL_SENDERS;
    private int statusRowLimit = DEFAULT_STATUS_ROW_LIMIT;

    private Builder() {
    }

    public Builder primary(Endpoint primary) {
      this.primary = primary;
      return this;
    }

    public Builder replica(Endpoint replica) {
      this.replica = replica;
      return this;
    }

    /**
     * Overrides the address the replica uses to reach the primary in the subscription's
     * connection string.
     */
    public Builder publisher(Endpoint publisher) {
      this.publisher = publisher;
      return this;
    }

    public Builder primaryServerName(String primaryServerName) {
      this.primaryServerName = primaryServerName;
      return this;
    }

    public Builder replicaServerName(String replicaServerName) {
      this.replicaServerName = replicaServerName;
      return this;
    }

    public Builder publicationName(String publicationName) {
      this.publicationName = publicationName;
      return this;
    }

    public Builder subscriptionName(String subscriptionName) {
      this.subscriptionName = subscriptionName;
      return this;
    }

    public Builder connectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    public Builder queryTimeout(Duration queryTimeout) {
      this.queryTimeout = queryTimeout;
      return this;
    }

    public Builder minReplicationSlots(int minReplicationSlots) {
      this.minReplicationSlots = minReplicationSlots;
      return this;
    }

    public Builder minWalSenders(int minWalSenders) {
      this.minWalSenders = minWalSenders;
      return this;
    }

    public Builder statusRowLimit(int statusRowLimit) {
      this.statusRowLimit = statusRowLimit;
      return this;
    }

    public SetupConfig build() {
      return new SetupConfig(this);
    }
  }
}
