package pgrepl.subscription;

import java.util.Objects;

/**
 * A subscription on the replica after {@link SubscriptionManager#ensure}.
 *
 * @param name            subscription name (its identity)
 * @param publicationName publication it is bound to
 * @param connInfo        connection descriptor to the primary
 * @param exists          always {@code true} once ensured
 * @param created         {@code true} if this call issued the create statement
 */
public record Subscription(String name, String publicationName, ConnInfo connInfo, boolean exists,
    boolean created) {

  public Subscription {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(publicationName, "publicationName");
    Objects.requireNonNull(connInfo, "connInfo");
  }
}
