package ca.gc.cra.bridge.domain.message;

import java.util.Objects;

/**
 * Where a replicated message is published: a log topic or an exchange with a routing key.
 *
 * @param kind destination kind
 * @param name topic or exchange name; the empty string denotes the default exchange
 * @param routingKey routing key for exchanges; empty for topics
 * @since 0.1.0
 */
public record Destination(Kind kind, String name, String routingKey) {

  /** Destination kinds. */
  public enum Kind {
    TOPIC,
    EXCHANGE
  }

  public Destination {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(name, "name");
    routingKey = routingKey == null ? "" : routingKey;
    if (kind == Kind.TOPIC && name.isBlank()) {
      throw new IllegalArgumentException("topic destination requires a topic name");
    }
    if (kind == Kind.EXCHANGE && name.isEmpty() && routingKey.isEmpty()) {
      throw new IllegalArgumentException("default exchange destination requires a routing key");
    }
  }

  /**
   * Creates a log topic destination.
   *
   * @param topic target topic
   * @return destination
   */
  public static Destination topic(String topic) {
    return new Destination(Kind.TOPIC, topic, "");
  }

  /**
   * Creates an exchange destination.
   *
   * @param exchange exchange name, or the empty string for the default exchange
   * @param routingKey routing key
   * @return destination
   */
  public static Destination exchange(String exchange, String routingKey) {
    return new Destination(Kind.EXCHANGE, exchange, routingKey);
  }

  /**
   * Indicates the broker's default exchange, which routes by queue name.
   *
   * @return {@code true} for the default exchange
   */
  public boolean isDefaultExchange() {
    return kind == Kind.EXCHANGE && name.isEmpty();
  }

  /**
   * Short human-readable form used in logs.
   *
   * @return e.g. {@code topic:orders} or {@code exchange:events[orders.created]}
   */
  public String describe() {
    if (kind == Kind.TOPIC) {
      return "topic:" + name;
    }
    String exchangeLabel = name.isEmpty() ? "(default)" : name;
    return "exchange:" + exchangeLabel + '[' + routingKey + ']';
  }
}
