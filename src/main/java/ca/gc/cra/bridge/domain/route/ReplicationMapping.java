package ca.gc.cra.bridge.domain.route;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One configured route entry, as supplied by the operator.
 *
 * <p>Which fields are required depends on the direction the table is built for; see
 * {@link MappingTable#forDirection}.</p>
 *
 * @param kafkaTopic Kafka topic (source for K2R and S2T, destination for R2K and T2S)
 * @param targetTopic target-cluster topic for log-to-log bridges
 * @param rabbitmqExchange exchange name
 * @param rabbitmqExchangeType exchange type: {@code direct}, {@code fanout}, {@code topic} or {@code headers}
 * @param rabbitmqQueue queue name
 * @param rabbitmqRoutingKey routing key used for publishing and binding
 * @since 0.1.0
 */
public record ReplicationMapping(
    Optional<String> kafkaTopic,
    Optional<String> targetTopic,
    Optional<String> rabbitmqExchange,
    String rabbitmqExchangeType,
    Optional<String> rabbitmqQueue,
    Optional<String> rabbitmqRoutingKey) {

  /** Exchange type used when none is configured. */
  public static final String DEFAULT_EXCHANGE_TYPE = "topic";

  private static final Set<String> EXCHANGE_TYPES = Set.of("direct", "fanout", "topic", "headers");

  public ReplicationMapping {
    kafkaTopic = Objects.requireNonNullElse(kafkaTopic, Optional.empty());
    targetTopic = Objects.requireNonNullElse(targetTopic, Optional.empty());
    rabbitmqExchange = Objects.requireNonNullElse(rabbitmqExchange, Optional.empty());
    rabbitmqQueue = Objects.requireNonNullElse(rabbitmqQueue, Optional.empty());
    rabbitmqRoutingKey = Objects.requireNonNullElse(rabbitmqRoutingKey, Optional.empty());
    String type = rabbitmqExchangeType == null || rabbitmqExchangeType.isBlank()
        ? DEFAULT_EXCHANGE_TYPE
        : rabbitmqExchangeType.trim().toLowerCase(Locale.ROOT);
    if (!EXCHANGE_TYPES.contains(type)) {
      throw new IllegalArgumentException(
          "rabbitmqExchangeType must be one of direct, fanout, topic, headers (was " + rabbitmqExchangeType + ")");
    }
    rabbitmqExchangeType = type;
  }

  /**
   * Convenience factory for a Kafka to RabbitMQ exchange route.
   *
   * @param topic source topic
   * @param exchange target exchange
   * @param routingKey routing key
   * @param queue optional queue to declare and bind; may be {@code null}
   * @return mapping
   */
  public static ReplicationMapping exchangeRoute(String topic, String exchange, String routingKey, String queue) {
    return new ReplicationMapping(
        Optional.ofNullable(topic),
        Optional.empty(),
        Optional.ofNullable(exchange),
        DEFAULT_EXCHANGE_TYPE,
        Optional.ofNullable(queue),
        Optional.ofNullable(routingKey));
  }

  /**
   * Convenience factory for a RabbitMQ queue to Kafka topic route.
   *
   * @param queue source queue
   * @param topic destination topic
   * @return mapping
   */
  public static ReplicationMapping queueRoute(String queue, String topic) {
    return new ReplicationMapping(
        Optional.ofNullable(topic),
        Optional.empty(),
        Optional.empty(),
        DEFAULT_EXCHANGE_TYPE,
        Optional.ofNullable(queue),
        Optional.empty());
  }

  /**
   * Convenience factory for a log-to-log route.
   *
   * @param sourceTopic topic on the source cluster
   * @param targetTopic topic on the target cluster
   * @return mapping
   */
  public static ReplicationMapping topicRoute(String sourceTopic, String targetTopic) {
    return new ReplicationMapping(
        Optional.ofNullable(sourceTopic),
        Optional.ofNullable(targetTopic),
        Optional.empty(),
        DEFAULT_EXCHANGE_TYPE,
        Optional.empty(),
        Optional.empty());
  }
}
