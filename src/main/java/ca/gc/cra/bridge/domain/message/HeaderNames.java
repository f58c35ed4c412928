package ca.gc.cra.bridge.domain.message;

/**
 * Header names attached to replicated messages.
 *
 * @since 0.1.0
 */
public final class HeaderNames {
  public static final String KAFKA_TOPIC = "kafka_topic";
  public static final String KAFKA_PARTITION = "kafka_partition";
  public static final String KAFKA_OFFSET = "kafka_offset";
  public static final String KAFKA_KEY = "kafka_key";
  public static final String RABBITMQ_QUEUE = "rabbitmq_queue";
  public static final String RABBITMQ_EXCHANGE = "rabbitmq_exchange";
  public static final String RABBITMQ_ROUTING_KEY = "rabbitmq_routing_key";
  public static final String REPLICATOR_ID = "replicator_id";

  private HeaderNames() {}
}
