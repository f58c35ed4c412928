package ca.gc.cra.bridge.domain.message;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Origin of a delivery received from a broker queue subscription.
 *
 * <p>Delivery tags are scoped to the channel that delivered them, so coordinates built from this
 * origin are only unique until the subscription is re-established.</p>
 *
 * @param queue queue the subscription consumes from
 * @param deliveryTag channel-scoped delivery tag used for ack and nack
 * @param exchange exchange the message was published to; empty for the default exchange
 * @param routingKey routing key supplied by the publisher
 * @param redelivered whether the broker flagged this delivery as a redelivery
 * @param consumerTag subscription handle that received the delivery
 * @since 0.1.0
 */
public record QueueOrigin(
    String queue,
    long deliveryTag,
    String exchange,
    String routingKey,
    boolean redelivered,
    String consumerTag) implements Origin {

  public QueueOrigin {
    Objects.requireNonNull(queue, "queue");
    exchange = exchange == null ? "" : exchange;
    routingKey = routingKey == null ? "" : routingKey;
    consumerTag = consumerTag == null ? "" : consumerTag;
  }

  @Override
  public String sourceId() {
    return queue;
  }

  @Override
  public String coordinates() {
    return queue + ':' + deliveryTag;
  }

  @Override
  public Map<String, String> provenanceHeaders() {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put(HeaderNames.RABBITMQ_QUEUE, queue);
    headers.put(HeaderNames.RABBITMQ_EXCHANGE, exchange);
    headers.put(HeaderNames.RABBITMQ_ROUTING_KEY, routingKey);
    return headers;
  }
}
