package ca.gc.cra.bridge.adapter.amqp;

import ca.gc.cra.bridge.application.port.ClockPort;
import ca.gc.cra.bridge.application.port.ConnectionException;
import ca.gc.cra.bridge.application.port.ConnectionState;
import ca.gc.cra.bridge.application.port.DeliveryException;
import ca.gc.cra.bridge.application.port.MessageSource;
import ca.gc.cra.bridge.domain.message.InFlightMessage;
import ca.gc.cra.bridge.domain.message.QueueOrigin;
import ca.gc.cra.bridge.infrastructure.exec.RetryPolicy;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MessageSource} consuming RabbitMQ queues with manual
 * acknowledgement.
 * <p><strong>Why:</strong> A delivery is only acked after Kafka confirmed the replicated record, so
 * the broker keeps it until then.</p>
 * <p><strong>Role:</strong> Source adapter for {@code R2K}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Declare the configured queues, then subscribe with one channel per queue and
 *   {@code basicQos(prefetch)}.</li>
 *   <li>Hand deliveries from the client's dispatch thread to the supervisor through a bounded
 *   queue.</li>
 *   <li>Resolve the source queue of each delivery from its consumer tag.</li>
 *   <li>Ack and nack on the channel that received the delivery.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> The consumer callbacks only enqueue. Everything else runs on
 * the supervisor thread.</p>
 * <p><strong>Observability:</strong> Logs subscriptions, cancellations and unexpected channel
 * shutdowns; {@link #backlog()} reports ready messages per queue.</p>
 *
 * @since 0.1.0
 */
public final class AmqpSourceAdapter implements MessageSource {
  private static final Logger log = LoggerFactory.getLogger(AmqpSourceAdapter.class);
  private static final int CLOSE_TIMEOUT_MILLIS = 5_000;

  private final AmqpConnector connector;
  private final List<String> queues;
  private final RetryPolicy retry;
  private final ClockPort clock;
  private final BlockingQueue<PendingDelivery> handoff;
  private final Map<String, String> queueByTag = new ConcurrentHashMap<>();
  private final Map<String, Channel> channelByTag = new ConcurrentHashMap<>();

  private Connection connection;
  private volatile ConnectionState state = ConnectionState.DISCONNECTED;
  private volatile TopologyReport topology;

  public AmqpSourceAdapter(AmqpConnector connector, List<String> queues) {
    this(connector, queues, RetryPolicy.defaults(), ClockPort.SYSTEM);
  }

  AmqpSourceAdapter(AmqpConnector connector, List<String> queues, RetryPolicy retry, ClockPort clock) {
    this.connector = Objects.requireNonNull(connector, "connector");
    this.queues = List.copyOf(Objects.requireNonNull(queues, "queues"));
    if (this.queues.isEmpty()) {
      throw new IllegalArgumentException("at least one source queue is required");
    }
    this.retry = Objects.requireNonNull(retry, "retry");
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
    this.handoff = new ArrayBlockingQueue<>(connector.settings().prefetch() * this.queues.size());
  }

  @Override
  public void connect() throws ConnectionException {
    state = ConnectionState.CONNECTING;
    try {
      connection = retry.execute(describe(), this::openAndSubscribe);
      state = ConnectionState.CONNECTED;
    } catch (ConnectionException ex) {
      state = ConnectionState.FAILED;
      throw ex;
    }
  }

  @Override
  public ConnectionState state() {
    return state;
  }

  @Override
  public boolean probe() {
    boolean healthy = state == ConnectionState.CONNECTED
        && connection != null
        && connection.isOpen()
        && channelByTag.values().stream().allMatch(Channel::isOpen)
        && !connector.blockedTooLong();
    if (!healthy && state == ConnectionState.CONNECTED) {
      log.warn("RabbitMQ consumer unhealthy (connection open={}, blocked={})",
          connection != null && connection.isOpen(), connector.blocked());
      state = ConnectionState.FAILED;
    }
    return healthy;
  }

  @Override
  public void reconnect() throws ConnectionException {
    closeConnection();
    connect();
  }

  @Override
  public String describe() {
    return connector.describe() + " queues=" + queues;
  }

  @Override
  public List<InFlightMessage> poll(Duration timeout) {
    List<PendingDelivery> batch = new ArrayList<>();
    try {
      PendingDelivery first = handoff.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (first == null) {
        return List.of();
      }
      batch.add(first);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return List.of();
    }
    handoff.drainTo(batch);
    long now = clock.nowMillis();
    List<InFlightMessage> messages = new ArrayList<>(batch.size());
    for (PendingDelivery delivery : batch) {
      messages.add(toMessage(delivery, now));
    }
    return messages;
  }

  @Override
  public void acknowledge(InFlightMessage message) throws DeliveryException {
    QueueOrigin origin = queueOrigin(message);
    Channel channel = channelFor(origin);
    try {
      channel.basicAck(origin.deliveryTag(), false);
    } catch (IOException | ShutdownSignalException ex) {
      state = ConnectionState.FAILED;
      throw new DeliveryException("ack failed for " + origin.coordinates() + ": " + ex.getMessage(), ex);
    }
  }

  @Override
  public void reject(InFlightMessage message, boolean requeue) throws DeliveryException {
    QueueOrigin origin = queueOrigin(message);
    Channel channel = channelFor(origin);
    try {
      channel.basicNack(origin.deliveryTag(), false, requeue);
    } catch (IOException | ShutdownSignalException ex) {
      state = ConnectionState.FAILED;
      throw new DeliveryException("nack failed for " + origin.coordinates() + ": " + ex.getMessage(), ex);
    }
  }

  @Override
  public Map<String, Long> backlog() {
    Connection current = connection;
    if (current == null || !current.isOpen()) {
      return Map.of();
    }
    Map<String, Long> backlog = new LinkedHashMap<>();
    for (String queue : queues) {
      try (Channel channel = current.createChannel()) {
        backlog.put(queue, channel.messageCount(queue));
      } catch (IOException | TimeoutException | ShutdownSignalException ex) {
        log.debug("Unable to read message count for {}: {}", queue, ex.getMessage());
      }
    }
    return backlog;
  }

  /** Delivery tags are channel-scoped and restart after a reconnect. */
  @Override
  public boolean coordinatesSurviveReconnect() {
    return false;
  }

  @Override
  public void close() {
    closeConnection();
    state = ConnectionState.DISCONNECTED;
  }

  TopologyReport topology() {
    return topology;
  }

  int pending() {
    return handoff.size();
  }

  private Connection openAndSubscribe() throws IOException, TimeoutException {
    Connection opened = connector.newConnection("bridge-r2k");
    try {
      topology = AmqpTopology.declareQueues(opened, queues);
      for (String queue : queues) {
        subscribe(opened, queue);
      }
      return opened;
    } catch (IOException | RuntimeException ex) {
      abort(opened);
      queueByTag.clear();
      channelByTag.clear();
      throw ex;
    }
  }

  private void subscribe(Connection target, String queue) throws IOException {
    Channel channel = target.createChannel();
    channel.basicQos(connector.settings().prefetch());
    String tag = channel.basicConsume(queue, false, new HandoffConsumer(channel, queue));
    queueByTag.put(tag, queue);
    channelByTag.put(tag, channel);
    log.info("Subscribed to queue {} (consumer tag {}, prefetch {})", queue, tag, connector.settings().prefetch());
  }

  private InFlightMessage toMessage(PendingDelivery delivery, long now) {
    Envelope envelope = delivery.envelope();
    QueueOrigin origin = new QueueOrigin(
        resolveQueue(delivery.consumerTag(), envelope),
        envelope.getDeliveryTag(),
        envelope.getExchange(),
        envelope.getRoutingKey(),
        envelope.isRedeliver(),
        delivery.consumerTag());
    Map<String, Object> table = delivery.properties() == null ? null : delivery.properties().getHeaders();
    return new InFlightMessage(origin, null, delivery.body(), AmqpHeaders.fromAmqp(table), now);
  }

  String resolveQueue(String consumerTag, Envelope envelope) {
    String queue = queueByTag.get(consumerTag);
    if (queue != null) {
      return queue;
    }
    if (envelope.getExchange() == null || envelope.getExchange().isEmpty()) {
      return envelope.getRoutingKey();
    }
    log.warn("Unknown consumer tag {}; using it as the queue name", consumerTag);
    return consumerTag;
  }

  private static QueueOrigin queueOrigin(InFlightMessage message) throws DeliveryException {
    if (message.origin() instanceof QueueOrigin origin) {
      return origin;
    }
    throw new DeliveryException("not a RabbitMQ delivery: " + message.origin().coordinates());
  }

  private Channel channelFor(QueueOrigin origin) throws DeliveryException {
    Channel channel = channelByTag.get(origin.consumerTag());
    if (channel == null) {
      throw new DeliveryException("no open channel for consumer tag " + origin.consumerTag()
          + "; " + origin.coordinates() + " will be redelivered by the broker");
    }
    return channel;
  }

  private void closeConnection() {
    Connection current = connection;
    connection = null;
    queueByTag.clear();
    channelByTag.clear();
    int dropped = handoff.size();
    handoff.clear();
    if (dropped > 0) {
      log.info("Discarded {} unacknowledged deliveries; the broker will redeliver them", dropped);
    }
    if (current != null && current.isOpen()) {
      try {
        current.close(CLOSE_TIMEOUT_MILLIS);
      } catch (IOException | ShutdownSignalException ex) {
        log.warn("Error closing RabbitMQ connection: {}", ex.getMessage());
      }
    }
  }

  private static void abort(Connection target) {
    target.abort(CLOSE_TIMEOUT_MILLIS);
  }

  private record PendingDelivery(
      String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {}

  private final class HandoffConsumer extends DefaultConsumer {
    private final String queue;

    HandoffConsumer(Channel channel, String queue) {
      super(channel);
      this.queue = queue;
    }

    @Override
    public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
      try {
        handoff.put(new PendingDelivery(consumerTag, envelope, properties, body));
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while handing off delivery {} from {}", envelope.getDeliveryTag(), queue);
      }
    }

    @Override
    public void handleCancel(String consumerTag) {
      log.error("Subscription {} to queue {} was cancelled by the broker", consumerTag, queue);
      state = ConnectionState.FAILED;
    }

    @Override
    public void handleShutdownSignal(String consumerTag, ShutdownSignalException signal) {
      if (!signal.isInitiatedByApplication()) {
        log.warn("Channel for queue {} shut down: {}", queue, signal.getMessage());
        state = ConnectionState.FAILED;
      }
    }
  }
}
