package ca.gc.cra.bridge.adapter.amqp;

import ca.gc.cra.bridge.application.port.ConnectionException;
import ca.gc.cra.bridge.application.port.ConnectionState;
import ca.gc.cra.bridge.application.port.DeliveryException;
import ca.gc.cra.bridge.application.port.MessageDestination;
import ca.gc.cra.bridge.domain.message.Destination;
import ca.gc.cra.bridge.domain.message.OutboundMessage;
import ca.gc.cra.bridge.domain.route.ReplicationMapping;
import ca.gc.cra.bridge.infrastructure.exec.RetryPolicy;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Return;
import com.rabbitmq.client.ShutdownSignalException;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MessageDestination} publishing persistent messages to RabbitMQ
 * exchanges.
 * <p><strong>Why:</strong> With publisher confirms enabled, a Kafka record is only considered
 * replicated once the broker has taken responsibility for the message.</p>
 * <p><strong>Role:</strong> Destination adapter for {@code K2R}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Provision exchanges, queues and bindings on every new connection.</li>
 *   <li>Publish with {@code deliveryMode=2}, {@code mandatory=true} and the bridge headers.</li>
 *   <li>Wait for the confirm of each publish; a nack or timeout is a {@link DeliveryException}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Uses a single channel; call from the supervisor thread only.</p>
 * <p><strong>Observability:</strong> Logs unroutable returns at WARN and topology failures at ERROR.</p>
 *
 * @since 0.1.0
 */
public final class AmqpDestinationAdapter implements MessageDestination {
  private static final Logger log = LoggerFactory.getLogger(AmqpDestinationAdapter.class);
  private static final int PERSISTENT = 2;
  private static final int CLOSE_TIMEOUT_MILLIS = 5_000;

  private final AmqpConnector connector;
  private final List<ReplicationMapping> mappings;
  private final RetryPolicy retry;

  private Connection connection;
  private Channel channel;
  private volatile ConnectionState state = ConnectionState.DISCONNECTED;
  private volatile TopologyReport topology;

  public AmqpDestinationAdapter(AmqpConnector connector, List<ReplicationMapping> mappings) {
    this(connector, mappings, RetryPolicy.defaults());
  }

  AmqpDestinationAdapter(AmqpConnector connector, List<ReplicationMapping> mappings, RetryPolicy retry) {
    this.connector = Objects.requireNonNull(connector, "connector");
    this.mappings = List.copyOf(Objects.requireNonNull(mappings, "mappings"));
    this.retry = Objects.requireNonNull(retry, "retry");
  }

  @Override
  public void connect() throws ConnectionException {
    state = ConnectionState.CONNECTING;
    try {
      connection = retry.execute(describe(), this::openAndProvision);
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
        && channel != null
        && channel.isOpen()
        && !connector.blockedTooLong();
    if (!healthy && state == ConnectionState.CONNECTED) {
      log.warn("RabbitMQ publisher unhealthy (connection open={}, blocked={})",
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
    return connector.describe();
  }

  @Override
  public void publish(OutboundMessage message) throws DeliveryException {
    Objects.requireNonNull(message, "message");
    Destination destination = message.destination();
    if (destination.kind() != Destination.Kind.EXCHANGE) {
      throw new DeliveryException("RabbitMQ cannot publish to " + destination.describe());
    }
    Channel current = channel;
    if (current == null) {
      throw new DeliveryException("publisher is not connected");
    }
    AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
        .deliveryMode(PERSISTENT)
        .headers(AmqpHeaders.toAmqp(message.headers()))
        .messageId(message.replicationId())
        .build();
    boolean confirms = connector.settings().publisherConfirms();
    long confirmMillis = connector.settings().confirmTimeout().toMillis();
    try {
      current.basicPublish(destination.name(), destination.routingKey(), true, properties, message.payload());
      if (confirms) {
        current.waitForConfirmsOrDie(confirmMillis);
      }
    } catch (TimeoutException ex) {
      throw new DeliveryException("RabbitMQ did not confirm " + message.replicationId()
          + " on " + destination.describe() + " within " + confirmMillis + " ms", ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new DeliveryException("Interrupted while waiting for RabbitMQ confirm", ex);
    } catch (IOException | ShutdownSignalException ex) {
      if (!current.isOpen()) {
        state = ConnectionState.FAILED;
      }
      throw new DeliveryException("RabbitMQ publish to " + destination.describe() + " failed: " + ex.getMessage(), ex);
    }
  }

  @Override
  public void flush(Duration timeout) {
    Channel current = channel;
    if (current == null || !current.isOpen() || !connector.settings().publisherConfirms()) {
      return;
    }
    try {
      if (!current.waitForConfirms(timeout.toMillis())) {
        log.warn("Broker nacked outstanding publishes during flush");
      }
    } catch (TimeoutException ex) {
      log.warn("Outstanding confirms not received within {}", timeout);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while flushing publisher confirms");
    }
  }

  @Override
  public void close() {
    closeConnection();
    state = ConnectionState.DISCONNECTED;
  }

  TopologyReport topology() {
    return topology;
  }

  private Connection openAndProvision() throws IOException, TimeoutException {
    Connection opened = connector.newConnection("bridge-k2r");
    try {
      topology = AmqpTopology.declareForPublishing(opened, mappings);
      Channel created = opened.createChannel();
      if (connector.settings().publisherConfirms()) {
        created.confirmSelect();
      }
      created.addReturnListener(AmqpDestinationAdapter::logReturn);
      channel = created;
      return opened;
    } catch (IOException | RuntimeException ex) {
      opened.abort(CLOSE_TIMEOUT_MILLIS);
      throw ex;
    }
  }

  private static void logReturn(Return returned) {
    log.warn("Message returned as unroutable by exchange '{}' with routing key '{}': {} {}",
        returned.getExchange(), returned.getRoutingKey(), returned.getReplyCode(), returned.getReplyText());
  }

  private void closeConnection() {
    Connection current = connection;
    connection = null;
    channel = null;
    if (current != null && current.isOpen()) {
      try {
        current.close(CLOSE_TIMEOUT_MILLIS);
      } catch (IOException | ShutdownSignalException ex) {
        log.warn("Error closing RabbitMQ connection: {}", ex.getMessage());
      }
    }
  }
}
