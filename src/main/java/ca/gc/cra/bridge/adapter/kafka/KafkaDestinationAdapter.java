package ca.gc.cra.bridge.adapter.kafka;

import ca.gc.cra.bridge.application.port.ConnectionException;
import ca.gc.cra.bridge.application.port.ConnectionState;
import ca.gc.cra.bridge.application.port.DeliveryException;
import ca.gc.cra.bridge.application.port.MessageDestination;
import ca.gc.cra.bridge.domain.message.Destination;
import ca.gc.cra.bridge.domain.message.OutboundMessage;
import ca.gc.cra.bridge.infrastructure.exec.RetryPolicy;
import ca.gc.cra.bridge.validation.Net;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.errors.AuthenticationException;
import org.apache.kafka.common.errors.AuthorizationException;
import org.apache.kafka.common.errors.OutOfOrderSequenceException;
import org.apache.kafka.common.errors.ProducerFencedException;
import org.apache.kafka.common.errors.UnsupportedVersionException;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MessageDestination} producing to Kafka topics with idempotent,
 * fully acknowledged sends.
 * <p><strong>Why:</strong> The source message is only resolved after Kafka confirmed the record, so
 * every publish waits on its send future.</p>
 * <p><strong>Role:</strong> Destination adapter for {@code R2K}, {@code S2T} and {@code T2S}.</p>
 * <p><strong>Thread-safety:</strong> Mirrors the provided {@link Producer}; the bridge only calls it
 * from the supervisor thread.</p>
 * <p><strong>Performance:</strong> One record in flight per connection keeps partition order; the
 * 5&nbsp;ms linger still allows small batches.</p>
 *
 * @since 0.1.0
 */
public final class KafkaDestinationAdapter implements MessageDestination {
  private static final Logger log = LoggerFactory.getLogger(KafkaDestinationAdapter.class);
  public static final Duration PRODUCE_TIMEOUT = Duration.ofSeconds(30);
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  private final String bootstrapServers;
  private final List<String> topics;
  private final Supplier<Producer<byte[], byte[]>> producerFactory;
  private final RetryPolicy retry;
  private final Duration produceTimeout;

  private Producer<byte[], byte[]> producer;
  private volatile ConnectionState state = ConnectionState.DISCONNECTED;

  /**
   * Creates an adapter backed by a {@link KafkaProducer}.
   *
   * @param bootstrapServers comma-separated bootstrap list
   * @param topics destination topics whose metadata is checked on connect
   * @param clientId client id reported to the brokers
   */
  public KafkaDestinationAdapter(String bootstrapServers, List<String> topics, String clientId) {
    this(
        bootstrapServers,
        topics,
        () -> new KafkaProducer<>(KafkaProperties.producer(bootstrapServers, clientId)),
        RetryPolicy.defaults(),
        PRODUCE_TIMEOUT);
  }

  KafkaDestinationAdapter(
      String bootstrapServers,
      List<String> topics,
      Supplier<Producer<byte[], byte[]>> producerFactory,
      RetryPolicy retry,
      Duration produceTimeout) {
    this.bootstrapServers = Net.validateBootstrapServers("bootstrapServers", bootstrapServers);
    this.topics = List.copyOf(Objects.requireNonNull(topics, "topics"));
    this.producerFactory = Objects.requireNonNull(producerFactory, "producerFactory");
    this.retry = Objects.requireNonNull(retry, "retry");
    this.produceTimeout = Objects.requireNonNull(produceTimeout, "produceTimeout");
  }

  @Override
  public void connect() throws ConnectionException {
    state = ConnectionState.CONNECTING;
    try {
      producer = retry.execute(describe(), this::openProducer);
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
    return producer != null && state == ConnectionState.CONNECTED;
  }

  @Override
  public void reconnect() throws ConnectionException {
    closeProducer(CLOSE_TIMEOUT);
    connect();
  }

  @Override
  public String describe() {
    return "kafka[" + bootstrapServers + "]";
  }

  @Override
  public void publish(OutboundMessage message) throws DeliveryException {
    Objects.requireNonNull(message, "message");
    Destination destination = message.destination();
    if (destination.kind() != Destination.Kind.TOPIC) {
      throw new DeliveryException("Kafka cannot publish to " + destination.describe());
    }
    if (producer == null) {
      throw new DeliveryException("producer is not connected");
    }
    RecordHeaders headers = new RecordHeaders();
    for (Map.Entry<String, byte[]> header : message.headers().entrySet()) {
      headers.add(new RecordHeader(header.getKey(), header.getValue()));
    }
    ProducerRecord<byte[], byte[]> record =
        new ProducerRecord<>(destination.name(), null, message.key(), message.payload(), headers);
    try {
      RecordMetadata metadata = producer.send(record).get(produceTimeout.toMillis(), TimeUnit.MILLISECONDS);
      log.debug("Produced {} to {}-{}@{}",
          message.replicationId(), metadata.topic(), metadata.partition(), metadata.offset());
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
      markFailedIfFatal(cause);
      throw new DeliveryException("Kafka rejected record for " + destination.name() + ": " + cause.getMessage(), cause);
    } catch (TimeoutException ex) {
      throw new DeliveryException(
          "Kafka did not confirm record for " + destination.name() + " within " + produceTimeout, ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new DeliveryException("Interrupted while waiting for Kafka confirmation", ex);
    } catch (KafkaException ex) {
      markFailedIfFatal(ex);
      throw new DeliveryException("Kafka send failed for " + destination.name() + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Sends buffered records, waiting at most {@code timeout}.
   *
   * <p>{@link Producer#flush()} cannot be bounded, so the producer is closed with the timeout
   * instead; records still unsent when it expires are aborted. A later publish needs
   * {@link #reconnect()}.</p>
   *
   * @param timeout maximum wait
   */
  @Override
  public void flush(Duration timeout) {
    if (producer != null) {
      closeProducer(Objects.requireNonNull(timeout, "timeout"));
      state = ConnectionState.DISCONNECTED;
    }
  }

  @Override
  public void close() {
    closeProducer(CLOSE_TIMEOUT);
    state = ConnectionState.DISCONNECTED;
  }

  private void markFailedIfFatal(Throwable cause) {
    if (isFatal(cause)) {
      log.error("Kafka producer cannot recover from {}; marking it failed", cause.getClass().getSimpleName());
      state = ConnectionState.FAILED;
    }
  }

  /** Errors after which the producer must be closed, as listed by {@link Producer#send}. */
  static boolean isFatal(Throwable cause) {
    return cause instanceof ProducerFencedException
        || cause instanceof OutOfOrderSequenceException
        || cause instanceof UnsupportedVersionException
        || cause instanceof AuthorizationException
        || cause instanceof AuthenticationException;
  }

  private Producer<byte[], byte[]> openProducer() {
    Producer<byte[], byte[]> created = producerFactory.get();
    try {
      for (String topic : topics) {
        List<PartitionInfo> partitions = created.partitionsFor(topic);
        log.info("Destination topic {} has {} partition(s)", topic, partitions == null ? 0 : partitions.size());
      }
      return created;
    } catch (RuntimeException ex) {
      closeQuietly(created, CLOSE_TIMEOUT);
      throw ex;
    }
  }

  private void closeProducer(Duration timeout) {
    if (producer == null) {
      return;
    }
    closeQuietly(producer, timeout);
    producer = null;
  }

  private static void closeQuietly(Producer<byte[], byte[]> target, Duration timeout) {
    try {
      target.close(timeout);
    } catch (RuntimeException ex) {
      log.warn("Error closing Kafka producer: {}", ex.getMessage());
    }
  }
}
