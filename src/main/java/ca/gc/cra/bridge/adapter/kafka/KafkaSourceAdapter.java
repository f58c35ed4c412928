package ca.gc.cra.bridge.adapter.kafka;

import ca.gc.cra.bridge.application.port.ClockPort;
import ca.gc.cra.bridge.application.port.ConnectionException;
import ca.gc.cra.bridge.application.port.ConnectionState;
import ca.gc.cra.bridge.application.port.DeliveryException;
import ca.gc.cra.bridge.application.port.MessageSource;
import ca.gc.cra.bridge.domain.message.InFlightMessage;
import ca.gc.cra.bridge.domain.message.LogOrigin;
import ca.gc.cra.bridge.infrastructure.exec.RetryPolicy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.header.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MessageSource} reading raw bytes from Kafka topics.
 * <p><strong>Why:</strong> The bridge controls its own offsets: by default it assigns partitions
 * explicitly and never commits, so restarts tail the log instead of replaying a group's history.</p>
 * <p><strong>Role:</strong> Source adapter for {@code K2R}, {@code S2T} and {@code T2S}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Verify reachability through topic metadata, with bounded retry.</li>
 *   <li>Assign every (or the first) partition, seek to the end or the beginning, pin positions.</li>
 *   <li>Track the next offset per partition; commit it synchronously in consumer-group mode.</li>
 *   <li>Return to the configured start position on every reconnect; tracked offsets are only
 *       logged, never used to resume.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confined to the supervisor thread like the
 * underlying {@link Consumer}.</p>
 * <p><strong>Observability:</strong> Logs assignments and start offsets at INFO and dropped
 * messages at WARN; exposes per-partition lag through {@link #backlog()}.</p>
 *
 * @since 0.1.0
 */
public final class KafkaSourceAdapter implements MessageSource {
  private static final Logger log = LoggerFactory.getLogger(KafkaSourceAdapter.class);
  static final Duration METADATA_TIMEOUT = Duration.ofSeconds(10);
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  private final KafkaSourceOptions options;
  private final Supplier<Consumer<byte[], byte[]>> consumerFactory;
  private final RetryPolicy retry;
  private final ClockPort clock;
  private final Map<TopicPartition, Long> nextOffsets = new HashMap<>();
  private final Map<TopicPartition, OffsetAndMetadata> pendingCommits = new LinkedHashMap<>();

  private Consumer<byte[], byte[]> consumer;
  private volatile ConnectionState state = ConnectionState.DISCONNECTED;

  /**
   * Creates an adapter backed by a {@link KafkaConsumer}.
   *
   * @param options consumer settings
   * @param clientId client id reported to the brokers
   */
  public KafkaSourceAdapter(KafkaSourceOptions options, String clientId) {
    this(
        options,
        () -> new KafkaConsumer<>(KafkaProperties.consumer(options, clientId)),
        RetryPolicy.defaults(),
        ClockPort.SYSTEM);
  }

  KafkaSourceAdapter(
      KafkaSourceOptions options,
      Supplier<Consumer<byte[], byte[]>> consumerFactory,
      RetryPolicy retry,
      ClockPort clock) {
    this.options = Objects.requireNonNull(options, "options");
    this.consumerFactory = Objects.requireNonNull(consumerFactory, "consumerFactory");
    this.retry = Objects.requireNonNull(retry, "retry");
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
  }

  @Override
  public void connect() throws ConnectionException {
    state = ConnectionState.CONNECTING;
    try {
      consumer = retry.execute(describe(), this::openConsumer);
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
    if (consumer == null || state == ConnectionState.FAILED) {
      return false;
    }
    if (options.groupMode()) {
      return true;
    }
    try {
      if (consumer.assignment().isEmpty()) {
        log.warn("Consumer lost its partition assignment");
        state = ConnectionState.FAILED;
        return false;
      }
      return true;
    } catch (RuntimeException ex) {
      log.warn("Consumer health check failed: {}", ex.getMessage());
      state = ConnectionState.FAILED;
      return false;
    }
  }

  @Override
  public void reconnect() throws ConnectionException {
    closeConsumer();
    connect();
  }

  @Override
  public String describe() {
    return "kafka[" + options.bootstrapServers() + "] topics=" + options.topics();
  }

  @Override
  public List<InFlightMessage> poll(Duration timeout) {
    if (consumer == null) {
      throw new IllegalStateException("source is not connected");
    }
    commitPending();
    ConsumerRecords<byte[], byte[]> records;
    try {
      records = consumer.poll(timeout);
    } catch (KafkaException ex) {
      state = ConnectionState.FAILED;
      throw ex;
    }
    if (records.isEmpty()) {
      return List.of();
    }
    long now = clock.nowMillis();
    List<InFlightMessage> messages = new ArrayList<>(records.count());
    for (ConsumerRecord<byte[], byte[]> record : records) {
      messages.add(toMessage(record, now));
    }
    return messages;
  }

  @Override
  public void acknowledge(InFlightMessage message) throws DeliveryException {
    advance(message);
  }

  @Override
  public void reject(InFlightMessage message, boolean requeue) throws DeliveryException {
    log.warn("Dropping {} (a log source cannot redeliver; requeue={} ignored)",
        message.origin().coordinates(), requeue);
    advance(message);
  }

  @Override
  public Map<String, Long> backlog() {
    if (consumer == null) {
      return Map.of();
    }
    Set<TopicPartition> assignment = consumer.assignment();
    if (assignment.isEmpty()) {
      return Map.of();
    }
    Map<TopicPartition, Long> ends = consumer.endOffsets(assignment, METADATA_TIMEOUT);
    Map<String, Long> lag = new LinkedHashMap<>();
    assignment.stream()
        .sorted(Comparator.comparing(TopicPartition::topic).thenComparingInt(TopicPartition::partition))
        .forEach(tp -> {
          Long end = ends.get(tp);
          if (end != null) {
            lag.put(tp.toString(), Math.max(0L, end - consumer.position(tp, METADATA_TIMEOUT)));
          }
        });
    return lag;
  }

  @Override
  public boolean coordinatesSurviveReconnect() {
    return true;
  }

  @Override
  public void close() {
    closeConsumer();
    state = ConnectionState.DISCONNECTED;
  }

  Map<TopicPartition, Long> nextOffsets() {
    return Map.copyOf(nextOffsets);
  }

  private Consumer<byte[], byte[]> openConsumer() {
    Consumer<byte[], byte[]> created = consumerFactory.get();
    try {
      if (options.groupMode()) {
        for (String topic : options.topics()) {
          created.partitionsFor(topic, METADATA_TIMEOUT);
        }
        created.subscribe(options.topics(), new LoggingRebalanceListener());
        log.info("Subscribed to {} as group {}", options.topics(), options.consumerGroup().orElse(""));
      } else {
        assign(created);
      }
      return created;
    } catch (RuntimeException ex) {
      closeQuietly(created);
      throw ex;
    }
  }

  private void assign(Consumer<byte[], byte[]> target) {
    List<TopicPartition> partitions = new ArrayList<>();
    for (String topic : options.topics()) {
      List<PartitionInfo> infos = target.partitionsFor(topic, METADATA_TIMEOUT);
      if (infos == null || infos.isEmpty()) {
        log.warn("No metadata for topic {}; falling back to partition 0", topic);
        partitions.add(new TopicPartition(topic, 0));
        continue;
      }
      List<Integer> ids = infos.stream().map(PartitionInfo::partition).sorted().toList();
      if (options.partitionStrategy() == PartitionStrategy.FIRST) {
        ids = ids.subList(0, 1);
      }
      ids.forEach(id -> partitions.add(new TopicPartition(topic, id)));
    }
    target.assign(partitions);
    if (options.startPosition() == StartPosition.EARLIEST) {
      target.seekToBeginning(partitions);
    } else {
      target.seekToEnd(partitions);
    }
    for (TopicPartition tp : partitions) {
      long position = target.position(tp, METADATA_TIMEOUT);
      Long processed = nextOffsets.get(tp);
      if (processed != null && processed < position) {
        log.info("Assigned {} starting at offset {} (skipping {} records from offset {})",
            tp, position, position - processed, processed);
      } else {
        log.info("Assigned {} starting at offset {}", tp, position);
      }
    }
  }

  private InFlightMessage toMessage(ConsumerRecord<byte[], byte[]> record, long now) {
    Map<String, byte[]> headers = new LinkedHashMap<>();
    for (Header header : record.headers()) {
      if (header.value() != null) {
        headers.put(header.key(), header.value());
      }
    }
    return new InFlightMessage(
        new LogOrigin(record.topic(), record.partition(), record.offset()),
        record.key(),
        record.value(),
        headers,
        now);
  }

  private void advance(InFlightMessage message) throws DeliveryException {
    if (!(message.origin() instanceof LogOrigin origin)) {
      throw new DeliveryException("not a Kafka message: " + message.origin().coordinates());
    }
    TopicPartition tp = new TopicPartition(origin.topic(), origin.partition());
    long next = origin.offset() + 1;
    nextOffsets.merge(tp, next, Math::max);
    if (options.groupMode()) {
      pendingCommits.merge(tp, new OffsetAndMetadata(next),
          (current, candidate) -> candidate.offset() > current.offset() ? candidate : current);
    }
  }

  private void commitPending() {
    if (pendingCommits.isEmpty() || consumer == null) {
      return;
    }
    try {
      consumer.commitSync(Map.copyOf(pendingCommits));
      log.debug("Committed offsets {}", pendingCommits);
      pendingCommits.clear();
    } catch (KafkaException ex) {
      log.warn("Offset commit failed; will retry after the next batch: {}", ex.getMessage());
    }
  }

  private void closeConsumer() {
    if (consumer == null) {
      return;
    }
    commitPending();
    closeQuietly(consumer);
    consumer = null;
  }

  private static void closeQuietly(Consumer<byte[], byte[]> target) {
    try {
      target.close(CLOSE_TIMEOUT);
    } catch (RuntimeException ex) {
      log.warn("Error closing Kafka consumer: {}", ex.getMessage());
    }
  }

  private static final class LoggingRebalanceListener implements ConsumerRebalanceListener {
    @Override
    public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
      log.info("Partitions revoked: {}", partitions);
    }

    @Override
    public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
      log.info("Partitions assigned: {}", partitions);
    }
  }
}
