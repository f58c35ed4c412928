package ca.gc.cra.bridge.config;

import ca.gc.cra.bridge.adapter.amqp.AmqpSettings;
import ca.gc.cra.bridge.adapter.kafka.KafkaSourceOptions;
import ca.gc.cra.bridge.adapter.kafka.PartitionStrategy;
import ca.gc.cra.bridge.adapter.kafka.StartPosition;
import ca.gc.cra.bridge.application.pipeline.SupervisorSettings;
import ca.gc.cra.bridge.domain.route.Direction;
import ca.gc.cra.bridge.domain.route.MappingTable;
import ca.gc.cra.bridge.domain.route.ReplicationMapping;
import ca.gc.cra.bridge.domain.route.Route;
import ca.gc.cra.bridge.validation.Net;
import ca.gc.cra.bridge.validation.Numbers;
import ca.gc.cra.bridge.validation.Strings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Typed, validated configuration for one bridge process.
 * <p><strong>Why:</strong> Every operator input is checked once at startup so that a bad value fails
 * fast with exit code 1 instead of surfacing as a broker error later.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@link CompositionRoot}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build the route table for the direction from {@code mappings} or {@code topicMapping}.</li>
 *   <li>Resolve which Kafka cluster is consumed and which is produced to.</li>
 *   <li>Describe the resolved plan for {@code --dry-run}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable once constructed; safe for concurrent reads.</p>
 *
 * @param direction replication direction
 * @param routes validated route table
 * @param kafkaBootstrap Kafka cluster for K2R and R2K
 * @param sourceBootstrap source cluster for S2T and T2S
 * @param targetBootstrap target cluster for S2T and T2S
 * @param amqp RabbitMQ settings for K2R and R2K
 * @param consumerGroup optional Kafka consumer group; absent means explicit assignment
 * @param partitionStrategy which partitions of each topic are assigned
 * @param startPosition where a fresh assignment starts reading
 * @param maxPollRecords maximum records per Kafka poll
 * @param supervisor supervisor loop timings
 * @param healthEnabled whether the health endpoint is served
 * @param healthPort health endpoint port
 * @since 0.1.0
 */
public record BridgeConfig(
    Direction direction,
    MappingTable routes,
    Optional<String> kafkaBootstrap,
    Optional<String> sourceBootstrap,
    Optional<String> targetBootstrap,
    Optional<AmqpSettings> amqp,
    Optional<String> consumerGroup,
    PartitionStrategy partitionStrategy,
    StartPosition startPosition,
    int maxPollRecords,
    SupervisorSettings supervisor,
    boolean healthEnabled,
    int healthPort) {

  private static final int MAX_HEARTBEAT_SECONDS = 86_400;
  private static final int MAX_DELIVERY_ATTEMPTS = 100;

  public BridgeConfig {
    Objects.requireNonNull(direction, "direction");
    Objects.requireNonNull(routes, "routes");
    kafkaBootstrap = Objects.requireNonNullElse(kafkaBootstrap, Optional.empty());
    sourceBootstrap = Objects.requireNonNullElse(sourceBootstrap, Optional.empty());
    targetBootstrap = Objects.requireNonNullElse(targetBootstrap, Optional.empty());
    amqp = Objects.requireNonNullElse(amqp, Optional.empty());
    consumerGroup = Objects.requireNonNullElse(consumerGroup, Optional.empty());
    Objects.requireNonNull(partitionStrategy, "partitionStrategy");
    Objects.requireNonNull(startPosition, "startPosition");
    Objects.requireNonNull(supervisor, "supervisor");
    if (routes.direction() != direction) {
      throw new IllegalArgumentException("route table was built for " + routes.direction() + ", not " + direction);
    }
    if (direction.isLogToLog()) {
      require(sourceBootstrap, ConfigKeys.SOURCE_BOOTSTRAP, direction);
      require(targetBootstrap, ConfigKeys.TARGET_BOOTSTRAP, direction);
    } else {
      require(kafkaBootstrap, ConfigKeys.KAFKA_BOOTSTRAP, direction);
      if (amqp.isEmpty()) {
        throw new IllegalArgumentException("RabbitMQ settings are required for " + direction);
      }
    }
  }

  /**
   * Builds the configuration from an effective flat map, as produced by {@link ConfigMerger}.
   *
   * @param direction replication direction
   * @param values merged key/value pairs
   * @return validated configuration
   * @throws IllegalArgumentException when any value is missing or invalid
   */
  public static BridgeConfig fromMap(Direction direction, Map<String, String> values) {
    Objects.requireNonNull(direction, "direction");
    Objects.requireNonNull(values, "values");
    MappingParser parser = new MappingParser();

    List<ReplicationMapping> mappings = direction.isLogToLog()
        ? parser.parseTopicMapping(values.get(ConfigKeys.TOPIC_MAPPING))
        : parser.parseMappings(values.get(ConfigKeys.MAPPINGS));
    MappingTable routes = MappingTable.forDirection(direction, mappings);

    Optional<String> kafkaBootstrap = Optional.empty();
    Optional<String> sourceBootstrap = Optional.empty();
    Optional<String> targetBootstrap = Optional.empty();
    Optional<AmqpSettings> amqp = Optional.empty();
    if (direction.isLogToLog()) {
      sourceBootstrap = optional(values, ConfigKeys.SOURCE_BOOTSTRAP)
          .map(raw -> Net.validateBootstrapServers(ConfigKeys.SOURCE_BOOTSTRAP, raw));
      targetBootstrap = optional(values, ConfigKeys.TARGET_BOOTSTRAP)
          .map(raw -> Net.validateBootstrapServers(ConfigKeys.TARGET_BOOTSTRAP, raw));
    } else {
      kafkaBootstrap = optional(values, ConfigKeys.KAFKA_BOOTSTRAP)
          .map(raw -> Net.validateBootstrapServers(ConfigKeys.KAFKA_BOOTSTRAP, raw));
      amqp = Optional.of(amqpSettings(values));
    }

    Optional<String> consumerGroup = optional(values, ConfigKeys.CONSUMER_GROUP);
    PartitionStrategy partitionStrategy = PartitionStrategy.parse(values.get(ConfigKeys.PARTITION_STRATEGY));
    StartPosition startPosition = StartPosition.parse(values.get(ConfigKeys.START_POSITION));
    int maxPollRecords = Numbers.parseBoundedInt(
        values, ConfigKeys.MAX_POLL_RECORDS, KafkaSourceOptions.DEFAULT_MAX_POLL_RECORDS, 1, 10_000);

    Duration pollTimeout = direction.source() == Direction.BrokerKind.RABBITMQ
        ? SupervisorSettings.QUEUE_POLL_TIMEOUT
        : SupervisorSettings.LOG_POLL_TIMEOUT;
    SupervisorSettings supervisor = new SupervisorSettings(
        pollTimeout,
        Duration.ofSeconds(Numbers.parseBoundedInt(
            values,
            ConfigKeys.HEARTBEAT_INTERVAL_SECONDS,
            (int) SupervisorSettings.DEFAULT_HEARTBEAT_INTERVAL.toSeconds(),
            1,
            MAX_HEARTBEAT_SECONDS)),
        Numbers.parseBoundedInt(
            values, ConfigKeys.EMPTY_POLL_THRESHOLD, SupervisorSettings.DEFAULT_EMPTY_POLL_THRESHOLD, 1, 1_000_000),
        Numbers.parseBoundedInt(
            values, ConfigKeys.DELIVERY_ATTEMPTS, SupervisorSettings.DEFAULT_DELIVERY_ATTEMPTS, 1, MAX_DELIVERY_ATTEMPTS),
        SupervisorSettings.DEFAULT_RETRY_PAUSE,
        Numbers.parseBoolean(values, ConfigKeys.REQUEUE_ON_FAILURE, true),
        SupervisorSettings.DEFAULT_ERROR_PAUSE,
        SupervisorSettings.DEFAULT_FLUSH_TIMEOUT);

    boolean healthEnabled = Numbers.parseBoolean(values, ConfigKeys.HEALTH_ENABLED, true);
    int healthPort = Numbers.parseBoundedInt(values, ConfigKeys.HEALTH_PORT, 8080, 0, 65_535);

    return new BridgeConfig(
        direction,
        routes,
        kafkaBootstrap,
        sourceBootstrap,
        targetBootstrap,
        amqp,
        consumerGroup,
        partitionStrategy,
        startPosition,
        maxPollRecords,
        supervisor,
        healthEnabled,
        healthPort);
  }

  /**
   * Kafka cluster the bridge consumes from.
   *
   * @return bootstrap list
   * @throws IllegalStateException for R2K, which consumes from RabbitMQ
   */
  public String consumeBootstrap() {
    return switch (direction) {
      case K2R -> kafkaBootstrap.orElseThrow();
      case S2T -> sourceBootstrap.orElseThrow();
      case T2S -> targetBootstrap.orElseThrow();
      case R2K -> throw new IllegalStateException("R2K does not consume from Kafka");
    };
  }

  /**
   * Kafka cluster the bridge produces to.
   *
   * @return bootstrap list
   * @throws IllegalStateException for K2R, which publishes to RabbitMQ
   */
  public String produceBootstrap() {
    return switch (direction) {
      case R2K -> kafkaBootstrap.orElseThrow();
      case S2T -> targetBootstrap.orElseThrow();
      case T2S -> sourceBootstrap.orElseThrow();
      case K2R -> throw new IllegalStateException("K2R does not produce to Kafka");
    };
  }

  /** Consumer options for directions that read from Kafka. */
  public KafkaSourceOptions kafkaSourceOptions() {
    return new KafkaSourceOptions(
        consumeBootstrap(), routes.sourceIds(), partitionStrategy, startPosition, consumerGroup, maxPollRecords);
  }

  /** Destination topics for directions that write to Kafka, in route order without duplicates. */
  public List<String> destinationTopics() {
    List<String> topics = new ArrayList<>();
    for (Route route : routes.routes()) {
      String topic = route.destination().name();
      if (!topics.contains(topic)) {
        topics.add(topic);
      }
    }
    return List.copyOf(topics);
  }

  /**
   * Human-readable plan printed by {@code --dry-run}. Secrets are never included.
   *
   * @return plan lines
   */
  public List<String> planLines() {
    List<String> lines = new ArrayList<>();
    lines.add("direction: " + direction + " (" + direction.description() + ")");
    if (direction.isLogToLog()) {
      lines.add("consume: kafka[" + consumeBootstrap() + "]");
      lines.add("produce: kafka[" + produceBootstrap() + "]");
    } else if (direction == Direction.K2R) {
      lines.add("consume: kafka[" + consumeBootstrap() + "]");
      lines.add("publish: " + amqp.orElseThrow().describe());
    } else {
      lines.add("consume: " + amqp.orElseThrow().describe());
      lines.add("produce: kafka[" + produceBootstrap() + "]");
    }
    if (direction.source() == Direction.BrokerKind.KAFKA) {
      lines.add("assignment: " + consumerGroup.map(group -> "group " + group).orElse("explicit")
          + ", partitions=" + partitionStrategy + ", start=" + startPosition
          + ", maxPollRecords=" + maxPollRecords);
    } else {
      lines.add("prefetch: " + amqp.orElseThrow().prefetch()
          + ", publisherConfirms=" + amqp.orElseThrow().publisherConfirms());
    }
    lines.add("routes (" + routes.size() + "):");
    for (Route route : routes.routes()) {
      lines.add("  " + route);
    }
    lines.add("timings: poll=" + supervisor.pollTimeout().toMillis() + "ms"
        + ", heartbeat=" + supervisor.heartbeatInterval().toSeconds() + "s"
        + ", emptyPollThreshold=" + supervisor.emptyPollThreshold()
        + ", deliveryAttempts=" + supervisor.deliveryAttempts()
        + ", requeueOnFailure=" + supervisor.requeueOnFailure());
    lines.add("health: " + (healthEnabled ? "port " + healthPort : "disabled"));
    return List.copyOf(lines);
  }

  private static AmqpSettings amqpSettings(Map<String, String> values) {
    String portRaw = values.get(ConfigKeys.RABBIT_PORT);
    int port = portRaw == null || portRaw.isBlank()
        ? AmqpSettings.DEFAULT_PORT
        : Net.parsePort(ConfigKeys.RABBIT_PORT, portRaw);
    return AmqpSettings.of(
        Strings.requireNonBlank(ConfigKeys.RABBIT_HOST, values.get(ConfigKeys.RABBIT_HOST)),
        port,
        Strings.requireNonBlank(ConfigKeys.RABBIT_USERNAME, values.get(ConfigKeys.RABBIT_USERNAME)),
        Objects.requireNonNullElse(values.get(ConfigKeys.RABBIT_PASSWORD), ""),
        Strings.requireNonBlank(ConfigKeys.RABBIT_VHOST, values.get(ConfigKeys.RABBIT_VHOST)),
        Numbers.parseBoundedInt(values, ConfigKeys.PREFETCH, AmqpSettings.DEFAULT_PREFETCH, 1, 65_535),
        Numbers.parseBoolean(values, ConfigKeys.PUBLISHER_CONFIRMS, true));
  }

  private static Optional<String> optional(Map<String, String> values, String key) {
    return Optional.ofNullable(Strings.trimToNull(values.get(key)));
  }

  private static void require(Optional<String> value, String key, Direction direction) {
    if (value.isEmpty()) {
      throw new IllegalArgumentException(key + " is required for " + direction);
    }
  }
}
