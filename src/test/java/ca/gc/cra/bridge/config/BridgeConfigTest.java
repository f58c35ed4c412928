package ca.gc.cra.bridge.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.bridge.adapter.amqp.AmqpSettings;
import ca.gc.cra.bridge.adapter.kafka.KafkaSourceOptions;
import ca.gc.cra.bridge.adapter.kafka.PartitionStrategy;
import ca.gc.cra.bridge.adapter.kafka.StartPosition;
import ca.gc.cra.bridge.application.pipeline.SupervisorSettings;
import ca.gc.cra.bridge.domain.route.Direction;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class BridgeConfigTest {
  private static final String MAPPINGS = "[{\"kafkaTopic\":\"orders\",\"rabbitmqExchange\":\"events\","
      + "\"rabbitmqQueue\":\"orders.q\",\"rabbitmqRoutingKey\":\"orders.created\"}]";

  @Test
  void k2rUsesDefaultsForEverythingOptional() {
    BridgeConfig config = BridgeConfig.fromMap(Direction.K2R, values(Direction.K2R, Map.of("mappings", MAPPINGS)));

    assertEquals("kafka:9092", config.consumeBootstrap());
    AmqpSettings amqp = config.amqp().orElseThrow();
    assertEquals("rabbitmq", amqp.host());
    assertEquals(5672, amqp.port());
    assertEquals("/", amqp.virtualHost());
    assertEquals(100, amqp.prefetch());
    assertTrue(amqp.publisherConfirms());
    assertEquals(PartitionStrategy.ALL, config.partitionStrategy());
    assertEquals(StartPosition.LATEST, config.startPosition());
    assertEquals(SupervisorSettings.LOG_POLL_TIMEOUT, config.supervisor().pollTimeout());
    assertEquals(3, config.supervisor().deliveryAttempts());
    assertTrue(config.healthEnabled());
    assertEquals(8080, config.healthPort());

    KafkaSourceOptions options = config.kafkaSourceOptions();
    assertEquals(List.of("orders"), options.topics());
    assertFalse(options.groupMode());
  }

  @Test
  void r2kPollsQueuesWithShortTimeoutAndProducesToKafka() {
    Map<String, String> overrides = Map.of(
        "mappings", "[{\"rabbitmqQueue\":\"orders.q\",\"kafkaTopic\":\"orders\"},"
            + "{\"rabbitmqQueue\":\"audit.q\",\"kafkaTopic\":\"orders\"}]",
        "kafkaBootstrap", "broker-1:9092,broker-2:9092",
        "requeueOnFailure", "false",
        "heartbeatIntervalSeconds", "15");

    BridgeConfig config = BridgeConfig.fromMap(Direction.R2K, values(Direction.R2K, overrides));

    assertEquals(SupervisorSettings.QUEUE_POLL_TIMEOUT, config.supervisor().pollTimeout());
    assertEquals("broker-1:9092,broker-2:9092", config.produceBootstrap());
    assertEquals(List.of("orders"), config.destinationTopics());
    assertEquals(List.of("orders.q", "audit.q"), config.routes().sourceIds());
    assertFalse(config.supervisor().requeueOnFailure());
    assertEquals(Duration.ofSeconds(15), config.supervisor().heartbeatInterval());
    assertThrows(IllegalStateException.class, config::consumeBootstrap);
  }

  @Test
  void logToLogDirectionsPickClustersByDirection() {
    Map<String, String> overrides = Map.of(
        "sourceBootstrap", "src:9092",
        "targetBootstrap", "dr:9092",
        "topicMapping", "{\"orders\":\"orders-replica\"}",
        "consumerGroup", "bridge-dr",
        "startPosition", "earliest");

    BridgeConfig forward = BridgeConfig.fromMap(Direction.S2T, values(Direction.S2T, overrides));
    BridgeConfig back = BridgeConfig.fromMap(Direction.T2S, values(Direction.T2S, overrides));

    assertEquals("src:9092", forward.consumeBootstrap());
    assertEquals("dr:9092", forward.produceBootstrap());
    assertEquals(List.of("orders"), forward.kafkaSourceOptions().topics());
    assertEquals(List.of("orders-replica"), forward.destinationTopics());
    assertEquals("dr:9092", back.consumeBootstrap());
    assertEquals("src:9092", back.produceBootstrap());
    assertEquals(List.of("orders-replica"), back.kafkaSourceOptions().topics());
    assertEquals(List.of("orders"), back.destinationTopics());
    assertEquals(Optional.of("bridge-dr"), forward.consumerGroup());
    assertEquals(StartPosition.EARLIEST, forward.startPosition());
    assertTrue(forward.amqp().isEmpty());
  }

  @Test
  void invalidValuesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> BridgeConfig.fromMap(
        Direction.K2R, values(Direction.K2R, Map.of("mappings", MAPPINGS, "prefetch", "0"))));
    assertThrows(IllegalArgumentException.class, () -> BridgeConfig.fromMap(
        Direction.K2R, values(Direction.K2R, Map.of("mappings", MAPPINGS, "rabbitPort", "99999"))));
    assertThrows(IllegalArgumentException.class, () -> BridgeConfig.fromMap(
        Direction.K2R, values(Direction.K2R, Map.of("mappings", MAPPINGS, "partitionStrategy", "RANDOM"))));
    assertThrows(IllegalArgumentException.class, () -> BridgeConfig.fromMap(
        Direction.K2R, values(Direction.K2R, Map.of("mappings", MAPPINGS, "kafkaBootstrap", "kafka"))));
    assertThrows(IllegalArgumentException.class, () -> BridgeConfig.fromMap(
        Direction.K2R, values(Direction.K2R, Map.of("mappings", MAPPINGS, "deliveryAttempts", "0"))));
  }

  @Test
  void planNeverShowsPassword() {
    BridgeConfig config = BridgeConfig.fromMap(
        Direction.K2R, values(Direction.K2R, Map.of("mappings", MAPPINGS, "rabbitPassword", "s3cr3t-value")));

    List<String> plan = config.planLines();

    assertTrue(plan.stream().noneMatch(line -> line.contains("s3cr3t-value")));
    assertTrue(plan.stream().anyMatch(line -> line.contains("orders -> exchange:events[orders.created]")));
    assertTrue(plan.get(0).startsWith("direction: K2R"));
  }

  private static Map<String, String> values(Direction direction, Map<String, String> overrides) {
    Map<String, String> values = new HashMap<>(BridgeDefaults.asFlatMap(direction));
    values.putAll(overrides);
    return values;
  }
}
