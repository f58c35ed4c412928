package ca.gc.cra.bridge.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.bridge.adapter.amqp.AmqpDestinationAdapter;
import ca.gc.cra.bridge.adapter.amqp.AmqpSourceAdapter;
import ca.gc.cra.bridge.adapter.kafka.KafkaDestinationAdapter;
import ca.gc.cra.bridge.adapter.kafka.KafkaSourceAdapter;
import ca.gc.cra.bridge.application.pipeline.SupervisorState;
import ca.gc.cra.bridge.application.port.MetricsPort;
import ca.gc.cra.bridge.domain.route.Direction;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CompositionRootTest {

  @Test
  void k2rReadsKafkaAndPublishesToRabbit() {
    CompositionRoot root = root(Direction.K2R, Map.of(
        "mappings", "[{\"kafkaTopic\":\"orders\",\"rabbitmqExchange\":\"events\"}]"));

    assertInstanceOf(KafkaSourceAdapter.class, root.source());
    assertInstanceOf(AmqpDestinationAdapter.class, root.destination());
  }

  @Test
  void r2kReadsRabbitAndProducesToKafka() {
    CompositionRoot root = root(Direction.R2K, Map.of(
        "mappings", "[{\"rabbitmqQueue\":\"orders.q\",\"kafkaTopic\":\"orders\"}]"));

    assertInstanceOf(AmqpSourceAdapter.class, root.source());
    assertInstanceOf(KafkaDestinationAdapter.class, root.destination());
    assertTrue(root.destination().describe().contains("kafka:9092"));
  }

  @Test
  void logToLogUsesKafkaOnBothSides() {
    CompositionRoot root = root(Direction.T2S, Map.of(
        "sourceBootstrap", "src:9092",
        "targetBootstrap", "dr:9092",
        "topicMapping", "{\"orders\":\"orders-dr\"}"));

    assertTrue(root.source().describe().contains("dr:9092"));
    assertTrue(root.destination().describe().contains("src:9092"));
  }

  @Test
  void buildWiresARuntimeWithoutConnecting() {
    CompositionRoot root = root(Direction.K2R, Map.of(
        "mappings", "[{\"kafkaTopic\":\"orders\",\"rabbitmqQueue\":\"orders.q\"}]",
        "healthEnabled", "false"));

    try (BridgeRuntime runtime = root.build()) {
      assertEquals(SupervisorState.STARTING, runtime.state());
      assertTrue(runtime.health().isEmpty());
      assertEquals(0L, runtime.stats().snapshot().messagesProcessed());
    }
  }

  @Test
  void healthEndpointIsAttachedWhenEnabled() {
    CompositionRoot root = root(Direction.S2T, Map.of(
        "sourceBootstrap", "src:9092",
        "targetBootstrap", "dr:9092",
        "topicMapping", "{\"orders\":\"orders-dr\"}",
        "healthPort", "0"));

    try (BridgeRuntime runtime = root.build()) {
      assertTrue(runtime.health().isPresent());
    }
  }

  private static CompositionRoot root(Direction direction, Map<String, String> overrides) {
    Map<String, String> values = new HashMap<>(BridgeDefaults.asFlatMap(direction));
    values.putAll(overrides);
    return new CompositionRoot(BridgeConfig.fromMap(direction, values), () -> 1_000L, d -> MetricsPort.NO_OP);
  }
}
