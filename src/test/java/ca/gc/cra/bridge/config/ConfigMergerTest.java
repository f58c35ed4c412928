package ca.gc.cra.bridge.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.bridge.domain.route.Direction;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {
  private static final String MAPPINGS = "[{\"kafkaTopic\":\"orders\",\"rabbitmqExchange\":\"events\"}]";

  @Test
  void precedenceIsCliThenYamlThenEnvironmentThenDefaults() {
    Map<String, String> defaults = Map.of("kafkaBootstrap", "kafka:9092", "prefetch", "100", "healthPort", "8080");
    Map<String, String> environment = Map.of("prefetch", "50", "mappings", MAPPINGS, "healthPort", "9000");
    Map<String, String> yaml = Map.of("prefetch", "25", "healthPort", "9100");
    Map<String, String> cli = Map.of("healthPort", "9200");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Direction.K2R, Optional.of(yaml), environment, cli, defaults, warnings::add);

    assertEquals("kafka:9092", merged.get("kafkaBootstrap"));
    assertEquals("25", merged.get("prefetch"));
    assertEquals("9200", merged.get("healthPort"));
    assertEquals(MAPPINGS, merged.get("mappings"));
    assertEquals(List.of("CLI overrides YAML for key: healthPort"), warnings);
  }

  @Test
  void crossBrokerDirectionsRequireMappings() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            Direction.R2K,
            Optional.empty(),
            Map.of(),
            Map.of(),
            BridgeDefaults.asFlatMap(Direction.R2K),
            msg -> { }));
    assertTrue(ex.getMessage().contains("REPLICATION_MAPPINGS"));
  }

  @Test
  void logToLogDirectionsRequireBothClustersAndTopicMapping() {
    Map<String, String> env = Map.of("sourceBootstrap", "src:9092", "topicMapping", "{\"a\":\"b\"}");

    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            Direction.S2T, Optional.empty(), env, Map.of(), BridgeDefaults.asFlatMap(Direction.S2T), msg -> { }));
    assertTrue(ex.getMessage().contains("targetBootstrap"));
  }
}
