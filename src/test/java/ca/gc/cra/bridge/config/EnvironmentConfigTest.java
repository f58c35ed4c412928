package ca.gc.cra.bridge.config;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Map;
import org.junit.jupiter.api.Test;

class EnvironmentConfigTest {

  @Test
  void translatesKnownVariablesAndSkipsBlankOnes() {
    Map<String, String> env = Map.of(
        "KAFKA_BOOTSTRAP_SERVERS", " kafka:9092 ",
        "RABBITMQ_PREFETCH", "20",
        "TOPIC_MAPPING", "{\"a\":\"b\"}",
        "RABBITMQ_VHOST", "  ",
        "PATH", "/usr/bin");

    Map<String, String> values = EnvironmentConfig.fromEnvironment(env);

    assertEquals(Map.of(
        "kafkaBootstrap", "kafka:9092",
        "prefetch", "20",
        "topicMapping", "{\"a\":\"b\"}"), values);
  }

  @Test
  void everyDocumentedVariableMapsToAKey() {
    assertEquals(26, ConfigKeys.ENVIRONMENT.size());
    assertEquals("mappings", ConfigKeys.ENVIRONMENT.get("REPLICATION_MAPPINGS"));
    assertEquals("config", ConfigKeys.ENVIRONMENT.get("BRIDGE_CONFIG"));
  }
}
