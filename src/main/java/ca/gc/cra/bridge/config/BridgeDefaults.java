package ca.gc.cra.bridge.config;

import ca.gc.cra.bridge.adapter.amqp.AmqpSettings;
import ca.gc.cra.bridge.adapter.kafka.KafkaSourceOptions;
import ca.gc.cra.bridge.adapter.kafka.PartitionStrategy;
import ca.gc.cra.bridge.adapter.kafka.StartPosition;
import ca.gc.cra.bridge.application.pipeline.SupervisorSettings;
import ca.gc.cra.bridge.domain.route.Direction;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each replication direction.
 *
 * <p>The defaults are the single source of truth for optional keys; YAML, environment and CLI
 * values are layered on top by {@link ConfigMerger}.</p>
 */
public final class BridgeDefaults {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private BridgeDefaults() {}

  /**
   * Returns the defaults for {@code direction} merged with common defaults.
   *
   * @param direction replication direction
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(Direction direction) {
    Objects.requireNonNull(direction, "direction");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    if (direction.isLogToLog()) {
      defaults.putAll(buildLogToLogDefaults());
    } else {
      defaults.putAll(buildCrossBrokerDefaults());
    }
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put(ConfigKeys.PARTITION_STRATEGY, PartitionStrategy.ALL.name());
    map.put(ConfigKeys.START_POSITION, StartPosition.LATEST.name());
    map.put(ConfigKeys.MAX_POLL_RECORDS, Integer.toString(KafkaSourceOptions.DEFAULT_MAX_POLL_RECORDS));
    map.put(ConfigKeys.HEARTBEAT_INTERVAL_SECONDS,
        Long.toString(SupervisorSettings.DEFAULT_HEARTBEAT_INTERVAL.toSeconds()));
    map.put(ConfigKeys.EMPTY_POLL_THRESHOLD, Integer.toString(SupervisorSettings.DEFAULT_EMPTY_POLL_THRESHOLD));
    map.put(ConfigKeys.DELIVERY_ATTEMPTS, Integer.toString(SupervisorSettings.DEFAULT_DELIVERY_ATTEMPTS));
    map.put(ConfigKeys.REQUEUE_ON_FAILURE, "true");
    map.put(ConfigKeys.HEALTH_ENABLED, "true");
    map.put(ConfigKeys.HEALTH_PORT, "8080");
    map.put(ConfigKeys.METRICS_EXPORTER, "none");
    map.put(ConfigKeys.OTEL_ENDPOINT, "");
    map.put(ConfigKeys.OTEL_RESOURCE_ATTRIBUTES, "");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildCrossBrokerDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put(ConfigKeys.KAFKA_BOOTSTRAP, "kafka:9092");
    map.put(ConfigKeys.RABBIT_HOST, "rabbitmq");
    map.put(ConfigKeys.RABBIT_PORT, Integer.toString(AmqpSettings.DEFAULT_PORT));
    map.put(ConfigKeys.RABBIT_USERNAME, "user");
    map.put(ConfigKeys.RABBIT_PASSWORD, "password");
    map.put(ConfigKeys.RABBIT_VHOST, "/");
    map.put(ConfigKeys.PREFETCH, Integer.toString(AmqpSettings.DEFAULT_PREFETCH));
    map.put(ConfigKeys.PUBLISHER_CONFIRMS, "true");
    return map;
  }

  private static Map<String, String> buildLogToLogDefaults() {
    return Map.of();
  }
}
