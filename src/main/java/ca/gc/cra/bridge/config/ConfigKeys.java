package ca.gc.cra.bridge.config;

import java.util.LinkedHashMap;
import java.util.Map;

/** Configuration keys and the environment variables that feed them. */
public final class ConfigKeys {
  public static final String KAFKA_BOOTSTRAP = "kafkaBootstrap";
  public static final String SOURCE_BOOTSTRAP = "sourceBootstrap";
  public static final String TARGET_BOOTSTRAP = "targetBootstrap";
  public static final String RABBIT_HOST = "rabbitHost";
  public static final String RABBIT_PORT = "rabbitPort";
  public static final String RABBIT_USERNAME = "rabbitUsername";
  public static final String RABBIT_PASSWORD = "rabbitPassword";
  public static final String RABBIT_VHOST = "rabbitVhost";
  public static final String MAPPINGS = "mappings";
  public static final String TOPIC_MAPPING = "topicMapping";
  public static final String CONSUMER_GROUP = "consumerGroup";
  public static final String PARTITION_STRATEGY = "partitionStrategy";
  public static final String START_POSITION = "startPosition";
  public static final String MAX_POLL_RECORDS = "maxPollRecords";
  public static final String PREFETCH = "prefetch";
  public static final String PUBLISHER_CONFIRMS = "publisherConfirms";
  public static final String HEARTBEAT_INTERVAL_SECONDS = "heartbeatIntervalSeconds";
  public static final String EMPTY_POLL_THRESHOLD = "emptyPollThreshold";
  public static final String DELIVERY_ATTEMPTS = "deliveryAttempts";
  public static final String REQUEUE_ON_FAILURE = "requeueOnFailure";
  public static final String HEALTH_PORT = "healthPort";
  public static final String HEALTH_ENABLED = "healthEnabled";
  public static final String CONFIG = "config";
  public static final String METRICS_EXPORTER = "metricsExporter";
  public static final String OTEL_ENDPOINT = "otelEndpoint";
  public static final String OTEL_RESOURCE_ATTRIBUTES = "otelResourceAttributes";

  /** Environment variable name to configuration key, in documentation order. */
  public static final Map<String, String> ENVIRONMENT = buildEnvironment();

  private ConfigKeys() {}

  private static Map<String, String> buildEnvironment() {
    Map<String, String> env = new LinkedHashMap<>();
    env.put("KAFKA_BOOTSTRAP_SERVERS", KAFKA_BOOTSTRAP);
    env.put("SOURCE_BOOTSTRAP_SERVERS", SOURCE_BOOTSTRAP);
    env.put("TARGET_BOOTSTRAP_SERVERS", TARGET_BOOTSTRAP);
    env.put("RABBITMQ_HOST", RABBIT_HOST);
    env.put("RABBITMQ_PORT", RABBIT_PORT);
    env.put("RABBITMQ_USERNAME", RABBIT_USERNAME);
    env.put("RABBITMQ_PASSWORD", RABBIT_PASSWORD);
    env.put("RABBITMQ_VHOST", RABBIT_VHOST);
    env.put("REPLICATION_MAPPINGS", MAPPINGS);
    env.put("TOPIC_MAPPING", TOPIC_MAPPING);
    env.put("CONSUMER_GROUP", CONSUMER_GROUP);
    env.put("PARTITION_STRATEGY", PARTITION_STRATEGY);
    env.put("START_POSITION", START_POSITION);
    env.put("MAX_POLL_RECORDS", MAX_POLL_RECORDS);
    env.put("RABBITMQ_PREFETCH", PREFETCH);
    env.put("RABBITMQ_PUBLISHER_CONFIRMS", PUBLISHER_CONFIRMS);
    env.put("HEARTBEAT_INTERVAL_SECONDS", HEARTBEAT_INTERVAL_SECONDS);
    env.put("EMPTY_POLL_THRESHOLD", EMPTY_POLL_THRESHOLD);
    env.put("DELIVERY_ATTEMPTS", DELIVERY_ATTEMPTS);
    env.put("REQUEUE_ON_FAILURE", REQUEUE_ON_FAILURE);
    env.put("HEALTH_PORT", HEALTH_PORT);
    env.put("HEALTH_ENABLED", HEALTH_ENABLED);
    env.put("BRIDGE_CONFIG", CONFIG);
    env.put("OTEL_METRICS_EXPORTER", METRICS_EXPORTER);
    env.put("OTEL_EXPORTER_OTLP_ENDPOINT", OTEL_ENDPOINT);
    env.put("OTEL_RESOURCE_ATTRIBUTES", OTEL_RESOURCE_ATTRIBUTES);
    return Map.copyOf(env);
  }
}
