package ca.gc.cra.bridge.config;

import ca.gc.cra.bridge.application.json.JsonSupport;
import ca.gc.cra.bridge.domain.route.ReplicationMapping;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the JSON route tables accepted by the bridge.
 *
 * <p>{@code REPLICATION_MAPPINGS} is an array of objects with the fields {@code kafkaTopic},
 * {@code rabbitmqExchange}, {@code rabbitmqExchangeType}, {@code rabbitmqQueue} and
 * {@code rabbitmqRoutingKey}. {@code TOPIC_MAPPING} is an object of source topic to target topic.</p>
 */
public final class MappingParser {
  private static final Logger log = LoggerFactory.getLogger(MappingParser.class);
  private static final Set<String> KNOWN_FIELDS = Set.of(
      "kafkaTopic", "targetTopic", "rabbitmqExchange", "rabbitmqExchangeType", "rabbitmqQueue", "rabbitmqRoutingKey");

  private final JsonSupport json;

  public MappingParser() {
    this(new JsonSupport());
  }

  MappingParser(JsonSupport json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  /**
   * Parses a JSON array of mapping objects.
   *
   * @param raw JSON text
   * @return mappings in declaration order
   * @throws IllegalArgumentException when the text is not an array of objects or a field has the wrong type
   */
  public List<ReplicationMapping> parseMappings(String raw) {
    Object document = json.parse(requireText(ConfigKeys.MAPPINGS, raw));
    if (!(document instanceof List<?> entries)) {
      throw new IllegalArgumentException(ConfigKeys.MAPPINGS + " must be a JSON array of mapping objects");
    }
    List<ReplicationMapping> mappings = new ArrayList<>(entries.size());
    int index = 0;
    for (Object entry : entries) {
      if (!(entry instanceof Map<?, ?> fields)) {
        throw new IllegalArgumentException("mapping #" + index + " must be a JSON object");
      }
      for (Object key : fields.keySet()) {
        if (!KNOWN_FIELDS.contains(String.valueOf(key))) {
          log.warn("Ignoring unknown field '{}' in mapping #{}", key, index);
        }
      }
      mappings.add(new ReplicationMapping(
          text(fields, "kafkaTopic", index),
          text(fields, "targetTopic", index),
          text(fields, "rabbitmqExchange", index),
          text(fields, "rabbitmqExchangeType", index).orElse(null),
          text(fields, "rabbitmqQueue", index),
          text(fields, "rabbitmqRoutingKey", index)));
      index++;
    }
    return List.copyOf(mappings);
  }

  /**
   * Parses a JSON object of source topic to target topic.
   *
   * @param raw JSON text such as {@code {"orders":"orders-replica"}}
   * @return one topic route per entry, in declaration order
   * @throws IllegalArgumentException when the text is not a non-empty object of strings
   */
  public List<ReplicationMapping> parseTopicMapping(String raw) {
    Object document = json.parse(requireText(ConfigKeys.TOPIC_MAPPING, raw));
    if (!(document instanceof Map<?, ?> entries)) {
      throw new IllegalArgumentException(ConfigKeys.TOPIC_MAPPING + " must be a JSON object of source to target topic");
    }
    if (entries.isEmpty()) {
      throw new IllegalArgumentException(ConfigKeys.TOPIC_MAPPING + " must not be empty");
    }
    List<ReplicationMapping> mappings = new ArrayList<>(entries.size());
    for (Map.Entry<?, ?> entry : entries.entrySet()) {
      if (!(entry.getValue() instanceof String target)) {
        throw new IllegalArgumentException(
            ConfigKeys.TOPIC_MAPPING + " value for '" + entry.getKey() + "' must be a string");
      }
      mappings.add(ReplicationMapping.topicRoute(String.valueOf(entry.getKey()), target));
    }
    return List.copyOf(mappings);
  }

  private static String requireText(String key, String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(key + " must not be blank");
    }
    return raw.trim();
  }

  private static Optional<String> text(Map<?, ?> fields, String name, int index) {
    Object value = fields.get(name);
    if (value == null) {
      return Optional.empty();
    }
    if (!(value instanceof String text)) {
      throw new IllegalArgumentException("mapping #" + index + " field " + name + " must be a string");
    }
    return text.isBlank() ? Optional.empty() : Optional.of(text.trim());
  }
}
