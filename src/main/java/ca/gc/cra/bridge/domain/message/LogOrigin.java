package ca.gc.cra.bridge.domain.message;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Origin of a record read from a partitioned log.
 *
 * @param topic source topic
 * @param partition partition index
 * @param offset record offset within the partition
 * @since 0.1.0
 */
public record LogOrigin(String topic, int partition, long offset) implements Origin {

  public LogOrigin {
    Objects.requireNonNull(topic, "topic");
    if (partition < 0) {
      throw new IllegalArgumentException("partition must be >= 0");
    }
    if (offset < 0) {
      throw new IllegalArgumentException("offset must be >= 0");
    }
  }

  @Override
  public String sourceId() {
    return topic;
  }

  @Override
  public String coordinates() {
    return topic + ':' + partition + ':' + offset;
  }

  @Override
  public Map<String, String> provenanceHeaders() {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put(HeaderNames.KAFKA_TOPIC, topic);
    headers.put(HeaderNames.KAFKA_PARTITION, Integer.toString(partition));
    headers.put(HeaderNames.KAFKA_OFFSET, Long.toString(offset));
    return headers;
  }
}
