package ca.gc.cra.bridge.adapter.kafka;

import ca.gc.cra.bridge.validation.Net;
import ca.gc.cra.bridge.validation.Numbers;
import ca.gc.cra.bridge.validation.Strings;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings for the consuming Kafka adapter.
 *
 * @param bootstrapServers validated {@code host:port} list
 * @param topics topics to read, in configuration order
 * @param partitionStrategy partitions to assign when no consumer group is set
 * @param startPosition initial position of newly assigned partitions
 * @param consumerGroup optional group id; when present the consumer subscribes and commits
 * @param maxPollRecords upper bound on records per poll
 * @since 0.1.0
 */
public record KafkaSourceOptions(
    String bootstrapServers,
    List<String> topics,
    PartitionStrategy partitionStrategy,
    StartPosition startPosition,
    Optional<String> consumerGroup,
    int maxPollRecords) {

  public static final int DEFAULT_MAX_POLL_RECORDS = 100;

  public KafkaSourceOptions {
    bootstrapServers = Net.validateBootstrapServers("bootstrapServers", bootstrapServers);
    Objects.requireNonNull(topics, "topics");
    if (topics.isEmpty()) {
      throw new IllegalArgumentException("at least one source topic is required");
    }
    List<String> sanitized = new ArrayList<>(topics.size());
    for (String topic : topics) {
      sanitized.add(Strings.sanitizeTopic("topic", topic));
    }
    topics = List.copyOf(sanitized);
    partitionStrategy = Objects.requireNonNullElse(partitionStrategy, PartitionStrategy.ALL);
    startPosition = Objects.requireNonNullElse(startPosition, StartPosition.LATEST);
    consumerGroup = Objects.requireNonNullElse(consumerGroup, Optional.<String>empty())
        .map(group -> Strings.requirePrintableAscii("consumerGroup", group, 249));
    Numbers.requireRange("maxPollRecords", maxPollRecords, 1, 10_000);
  }

  /**
   * Options for a live-tail, group-less consumer over every partition.
   *
   * @param bootstrapServers bootstrap list
   * @param topics topics to read
   * @return options with defaults
   */
  public static KafkaSourceOptions liveTail(String bootstrapServers, List<String> topics) {
    return new KafkaSourceOptions(
        bootstrapServers,
        topics,
        PartitionStrategy.ALL,
        StartPosition.LATEST,
        Optional.empty(),
        DEFAULT_MAX_POLL_RECORDS);
  }

  public boolean groupMode() {
    return consumerGroup.isPresent();
  }
}
