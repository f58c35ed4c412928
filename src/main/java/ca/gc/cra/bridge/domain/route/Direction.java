package ca.gc.cra.bridge.domain.route;

import ca.gc.cra.bridge.domain.message.Origin;
import java.util.Locale;
import java.util.Objects;

/**
 * Replication direction served by one bridge process.
 *
 * @since 0.1.0
 */
public enum Direction {
  /** Kafka topics to RabbitMQ exchanges or queues. */
  K2R(BrokerKind.KAFKA, BrokerKind.RABBITMQ, "Kafka to RabbitMQ"),
  /** RabbitMQ queues to Kafka topics. */
  R2K(BrokerKind.RABBITMQ, BrokerKind.KAFKA, "RabbitMQ to Kafka"),
  /** Source Kafka cluster to target Kafka cluster. */
  S2T(BrokerKind.KAFKA, BrokerKind.KAFKA, "source Kafka to target Kafka"),
  /** Target Kafka cluster back to source Kafka cluster. */
  T2S(BrokerKind.KAFKA, BrokerKind.KAFKA, "target Kafka to source Kafka");

  /** Broker families the bridge speaks. */
  public enum BrokerKind {
    KAFKA,
    RABBITMQ
  }

  private final BrokerKind source;
  private final BrokerKind destination;
  private final String description;

  Direction(BrokerKind source, BrokerKind destination, String description) {
    this.source = source;
    this.destination = destination;
    this.description = description;
  }

  /**
   * Parses a direction tag case-insensitively.
   *
   * @param raw tag such as {@code k2r}
   * @return parsed direction
   * @throws IllegalArgumentException when the tag is blank or unknown
   */
  public static Direction parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("direction is required (K2R, R2K, S2T or T2S)");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    for (Direction direction : values()) {
      if (direction.name().equals(normalized)) {
        return direction;
      }
    }
    throw new IllegalArgumentException("unknown direction: " + raw.trim() + " (expected K2R, R2K, S2T or T2S)");
  }

  public BrokerKind source() {
    return source;
  }

  public BrokerKind destination() {
    return destination;
  }

  public String description() {
    return description;
  }

  /** Indicates a log-to-log direction served by two Kafka clusters. */
  public boolean isLogToLog() {
    return source == BrokerKind.KAFKA && destination == BrokerKind.KAFKA;
  }

  /**
   * Builds the deduplication identifier for a message origin, e.g. {@code k2r:orders:0:42}.
   *
   * @param origin message origin
   * @return identifier unique within the process lifetime of the source connection
   */
  public String dedupId(Origin origin) {
    Objects.requireNonNull(origin, "origin");
    return name().toLowerCase(Locale.ROOT) + ':' + origin.coordinates();
  }
}
