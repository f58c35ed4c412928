package ca.gc.cra.bridge.adapter.kafka;

import java.util.Locale;

/** Which partitions of each configured topic a group-less consumer assigns. */
public enum PartitionStrategy {
  /** Every partition reported by topic metadata. */
  ALL,
  /** Only the lowest partition index. */
  FIRST;

  /**
   * Parses a configuration value.
   *
   * @param raw value such as {@code all} or {@code FIRST}
   * @return strategy
   * @throws IllegalArgumentException when the value is unknown
   */
  public static PartitionStrategy parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return ALL;
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("partitionStrategy must be ALL or FIRST (got " + raw + ")", ex);
    }
  }
}
