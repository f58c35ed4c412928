package ca.gc.cra.bridge.adapter.kafka;

import java.util.Locale;

/** Where a freshly assigned partition starts reading. */
public enum StartPosition {
  /** Live tail: only messages produced after startup. */
  LATEST,
  /** Backfill from the oldest retained offset. */
  EARLIEST;

  /**
   * Parses a configuration value.
   *
   * @param raw value such as {@code latest}
   * @return start position
   * @throws IllegalArgumentException when the value is unknown
   */
  public static StartPosition parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return LATEST;
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("startPosition must be LATEST or EARLIEST (got " + raw + ")", ex);
    }
  }

  String resetPolicy() {
    return name().toLowerCase(Locale.ROOT);
  }
}
