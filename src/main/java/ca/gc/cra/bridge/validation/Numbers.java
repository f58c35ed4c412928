package ca.gc.cra.bridge.validation;

import java.util.Map;

/**
 * Numeric parsing and range checks for configuration values.
 *
 * <p>All failures surface as {@link IllegalArgumentException} so the CLI can map them to a
 * configuration error exit.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Reads an optional integer from a flat configuration map.
   *
   * @param values flat configuration map
   * @param key key to read
   * @param defaultValue value used when the key is absent or blank
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed and range-checked value
   * @throws IllegalArgumentException if the value is not an integer or is out of range
   */
  public static int parseBoundedInt(
      Map<String, String> values, String key, int defaultValue, int min, int max) {
    String raw = values.get(key);
    if (raw == null || raw.isBlank()) {
      requireRange(key, defaultValue, min, max);
      return defaultValue;
    }
    try {
      int parsed = Integer.parseInt(raw.trim());
      requireRange(key, parsed, min, max);
      return parsed;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer between " + min + " and " + max, ex);
    }
  }

  /**
   * Reads an optional boolean from a flat configuration map.
   *
   * <p>Only {@code true} and {@code false} (case-insensitive) are accepted so that typos such as
   * {@code ture} are reported instead of silently meaning {@code false}.</p>
   *
   * @param values flat configuration map
   * @param key key to read
   * @param defaultValue value used when the key is absent or blank
   * @return parsed value
   * @throws IllegalArgumentException if the value is not a boolean literal
   */
  public static boolean parseBoolean(Map<String, String> values, String key, boolean defaultValue) {
    String raw = values.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    String trimmed = raw.trim();
    if (trimmed.equalsIgnoreCase("true")) {
      return true;
    }
    if (trimmed.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException(key + " must be true or false (was " + trimmed + ")");
  }
}
