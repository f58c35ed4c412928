package ca.gc.cra.bridge.validation;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> String validation helpers shared by the CLI, configuration and route table.
 * <p><strong>Why:</strong> Topic, queue and exchange names reach two brokers with different naming rules;
 * rejecting bad names before connecting keeps failures in the configuration phase.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Violations raise {@link IllegalArgumentException} naming the offending key.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Net
 */
public final class Strings {
  private static final Pattern TOPIC_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");
  private static final int MAX_TOPIC_LENGTH = 249;
  private static final int MAX_AMQP_NAME_BYTES = 255;

  private Strings() {
    // Utility
  }

  /**
   * Ensures a value is non-null, non-blank and free of ISO control characters.
   *
   * @param name logical parameter name for diagnostics; {@code null} defaults to {@code "value"}
   * @param value candidate text
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a Kafka topic name.
   *
   * @param name logical parameter name used in exception messages
   * @param topic candidate topic
   * @return trimmed topic matching {@code [A-Za-z0-9._-]+}, at most 249 characters
   * @throws IllegalArgumentException if the topic is blank, too long or uses unsupported characters
   */
  public static String sanitizeTopic(String name, String topic) {
    String sanitized = requireNonBlank(name, topic);
    if (sanitized.length() > MAX_TOPIC_LENGTH) {
      throw new IllegalArgumentException(message(name, "length must be <= " + MAX_TOPIC_LENGTH));
    }
    if (!TOPIC_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen"));
    }
    return sanitized;
  }

  /**
   * Validates a RabbitMQ queue, exchange or routing key name.
   *
   * <p>AMQP 0-9-1 names are short strings: any UTF-8 text of at most 255 bytes. Only control
   * characters are refused on top of that.</p>
   *
   * @param name logical parameter name used in exception messages
   * @param value candidate name
   * @return trimmed name
   * @throws IllegalArgumentException if the name is blank, longer than 255 UTF-8 bytes or contains
   *     control characters
   */
  public static String sanitizeAmqpName(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.getBytes(StandardCharsets.UTF_8).length > MAX_AMQP_NAME_BYTES) {
      throw new IllegalArgumentException(message(name, "must be at most " + MAX_AMQP_NAME_BYTES + " UTF-8 bytes"));
    }
    return sanitized;
  }

  /**
   * Ensures a value contains only printable ASCII characters and fits within {@code maxLength}.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate string
   * @param maxLength maximum permitted length in characters
   * @return validated value
   * @throws IllegalArgumentException if the value is too long or contains non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  /**
   * Returns the trimmed value, or {@code null} when the input is {@code null} or blank.
   *
   * @param value candidate text
   * @return trimmed text or {@code null}
   */
  public static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
