package ca.gc.cra.bridge.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Log hygiene helpers for replicated payloads and credentials.
 * <p><strong>Why:</strong> Message bodies can be large or binary and broker passwords must never reach
 * operator logs.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @implNote Truncation decodes with {@link CodingErrorAction#IGNORE} so a cut through a multi-byte
 * sequence does not fail.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  /** Default preview budget used for payloads in progress logs. */
  public static final int PREVIEW_BYTES = 200;

  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending length metadata when cut.
   *
   * @param value string to truncate; {@code null} yields {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return original value when it fits, otherwise a truncated copy with a suffix
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    return decodePrefix(bytes, maxBytes) + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
  }

  /**
   * Returns the redaction placeholder used for secrets.
   *
   * @param value ignored original value
   * @return {@code "[REDACTED]"}
   */
  public static String redact(String value) {
    return REDACTED_PLACEHOLDER;
  }

  private static String decodePrefix(byte[] bytes, int length) {
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, length));
      return buffer.toString();
    } catch (CharacterCodingException ex) {
      // IGNORE actions make this unreachable in practice; fall back to lossy decoding.
      return new String(bytes, 0, length, StandardCharsets.UTF_8);
    }
  }
}
