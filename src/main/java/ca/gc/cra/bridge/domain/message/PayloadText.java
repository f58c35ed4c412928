package ca.gc.cra.bridge.domain.message;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Strict UTF-8 view of message bytes.
 *
 * <p>Decoding is only ever used for logging and header conversion; the bridge forwards the
 * original bytes regardless of the outcome.</p>
 *
 * @since 0.1.0
 */
public final class PayloadText {
  private PayloadText() {}

  /**
   * Decodes bytes as UTF-8, rejecting malformed input.
   *
   * @param bytes raw bytes; {@code null} yields empty
   * @return decoded text, or empty when the bytes are not valid UTF-8
   */
  public static Optional<String> decode(byte[] bytes) {
    if (bytes == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString());
    } catch (CharacterCodingException ex) {
      return Optional.empty();
    }
  }

  /**
   * Encodes text as UTF-8.
   *
   * @param text text to encode; {@code null} yields {@code null}
   * @return encoded bytes
   */
  public static byte[] encode(String text) {
    return text == null ? null : text.getBytes(StandardCharsets.UTF_8);
  }
}
