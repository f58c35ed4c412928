package ca.gc.cra.bridge.domain.message;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> A message received from the source broker and not yet resolved.
 * <p><strong>Why:</strong> Carries everything the pipeline needs to route, publish and finally
 * acknowledge the message on its source.</p>
 * <p><strong>Thread-safety:</strong> Immutable once constructed; byte arrays are copied on entry.</p>
 *
 * @param origin source coordinates; never {@code null}
 * @param key record key, or {@code null} when the source carries none
 * @param payload message body; the raw bytes are authoritative
 * @param headers pass-through headers from the source message
 * @param receivedAtMillis epoch millis when the adapter handed the message over
 * @since 0.1.0
 */
public record InFlightMessage(
    Origin origin,
    byte[] key,
    byte[] payload,
    Map<String, byte[]> headers,
    long receivedAtMillis) {

  public InFlightMessage {
    Objects.requireNonNull(origin, "origin");
    key = key != null ? key.clone() : null;
    payload = payload != null ? payload.clone() : new byte[0];
    if (headers == null || headers.isEmpty()) {
      headers = Map.of();
    } else {
      Map<String, byte[]> copy = new LinkedHashMap<>();
      headers.forEach((name, value) -> {
        if (name != null && value != null) {
          copy.put(name, value.clone());
        }
      });
      headers = Collections.unmodifiableMap(copy);
    }
  }

  /**
   * Returns the record key without copying.
   *
   * @return key bytes or {@code null}
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Copied on construction; the pipeline only reads it.")
  public byte[] key() {
    return key;
  }

  /**
   * Returns the payload without copying.
   *
   * @return payload bytes; never {@code null}
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Copied on construction; the pipeline only reads it.")
  public byte[] payload() {
    return payload;
  }

  /**
   * Looks up a pass-through header.
   *
   * @param name header name
   * @return header bytes when present
   */
  public Optional<byte[]> header(String name) {
    return Optional.ofNullable(headers.get(name));
  }

  @Override
  public String toString() {
    return "InFlightMessage{"
        + "origin=" + origin.coordinates()
        + ", keyBytes=" + (key == null ? -1 : key.length)
        + ", payloadBytes=" + payload.length
        + ", headers=" + headers.keySet()
        + '}';
  }
}
