package ca.gc.cra.bridge.domain.message;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A message ready to be published on the destination broker.
 *
 * @param destination target topic or exchange
 * @param key record key, or {@code null}
 * @param payload message body, forwarded unchanged from the source
 * @param headers pass-through and provenance headers in publication order
 * @param replicationId deduplication identifier, also carried in the {@code replicator_id} header
 * @since 0.1.0
 */
public record OutboundMessage(
    Destination destination,
    byte[] key,
    byte[] payload,
    Map<String, byte[]> headers,
    String replicationId) {

  public OutboundMessage {
    Objects.requireNonNull(destination, "destination");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(replicationId, "replicationId");
    headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
  }

  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Bytes come from an immutable InFlightMessage.")
  public byte[] key() {
    return key;
  }

  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Bytes come from an immutable InFlightMessage.")
  public byte[] payload() {
    return payload;
  }

  /**
   * Decodes a header as UTF-8 text.
   *
   * @param name header name
   * @return decoded value or {@code null} when absent
   */
  public String headerText(String name) {
    byte[] value = headers.get(name);
    return value == null ? null : new String(value, StandardCharsets.UTF_8);
  }
}
