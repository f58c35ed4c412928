package ca.gc.cra.bridge.domain.message;

import java.util.Map;

/**
 * Source-side coordinates of a message received by the bridge.
 *
 * <p>Implementations are immutable. The coordinates string is unique per message for the
 * lifetime of the source connection and is the basis of the deduplication identifier.</p>
 *
 * @since 0.1.0
 * @see LogOrigin
 * @see QueueOrigin
 */
public interface Origin {
  /**
   * Returns the identifier that keys the route table: the topic for log sources, the queue for
   * queue sources.
   *
   * @return source identifier
   */
  String sourceId();

  /**
   * Returns the colon-separated coordinates, e.g. {@code orders:0:42} or {@code orders-q:7}.
   *
   * @return coordinates string
   */
  String coordinates();

  /**
   * Returns the provenance headers describing where the message came from.
   *
   * @return ordered header map; never {@code null}
   */
  Map<String, String> provenanceHeaders();
}
