package ca.gc.cra.bridge.domain.route;

import ca.gc.cra.bridge.domain.message.Destination;
import java.util.Objects;

/**
 * Resolved route: messages from {@code sourceId} are published to {@code destination}.
 *
 * @param sourceId topic or queue the messages are read from
 * @param destination where they are published
 * @since 0.1.0
 */
public record Route(String sourceId, Destination destination) {
  public Route {
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(destination, "destination");
  }

  @Override
  public String toString() {
    return sourceId + " -> " + destination.describe();
  }
}
