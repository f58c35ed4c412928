package ca.gc.cra.bridge.application.port;

import ca.gc.cra.bridge.domain.message.OutboundMessage;
import java.time.Duration;

/**
 * Produce side of a replication direction.
 *
 * <p>{@link #publish} is synchronous: it returns only once the broker confirmed the message, so
 * the caller may acknowledge the source immediately afterwards.</p>
 *
 * @since 0.1.0
 */
public interface MessageDestination extends BrokerConnection {
  /**
   * Publishes a message and waits for broker confirmation.
   *
   * @param message message to publish
   * @throws DeliveryException when publication failed or was not confirmed within the produce timeout
   */
  void publish(OutboundMessage message) throws DeliveryException;

  /**
   * Flushes buffered messages, waiting at most {@code timeout}. Implementations whose client
   * cannot flush within a bound may release the connection instead; only {@link #close()} or a
   * reconnect may follow.
   *
   * @param timeout maximum wait
   */
  void flush(Duration timeout);
}
