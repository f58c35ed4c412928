package ca.gc.cra.bridge.application.port;

import ca.gc.cra.bridge.domain.message.InFlightMessage;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * <strong>What:</strong> Consume side of a replication direction.
 * <p><strong>Why:</strong> Hides the difference between commit-less log consumption and explicit
 * ack/nack queue consumption behind one resolution contract.</p>
 * <p><strong>Role:</strong> Port implemented by the Kafka and RabbitMQ source adapters.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hand over received messages in receipt order per partition or queue.</li>
 *   <li>Resolve each message exactly once through {@link #acknowledge} or {@link #reject}.</li>
 *   <li>Report backlog for the heartbeat.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Called from the supervisor thread only.</p>
 *
 * @since 0.1.0
 */
public interface MessageSource extends BrokerConnection {
  /**
   * Waits up to {@code timeout} for messages.
   *
   * @param timeout maximum wait
   * @return received messages, possibly empty; never {@code null}
   */
  List<InFlightMessage> poll(Duration timeout);

  /**
   * Marks a message as fully replicated.
   *
   * @param message message previously returned by {@link #poll}
   * @throws DeliveryException when the broker did not accept the acknowledgement
   */
  void acknowledge(InFlightMessage message) throws DeliveryException;

  /**
   * Gives up on a message.
   *
   * @param message message previously returned by {@link #poll}
   * @param requeue whether the broker should redeliver it; ignored by sources without redelivery
   * @throws DeliveryException when the broker did not accept the rejection
   */
  void reject(InFlightMessage message, boolean requeue) throws DeliveryException;

  /**
   * Returns messages waiting on the broker, keyed by partition (e.g. {@code orders-0}) or queue.
   *
   * @return backlog per source; empty when unknown
   */
  Map<String, Long> backlog();

  /**
   * Indicates whether message coordinates stay unique across {@link #reconnect()}.
   *
   * <p>Log offsets do; channel-scoped delivery tags restart at 1, so the deduplication window must
   * be cleared after a queue source reconnects.</p>
   *
   * @return {@code true} when coordinates survive reconnects
   */
  boolean coordinatesSurviveReconnect();
}
