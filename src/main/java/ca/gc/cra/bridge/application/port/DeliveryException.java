package ca.gc.cra.bridge.application.port;

/**
 * Raised when a publish, acknowledgement or rejection is not confirmed by the broker.
 *
 * <p>Recovered per message: counted, logged and retried, never fatal.</p>
 *
 * @since 0.1.0
 */
public final class DeliveryException extends Exception {
  private static final long serialVersionUID = 1L;

  public DeliveryException(String message) {
    super(message);
  }

  public DeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
