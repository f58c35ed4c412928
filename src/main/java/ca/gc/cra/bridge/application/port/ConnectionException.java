package ca.gc.cra.bridge.application.port;

/**
 * Raised when a broker cannot be reached after the configured connect attempts.
 *
 * <p>Always fatal: the supervisor stops and the process exits non-zero.</p>
 *
 * @since 0.1.0
 */
public final class ConnectionException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a message.
   *
   * @param message diagnostic text naming the broker
   */
  public ConnectionException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and cause.
   *
   * @param message diagnostic text naming the broker
   * @param cause last underlying failure
   */
  public ConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
