package ca.gc.cra.bridge.application.port;

/**
 * Connection lifecycle of a broker adapter.
 *
 * <p>{@link #CONNECTED} is only reported once assignment, topology and subscriptions have been
 * (re)established for the current connection.</p>
 *
 * @since 0.1.0
 */
public enum ConnectionState {
  DISCONNECTED,
  CONNECTING,
  CONNECTED,
  FAILED
}
