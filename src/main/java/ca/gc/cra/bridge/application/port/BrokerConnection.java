package ca.gc.cra.bridge.application.port;

/**
 * <strong>What:</strong> Lifecycle contract shared by every broker adapter.
 * <p><strong>Why:</strong> The supervisor owns connection recovery; adapters only report health and
 * re-establish themselves on request.</p>
 * <p><strong>Thread-safety:</strong> Lifecycle methods are called from the supervisor thread only.</p>
 *
 * @since 0.1.0
 */
public interface BrokerConnection extends AutoCloseable {
  /**
   * Connects with bounded retry and performs the adapter's setup (assignment, topology,
   * subscriptions).
   *
   * @throws ConnectionException when every attempt failed
   */
  void connect() throws ConnectionException;

  /**
   * Returns the current lifecycle state.
   *
   * @return state; never {@code null}
   */
  ConnectionState state();

  /**
   * Checks whether the connection is still usable.
   *
   * <p>May update {@link #state()} to {@link ConnectionState#FAILED} as a side effect.</p>
   *
   * @return {@code true} when healthy
   */
  boolean probe();

  /**
   * Tears the connection down and connects again, repeating the adapter's setup.
   *
   * @throws ConnectionException when every attempt failed
   */
  void reconnect() throws ConnectionException;

  /**
   * Short label for logs, e.g. {@code kafka[kafka:9092]}.
   *
   * @return endpoint description without credentials
   */
  String describe();

  /**
   * Releases broker resources. Never throws checked exceptions.
   */
  @Override
  void close();
}
