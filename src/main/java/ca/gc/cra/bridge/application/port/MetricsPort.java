package ca.gc.cra.bridge.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for the bridge.
 * <p><strong>Why:</strong> Lets the pipeline and supervisor record counters without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} for tests.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept updates from any thread.</p>
 * <p><strong>Observability:</strong> Metric names use dotted form, e.g. {@code bridge.messages.replicated}.</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric name; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram metric.
   *
   * @param key dotted metric name; must not be {@code null}
   * @param value observed value, in the unit named by the key suffix
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
