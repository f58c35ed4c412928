package ca.gc.cra.bridge.application.pipeline;

/**
 * Metric names recorded through {@link ca.gc.cra.bridge.application.port.MetricsPort}.
 *
 * @since 0.1.0
 */
public final class BridgeMetrics {
  public static final String REPLICATED = "bridge.messages.replicated";
  public static final String DUPLICATE = "bridge.messages.duplicate";
  public static final String UNROUTED = "bridge.messages.unrouted";
  public static final String DELIVERY_FAILED = "bridge.delivery.failed";
  public static final String DELIVERY_REJECTED = "bridge.delivery.rejected";
  public static final String ACK_FAILED = "bridge.ack.failed";
  public static final String LOOP_ERRORS = "bridge.loop.errors";
  public static final String RECONNECTS = "bridge.reconnects";
  public static final String PUBLISH_LATENCY_MILLIS = "bridge.publish.latencyMillis";

  private BridgeMetrics() {}
}
