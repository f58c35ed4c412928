package ca.gc.cra.bridge.application.pipeline;

import ca.gc.cra.bridge.application.port.ClockPort;
import ca.gc.cra.bridge.application.port.DeliveryException;
import ca.gc.cra.bridge.application.port.MessageDestination;
import ca.gc.cra.bridge.application.port.MessageSource;
import ca.gc.cra.bridge.application.port.MetricsPort;
import ca.gc.cra.bridge.domain.message.HeaderNames;
import ca.gc.cra.bridge.domain.message.InFlightMessage;
import ca.gc.cra.bridge.domain.message.LogOrigin;
import ca.gc.cra.bridge.domain.message.Origin;
import ca.gc.cra.bridge.domain.message.OutboundMessage;
import ca.gc.cra.bridge.domain.message.PayloadText;
import ca.gc.cra.bridge.domain.route.Direction;
import ca.gc.cra.bridge.domain.route.MappingTable;
import ca.gc.cra.bridge.domain.route.Route;
import ca.gc.cra.bridge.logging.Logs;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Per-message replication algorithm shared by every direction.
 * <p><strong>Why:</strong> Gives at-least-once delivery across two acknowledgement models: the source
 * message is only resolved after the destination confirmed the publish.</p>
 * <p><strong>Role:</strong> Application service driven by {@link ReplicationSupervisor}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ol>
 *   <li>Resolve the route; a miss rejects the message without requeue.</li>
 *   <li>Suppress identifiers already in the {@link DeduplicationWindow} (acknowledge, no publish).</li>
 *   <li>Count the message and decode key and payload for logging only.</li>
 *   <li>Attach provenance headers and the {@code replicator_id} header.</li>
 *   <li>Publish synchronously; on failure leave the source message unresolved.</li>
 *   <li>Acknowledge the source, then record the identifier.</li>
 * </ol>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confined to the supervisor thread together
 * with the window it owns.</p>
 * <p><strong>Observability:</strong> Logs the first ten messages and every hundredth; records
 * {@code bridge.messages.*} counters and publish latency.</p>
 *
 * @since 0.1.0
 */
public final class ReplicationPipeline {
  private static final Logger log = LoggerFactory.getLogger(ReplicationPipeline.class);
  private static final int VERBOSE_FIRST_MESSAGES = 10;
  private static final int PROGRESS_LOG_INTERVAL = 100;

  private final Direction direction;
  private final MappingTable routes;
  private final DeduplicationWindow window;
  private final MessageSource source;
  private final MessageDestination destination;
  private final ReplicationStats stats;
  private final MetricsPort metrics;
  private final ClockPort clock;

  public ReplicationPipeline(
      Direction direction,
      MappingTable routes,
      DeduplicationWindow window,
      MessageSource source,
      MessageDestination destination,
      ReplicationStats stats,
      MetricsPort metrics,
      ClockPort clock) {
    this.direction = Objects.requireNonNull(direction, "direction");
    this.routes = Objects.requireNonNull(routes, "routes");
    this.window = Objects.requireNonNull(window, "window");
    this.source = Objects.requireNonNull(source, "source");
    this.destination = Objects.requireNonNull(destination, "destination");
    this.stats = Objects.requireNonNull(stats, "stats");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
  }

  /**
   * Runs a message through the pipeline for the first time.
   *
   * @param message received message
   * @return outcome
   */
  public DispatchOutcome dispatch(InFlightMessage message) {
    return dispatch(message, 1);
  }

  /**
   * Runs a message through the pipeline.
   *
   * <p>Retries of the same message pass {@code attempt > 1}; only the first attempt is counted as a
   * processed message.</p>
   *
   * @param message received message
   * @param attempt 1-based attempt number
   * @return outcome
   */
  public DispatchOutcome dispatch(InFlightMessage message, int attempt) {
    Objects.requireNonNull(message, "message");
    Origin origin = message.origin();

    Optional<Route> route = routes.resolve(origin.sourceId());
    if (route.isEmpty()) {
      handleRouteMiss(message);
      return DispatchOutcome.ROUTE_MISS;
    }

    String replicationId = direction.dedupId(origin);
    if (window.contains(replicationId)) {
      handleDuplicate(message, replicationId);
      return DispatchOutcome.DUPLICATE;
    }

    long count = attempt == 1
        ? stats.recordMessage(clock.nowMillis())
        : stats.snapshot().messagesProcessed();
    OutboundMessage outbound = toOutbound(message, route.get(), replicationId);
    logProgress(count, attempt, message, route.get());

    long started = clock.nowMillis();
    try {
      destination.publish(outbound);
    } catch (DeliveryException ex) {
      stats.recordError();
      metrics.increment(BridgeMetrics.DELIVERY_FAILED);
      log.error("Delivery failed for {} via {} (attempt {}): {}",
          origin.coordinates(), route.get(), attempt, ex.getMessage(), ex);
      return DispatchOutcome.FAILED;
    }
    metrics.observe(BridgeMetrics.PUBLISH_LATENCY_MILLIS, clock.nowMillis() - started);

    try {
      source.acknowledge(message);
    } catch (DeliveryException ex) {
      // Already published; a redelivery of this message is possible and tolerated.
      stats.recordError();
      metrics.increment(BridgeMetrics.ACK_FAILED);
      log.warn("Published {} but acknowledgement failed: {}", origin.coordinates(), ex.getMessage(), ex);
    }
    window.record(replicationId);
    metrics.increment(BridgeMetrics.REPLICATED);
    return DispatchOutcome.REPLICATED;
  }

  /**
   * Forgets every recorded identifier. Used after a queue source reconnects because its delivery
   * tags restart.
   */
  public void resetWindow() {
    int dropped = window.size();
    window.clear();
    log.info("Cleared deduplication window ({} identifiers) after source reconnect", dropped);
  }

  private void handleRouteMiss(InFlightMessage message) {
    stats.recordRouteMiss();
    metrics.increment(BridgeMetrics.UNROUTED);
    log.warn("No route for source '{}' ({}); rejecting without requeue",
        message.origin().sourceId(), message.origin().coordinates());
    try {
      source.reject(message, false);
    } catch (DeliveryException ex) {
      stats.recordError();
      log.error("Failed to reject unrouted message {}: {}", message.origin().coordinates(), ex.getMessage(), ex);
    }
  }

  private void handleDuplicate(InFlightMessage message, String replicationId) {
    stats.recordDuplicate();
    metrics.increment(BridgeMetrics.DUPLICATE);
    log.debug("Duplicate {} suppressed", replicationId);
    try {
      source.acknowledge(message);
    } catch (DeliveryException ex) {
      stats.recordError();
      metrics.increment(BridgeMetrics.ACK_FAILED);
      log.warn("Failed to acknowledge duplicate {}: {}", replicationId, ex.getMessage(), ex);
    }
  }

  private OutboundMessage toOutbound(InFlightMessage message, Route route, String replicationId) {
    Origin origin = message.origin();
    Map<String, byte[]> headers = new LinkedHashMap<>(message.headers());
    origin.provenanceHeaders().forEach((name, value) -> headers.put(name, PayloadText.encode(value)));
    if (origin instanceof LogOrigin && message.key() != null) {
      headers.put(HeaderNames.KAFKA_KEY, message.key());
    }
    headers.put(HeaderNames.REPLICATOR_ID, PayloadText.encode(replicationId));

    byte[] key = message.key();
    if (key == null) {
      key = message.header(HeaderNames.KAFKA_KEY).orElse(null);
    }
    return new OutboundMessage(route.destination(), key, message.payload(), headers, replicationId);
  }

  private void logProgress(long count, int attempt, InFlightMessage message, Route route) {
    Optional<String> text = PayloadText.decode(message.payload());
    if (text.isEmpty()) {
      log.debug("Payload of {} is not valid UTF-8; forwarding {} raw bytes",
          message.origin().coordinates(), message.payload().length);
    }
    if (attempt > 1 || !(count <= VERBOSE_FIRST_MESSAGES || count % PROGRESS_LOG_INTERVAL == 0)) {
      return;
    }
    String key = message.key() == null
        ? "<none>"
        : PayloadText.decode(message.key()).orElse("<" + message.key().length + " bytes>");
    log.info("Replicating #{} {} via {} key={} payload={}",
        count,
        message.origin().coordinates(),
        route,
        Logs.truncate(key, Logs.PREVIEW_BYTES),
        text.map(value -> Logs.truncate(value, Logs.PREVIEW_BYTES))
            .orElse("<" + message.payload().length + " bytes>"));
  }
}
