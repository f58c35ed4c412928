package ca.gc.cra.bridge.config;

import ca.gc.cra.bridge.adapter.amqp.AmqpConnector;
import ca.gc.cra.bridge.adapter.amqp.AmqpDestinationAdapter;
import ca.gc.cra.bridge.adapter.amqp.AmqpSourceAdapter;
import ca.gc.cra.bridge.adapter.kafka.KafkaDestinationAdapter;
import ca.gc.cra.bridge.adapter.kafka.KafkaSourceAdapter;
import ca.gc.cra.bridge.application.pipeline.DeduplicationWindow;
import ca.gc.cra.bridge.application.pipeline.ReplicationPipeline;
import ca.gc.cra.bridge.application.pipeline.ReplicationStats;
import ca.gc.cra.bridge.application.pipeline.ReplicationSupervisor;
import ca.gc.cra.bridge.application.port.ClockPort;
import ca.gc.cra.bridge.application.port.MessageDestination;
import ca.gc.cra.bridge.application.port.MessageSource;
import ca.gc.cra.bridge.application.port.MetricsPort;
import ca.gc.cra.bridge.domain.route.Direction;
import ca.gc.cra.bridge.infrastructure.health.HealthServer;
import ca.gc.cra.bridge.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * <strong>What:</strong> Central composition root that wires the replication supervisor to concrete
 * broker adapters.
 * <p><strong>Why:</strong> The direction is the only thing that decides which adapters are used; the
 * pipeline and supervisor never branch on it.</p>
 * <p><strong>Role:</strong> Adapter composition root spanning source, pipeline and destination.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Pick the source/destination adapter pair for the direction.</li>
 *   <li>Create shared counters, the deduplication window and the metrics exporter.</li>
 *   <li>Attach the health endpoint when enabled.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; intended for single-threaded bootstrap.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final BridgeConfig config;
  private final ClockPort clock;
  private final Function<Direction, MetricsPort> metricsFactory;

  public CompositionRoot(BridgeConfig config) {
    this(config, ClockPort.SYSTEM, direction -> new OpenTelemetryMetricsAdapter(tag(direction)));
  }

  CompositionRoot(BridgeConfig config, ClockPort clock, Function<Direction, MetricsPort> metricsFactory) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
    this.metricsFactory = Objects.requireNonNull(metricsFactory, "metricsFactory");
  }

  /**
   * Builds the runtime; no connection is opened until {@link BridgeRuntime#run()}.
   *
   * @return wired runtime
   */
  public BridgeRuntime build() {
    Direction direction = config.direction();
    MessageSource source = source();
    MessageDestination destination = destination();
    MetricsPort metrics = metricsFactory.apply(direction);
    ReplicationStats stats = new ReplicationStats(clock.nowMillis());
    ReplicationPipeline pipeline = new ReplicationPipeline(
        direction, config.routes(), new DeduplicationWindow(), source, destination, stats, metrics, clock);
    ReplicationSupervisor supervisor = new ReplicationSupervisor(
        direction, source, destination, pipeline, stats, config.supervisor(), metrics, clock);
    Optional<HealthServer> health = config.healthEnabled()
        ? Optional.of(new HealthServer(config.healthPort(), direction, supervisor::state, stats, clock))
        : Optional.empty();
    AutoCloseable closeableMetrics = metrics instanceof AutoCloseable closeable ? closeable : null;
    return new BridgeRuntime(supervisor, stats, health, closeableMetrics);
  }

  MessageSource source() {
    return switch (config.direction()) {
      case K2R, S2T, T2S -> new KafkaSourceAdapter(config.kafkaSourceOptions(), clientId("consumer"));
      case R2K -> new AmqpSourceAdapter(new AmqpConnector(config.amqp().orElseThrow()), config.routes().sourceIds());
    };
  }

  MessageDestination destination() {
    return switch (config.direction()) {
      case K2R -> new AmqpDestinationAdapter(
          new AmqpConnector(config.amqp().orElseThrow()), config.routes().mappings());
      case R2K, S2T, T2S -> new KafkaDestinationAdapter(
          config.produceBootstrap(), config.destinationTopics(), clientId("producer"));
    };
  }

  private String clientId(String role) {
    return "bridge-" + tag(config.direction()) + '-' + role;
  }

  private static String tag(Direction direction) {
    return direction.name().toLowerCase(Locale.ROOT);
  }
}
