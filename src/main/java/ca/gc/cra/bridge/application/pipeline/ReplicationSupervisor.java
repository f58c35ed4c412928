package ca.gc.cra.bridge.application.pipeline;

import ca.gc.cra.bridge.application.port.BrokerConnection;
import ca.gc.cra.bridge.application.port.ClockPort;
import ca.gc.cra.bridge.application.port.ConnectionException;
import ca.gc.cra.bridge.application.port.ConnectionState;
import ca.gc.cra.bridge.application.port.DeliveryException;
import ca.gc.cra.bridge.application.port.MessageDestination;
import ca.gc.cra.bridge.application.port.MessageSource;
import ca.gc.cra.bridge.application.port.MetricsPort;
import ca.gc.cra.bridge.application.port.Sleeper;
import ca.gc.cra.bridge.domain.message.InFlightMessage;
import ca.gc.cra.bridge.domain.route.Direction;
import ca.gc.cra.bridge.logging.LoggingConfigurator;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Drives one replication direction from startup to graceful shutdown.
 * <p><strong>Why:</strong> Owns the only long-running loop of the process so that ordering, connection
 * recovery and cancellation are decided in one place.</p>
 * <p><strong>Role:</strong> Application use case started by the CLI through the composition root.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>{@code STARTING}: connect the destination, then the source. A {@link ConnectionException}
 *   stops the supervisor before any message is processed.</li>
 *   <li>{@code RUNNING}: heartbeat, probe and reconnect adapters, poll, dispatch each message with
 *   in-place retries, and survive unexpected errors with a short pause.</li>
 *   <li>{@code DRAINING}: entered through {@link #requestStop()}; the current batch completes and no
 *   new poll starts.</li>
 *   <li>{@code STOPPED}: flush and close the destination, close the source, log final counters.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #run()} executes on one thread. {@link #requestStop()},
 * {@link #state()} and {@link #awaitStopped(Duration)} may be called from any thread.</p>
 * <p><strong>Observability:</strong> Binds the {@code direction} MDC key for the loop thread and records
 * {@code bridge.loop.errors}, {@code bridge.reconnects} and {@code bridge.delivery.rejected}.</p>
 *
 * @since 0.1.0
 */
public final class ReplicationSupervisor {
  private static final Logger log = LoggerFactory.getLogger(ReplicationSupervisor.class);

  private final Direction direction;
  private final MessageSource source;
  private final MessageDestination destination;
  private final ReplicationPipeline pipeline;
  private final ReplicationStats stats;
  private final HeartbeatReporter heartbeat;
  private final SupervisorSettings settings;
  private final MetricsPort metrics;
  private final Sleeper sleeper;

  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean stopRequested = new AtomicBoolean();
  private final AtomicReference<SupervisorState> state = new AtomicReference<>(SupervisorState.STARTING);
  private final CountDownLatch stopped = new CountDownLatch(1);
  private int emptyPolls;

  public ReplicationSupervisor(
      Direction direction,
      MessageSource source,
      MessageDestination destination,
      ReplicationPipeline pipeline,
      ReplicationStats stats,
      SupervisorSettings settings,
      MetricsPort metrics,
      ClockPort clock) {
    this(direction, source, destination, pipeline, stats, settings, metrics, clock, Sleeper.THREAD);
  }

  ReplicationSupervisor(
      Direction direction,
      MessageSource source,
      MessageDestination destination,
      ReplicationPipeline pipeline,
      ReplicationStats stats,
      SupervisorSettings settings,
      MetricsPort metrics,
      ClockPort clock,
      Sleeper sleeper) {
    this.direction = Objects.requireNonNull(direction, "direction");
    this.source = Objects.requireNonNull(source, "source");
    this.destination = Objects.requireNonNull(destination, "destination");
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    this.stats = Objects.requireNonNull(stats, "stats");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.heartbeat = new HeartbeatReporter(
        direction, stats, source, settings.heartbeatInterval(), Objects.requireNonNullElse(clock, ClockPort.SYSTEM));
  }

  /**
   * Runs the supervisor until {@link #requestStop()} is called or a fatal connection failure occurs.
   *
   * @throws ConnectionException when a broker cannot be reached at startup or after a lost connection
   * @throws IllegalStateException when invoked more than once
   */
  public void run() throws ConnectionException {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("supervisor already started");
    }
    LoggingConfigurator.bindDirection(direction.name());
    try {
      start();
      while (!stopRequested.get()) {
        iterate();
      }
      state.set(SupervisorState.DRAINING);
      log.info("Replication loop drained");
    } catch (ConnectionException ex) {
      log.error("Fatal connection failure during {}: {}", state.get(), ex.getMessage());
      throw ex;
    } finally {
      shutdown();
      LoggingConfigurator.clearDirection();
    }
  }

  /**
   * Requests a graceful stop. The loop finishes the batch in progress and exits at the next
   * iteration boundary.
   */
  public void requestStop() {
    if (stopRequested.compareAndSet(false, true)) {
      state.compareAndSet(SupervisorState.RUNNING, SupervisorState.DRAINING);
      log.info("Stop requested for {} replication; draining", direction);
    }
  }

  public SupervisorState state() {
    return state.get();
  }

  /**
   * Waits for the supervisor to reach {@link SupervisorState#STOPPED}.
   *
   * @param timeout maximum wait
   * @return {@code true} when stopped within the timeout
   * @throws InterruptedException when interrupted while waiting
   */
  public boolean awaitStopped(Duration timeout) throws InterruptedException {
    return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  private void start() throws ConnectionException {
    state.set(SupervisorState.STARTING);
    log.info("Starting {} replication ({})", direction, direction.description());
    destination.connect();
    source.connect();
    if (state.compareAndSet(SupervisorState.STARTING, SupervisorState.RUNNING)) {
      log.info("Replication running: {} -> {}", source.describe(), destination.describe());
    }
  }

  private void iterate() throws ConnectionException {
    try {
      heartbeat.maybeReport();
      ensureConnected();
      List<InFlightMessage> batch = source.poll(settings.pollTimeout());
      if (batch.isEmpty()) {
        emptyPolls++;
        return;
      }
      emptyPolls = 0;
      for (InFlightMessage message : batch) {
        deliver(message);
      }
    } catch (RuntimeException ex) {
      stats.recordError();
      metrics.increment(BridgeMetrics.LOOP_ERRORS);
      log.error("Unexpected error in replication loop; pausing {}", settings.errorPause(), ex);
      pause(settings.errorPause());
    }
  }

  private void ensureConnected() throws ConnectionException {
    if (destination.state() != ConnectionState.CONNECTED && !destination.probe()) {
      reconnect(destination);
    }
    boolean idle = emptyPolls >= settings.emptyPollThreshold();
    if (idle || source.state() != ConnectionState.CONNECTED) {
      if (idle) {
        log.debug("No messages in {} consecutive polls; probing {}", emptyPolls, source.describe());
      }
      emptyPolls = 0;
      if (!source.probe()) {
        reconnect(source);
        if (!source.coordinatesSurviveReconnect()) {
          pipeline.resetWindow();
        }
      }
    }
  }

  private void reconnect(BrokerConnection connection) throws ConnectionException {
    metrics.increment(BridgeMetrics.RECONNECTS);
    log.warn("{} is unhealthy (state {}); reconnecting", connection.describe(), connection.state());
    connection.reconnect();
    log.info("{} reconnected", connection.describe());
  }

  private void deliver(InFlightMessage message) throws ConnectionException {
    int attempts = settings.deliveryAttempts();
    for (int attempt = 1; attempt <= attempts; attempt++) {
      if (pipeline.dispatch(message, attempt) != DispatchOutcome.FAILED) {
        return;
      }
      if (attempt < attempts) {
        if (!pause(settings.retryPause())) {
          break;
        }
        // A destination that marked itself FAILED cannot succeed on retry without a new connection.
        if (destination.state() == ConnectionState.FAILED) {
          reconnect(destination);
        }
      }
    }
    giveUp(message, attempts);
  }

  private void giveUp(InFlightMessage message, int attempts) {
    boolean requeue = settings.requeueOnFailure();
    metrics.increment(BridgeMetrics.DELIVERY_REJECTED);
    log.error("Giving up on {} after {} attempt(s); rejecting with requeue={}",
        message.origin().coordinates(), attempts, requeue);
    try {
      source.reject(message, requeue);
    } catch (DeliveryException ex) {
      stats.recordError();
      log.error("Failed to reject {}: {}", message.origin().coordinates(), ex.getMessage(), ex);
    }
  }

  private boolean pause(Duration duration) {
    try {
      sleeper.sleep(duration);
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Replication loop interrupted; stopping");
      requestStop();
      return false;
    }
  }

  private void shutdown() {
    try {
      destination.flush(settings.flushTimeout());
    } catch (RuntimeException ex) {
      log.warn("Destination flush failed during shutdown: {}", ex.getMessage(), ex);
    }
    close(destination, "destination");
    close(source, "source");
    state.set(SupervisorState.STOPPED);
    StatsSnapshot snapshot = stats.snapshot();
    log.info("Replication stopped: processed={} errors={} unrouted={} duplicates={}",
        snapshot.messagesProcessed(), snapshot.errors(), snapshot.routeMisses(), snapshot.duplicates());
    stopped.countDown();
  }

  private static void close(BrokerConnection connection, String role) {
    try {
      connection.close();
      log.info("Closed {} {}", role, connection.describe());
    } catch (RuntimeException ex) {
      log.error("Failed to close {} {}", role, connection.describe(), ex);
    }
  }
}
