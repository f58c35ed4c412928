package ca.gc.cra.bridge.config;

import ca.gc.cra.bridge.application.pipeline.ReplicationStats;
import ca.gc.cra.bridge.application.pipeline.ReplicationSupervisor;
import ca.gc.cra.bridge.application.pipeline.SupervisorState;
import ca.gc.cra.bridge.application.port.ConnectionException;
import ca.gc.cra.bridge.infrastructure.health.HealthServer;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A wired bridge: supervisor, optional health endpoint and metrics exporter.
 *
 * <p>{@link #run()} blocks the calling thread; {@link #requestStop()} may be called from a shutdown
 * hook.</p>
 */
public final class BridgeRuntime implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(BridgeRuntime.class);

  private final ReplicationSupervisor supervisor;
  private final ReplicationStats stats;
  private final Optional<HealthServer> health;
  private final AutoCloseable metrics;

  BridgeRuntime(
      ReplicationSupervisor supervisor,
      ReplicationStats stats,
      Optional<HealthServer> health,
      AutoCloseable metrics) {
    this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
    this.stats = Objects.requireNonNull(stats, "stats");
    this.health = Objects.requireNonNullElse(health, Optional.empty());
    this.metrics = metrics;
  }

  /**
   * Starts the health endpoint and runs the supervisor until it stops.
   *
   * @throws ConnectionException when a broker cannot be reached
   */
  public void run() throws ConnectionException {
    health.ifPresent(HealthServer::start);
    supervisor.run();
  }

  /** Asks the supervisor to drain and stop. */
  public void requestStop() {
    supervisor.requestStop();
  }

  /**
   * Waits for the supervisor to finish draining.
   *
   * @param timeout upper bound
   * @return {@code true} when stopped in time
   * @throws InterruptedException when interrupted while waiting
   */
  public boolean awaitStopped(Duration timeout) throws InterruptedException {
    return supervisor.awaitStopped(timeout);
  }

  public SupervisorState state() {
    return supervisor.state();
  }

  public ReplicationStats stats() {
    return stats;
  }

  Optional<HealthServer> health() {
    return health;
  }

  @Override
  public void close() {
    health.ifPresent(HealthServer::close);
    if (metrics != null) {
      try {
        metrics.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics exporter", ex);
      }
    }
  }
}
