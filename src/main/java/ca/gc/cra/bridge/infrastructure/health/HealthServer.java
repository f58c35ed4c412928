package ca.gc.cra.bridge.infrastructure.health;

import ca.gc.cra.bridge.application.json.JsonSupport;
import ca.gc.cra.bridge.application.pipeline.ReplicationStats;
import ca.gc.cra.bridge.application.pipeline.StatsSnapshot;
import ca.gc.cra.bridge.application.pipeline.SupervisorState;
import ca.gc.cra.bridge.application.port.ClockPort;
import ca.gc.cra.bridge.domain.route.Direction;
import ca.gc.cra.bridge.infrastructure.exec.ExecutorFactories;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Minimal HTTP endpoint answering {@code GET /health} with a JSON status
 * document.
 * <p><strong>Why:</strong> Container orchestrators probe liveness over HTTP; the replication loop
 * itself has no listener.</p>
 * <p><strong>Role:</strong> Infrastructure adapter reading {@link StatsSnapshot} and the supervisor
 * state from its own daemon thread.</p>
 * <p><strong>Thread-safety:</strong> {@link #start()} and {@link #close()} are expected from the main
 * thread; requests are served by a single worker.</p>
 *
 * @since 0.1.0
 */
public final class HealthServer implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(HealthServer.class);
  static final String PATH = "/health";

  private final int requestedPort;
  private final Direction direction;
  private final Supplier<SupervisorState> state;
  private final ReplicationStats stats;
  private final ClockPort clock;
  private final JsonSupport json = new JsonSupport();

  private HttpServer server;
  private ExecutorService executor;

  /**
   * Creates a health server; nothing is bound until {@link #start()}.
   *
   * @param port TCP port, or {@code 0} for an ephemeral port
   * @param direction replication direction reported in the body
   * @param state supplier of the supervisor state
   * @param stats counters to report
   * @param clock clock used for uptime
   */
  public HealthServer(
      int port,
      Direction direction,
      Supplier<SupervisorState> state,
      ReplicationStats stats,
      ClockPort clock) {
    if (port < 0 || port > 65_535) {
      throw new IllegalArgumentException("health port must be within 0..65535");
    }
    this.requestedPort = port;
    this.direction = Objects.requireNonNull(direction, "direction");
    this.state = Objects.requireNonNull(state, "state");
    this.stats = Objects.requireNonNull(stats, "stats");
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
  }

  /**
   * Binds and starts serving. A bind failure is logged and leaves the server stopped.
   *
   * @return {@code true} when the endpoint is listening
   */
  public synchronized boolean start() {
    if (server != null) {
      return true;
    }
    try {
      HttpServer created = HttpServer.create(new InetSocketAddress(requestedPort), 0);
      created.createContext("/", this::handle);
      executor = ExecutorFactories.newSingleDaemonExecutor("bridge-health");
      created.setExecutor(executor);
      created.start();
      server = created;
      log.info("Health endpoint listening on port {}", port());
      return true;
    } catch (IOException ex) {
      log.warn("Could not start health endpoint on port {}: {}", requestedPort, ex.getMessage());
      if (executor != null) {
        executor.shutdownNow();
        executor = null;
      }
      return false;
    }
  }

  /**
   * Returns the bound port.
   *
   * @return bound port, or {@code -1} when not listening
   */
  public synchronized int port() {
    return server == null ? -1 : server.getAddress().getPort();
  }

  @Override
  public synchronized void close() {
    if (server != null) {
      server.stop(0);
      server = null;
      log.info("Health endpoint stopped");
    }
    if (executor != null) {
      executor.shutdownNow();
      executor = null;
    }
  }

  Map<String, Object> body() {
    StatsSnapshot snapshot = stats.snapshot();
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", status(state.get()));
    body.put("direction", direction.name());
    body.put("messages_processed", snapshot.messagesProcessed());
    body.put("errors", snapshot.errors());
    body.put("uptime", snapshot.uptimeMillis(clock.nowMillis()) / 1000.0d);
    return body;
  }

  static String status(SupervisorState current) {
    if (current == SupervisorState.RUNNING) {
      return "healthy";
    }
    return current == SupervisorState.STARTING ? "starting" : "stopping";
  }

  private void handle(HttpExchange exchange) throws IOException {
    try {
      if (!PATH.equals(exchange.getRequestURI().getPath())) {
        exchange.sendResponseHeaders(404, -1);
        return;
      }
      if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
        exchange.getResponseHeaders().set("Allow", "GET");
        exchange.sendResponseHeaders(405, -1);
        return;
      }
      byte[] payload = json.write(body()).getBytes(StandardCharsets.UTF_8);
      exchange.getResponseHeaders().set("Content-Type", "application/json");
      exchange.sendResponseHeaders(200, payload.length);
      try (OutputStream out = exchange.getResponseBody()) {
        out.write(payload);
      }
    } catch (RuntimeException ex) {
      log.warn("Health request failed: {}", ex.getMessage(), ex);
      throw ex;
    } finally {
      exchange.close();
    }
  }
}
