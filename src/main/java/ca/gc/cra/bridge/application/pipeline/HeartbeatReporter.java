package ca.gc.cra.bridge.application.pipeline;

import ca.gc.cra.bridge.application.port.ClockPort;
import ca.gc.cra.bridge.application.port.MessageSource;
import ca.gc.cra.bridge.domain.route.Direction;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits the periodic heartbeat log line: uptime, counters, time since the last message, average
 * rate and source backlog.
 *
 * @since 0.1.0
 */
public final class HeartbeatReporter {
  private static final Logger log = LoggerFactory.getLogger(HeartbeatReporter.class);

  private final Direction direction;
  private final ReplicationStats stats;
  private final MessageSource source;
  private final Duration interval;
  private final ClockPort clock;
  private long lastReportMillis;

  public HeartbeatReporter(
      Direction direction, ReplicationStats stats, MessageSource source, Duration interval, ClockPort clock) {
    this.direction = Objects.requireNonNull(direction, "direction");
    this.stats = Objects.requireNonNull(stats, "stats");
    this.source = Objects.requireNonNull(source, "source");
    this.interval = Objects.requireNonNull(interval, "interval");
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
    this.lastReportMillis = this.clock.nowMillis();
  }

  /**
   * Reports when at least one interval elapsed since the previous heartbeat.
   *
   * @return {@code true} when a heartbeat was emitted
   */
  public boolean maybeReport() {
    long now = clock.nowMillis();
    if (now - lastReportMillis < interval.toMillis()) {
      return false;
    }
    lastReportMillis = now;
    log.info(render(now));
    return true;
  }

  /**
   * Renders the heartbeat line for the given instant.
   *
   * @param nowMillis current epoch millis
   * @return heartbeat text
   */
  String render(long nowMillis) {
    StatsSnapshot snapshot = stats.snapshot();
    OptionalLong idle = snapshot.millisSinceLastMessage(nowMillis);
    return String.format(Locale.ROOT,
        "Heartbeat %s: uptime=%s messages=%d errors=%d unrouted=%d duplicates=%d lastMessage=%s rate=%.2f/s backlog=%s",
        direction,
        Duration.ofMillis(snapshot.uptimeMillis(nowMillis)),
        snapshot.messagesProcessed(),
        snapshot.errors(),
        snapshot.routeMisses(),
        snapshot.duplicates(),
        idle.isPresent() ? Duration.ofMillis(idle.getAsLong()) + " ago" : "never",
        snapshot.averageRatePerSecond(nowMillis),
        describeBacklog());
  }

  private String describeBacklog() {
    try {
      Map<String, Long> backlog = source.backlog();
      return backlog.isEmpty() ? "unknown" : backlog.toString();
    } catch (RuntimeException ex) {
      log.debug("Backlog unavailable for heartbeat", ex);
      return "unavailable";
    }
  }
}
