package ca.gc.cra.bridge.application.pipeline;

import java.util.OptionalLong;

/**
 * Immutable copy of the replication counters, safe to hand to other threads.
 *
 * @param messagesProcessed messages received and routed (first attempt only)
 * @param errors delivery, acknowledgement and loop errors
 * @param routeMisses messages without a configured route
 * @param duplicates messages suppressed by the deduplication window
 * @param startedAtMillis epoch millis when counting began
 * @param lastMessageAtMillis epoch millis of the last processed message, or {@code 0} when none
 * @since 0.1.0
 */
public record StatsSnapshot(
    long messagesProcessed,
    long errors,
    long routeMisses,
    long duplicates,
    long startedAtMillis,
    long lastMessageAtMillis) {

  /**
   * Computes uptime.
   *
   * @param nowMillis current epoch millis
   * @return millis since start, never negative
   */
  public long uptimeMillis(long nowMillis) {
    return Math.max(0L, nowMillis - startedAtMillis);
  }

  /**
   * Computes the time since the last processed message.
   *
   * @param nowMillis current epoch millis
   * @return elapsed millis, or empty when nothing has been processed
   */
  public OptionalLong millisSinceLastMessage(long nowMillis) {
    if (lastMessageAtMillis <= 0L) {
      return OptionalLong.empty();
    }
    return OptionalLong.of(Math.max(0L, nowMillis - lastMessageAtMillis));
  }

  /**
   * Average throughput since start.
   *
   * @param nowMillis current epoch millis
   * @return messages per second; {@code 0} during the first second
   */
  public double averageRatePerSecond(long nowMillis) {
    long uptime = uptimeMillis(nowMillis);
    if (uptime < 1_000L) {
      return 0.0d;
    }
    return messagesProcessed * 1_000.0d / uptime;
  }
}
