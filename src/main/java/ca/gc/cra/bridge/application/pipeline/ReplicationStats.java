package ca.gc.cra.bridge.application.pipeline;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide replication counters.
 *
 * <p>Written by the supervisor thread, read by the health endpoint through {@link #snapshot()}.
 * Counters are never reset.</p>
 *
 * @since 0.1.0
 */
public final class ReplicationStats {
  private final long startedAtMillis;
  private final AtomicLong messagesProcessed = new AtomicLong();
  private final AtomicLong errors = new AtomicLong();
  private final AtomicLong routeMisses = new AtomicLong();
  private final AtomicLong duplicates = new AtomicLong();
  private final AtomicLong lastMessageAtMillis = new AtomicLong();

  /**
   * Creates counters anchored at the given start time.
   *
   * @param startedAtMillis epoch millis the process started
   */
  public ReplicationStats(long startedAtMillis) {
    this.startedAtMillis = startedAtMillis;
  }

  /**
   * Counts a processed message.
   *
   * @param nowMillis receive time
   * @return new processed total
   */
  public long recordMessage(long nowMillis) {
    lastMessageAtMillis.set(nowMillis);
    return messagesProcessed.incrementAndGet();
  }

  public long recordError() {
    return errors.incrementAndGet();
  }

  public long recordRouteMiss() {
    return routeMisses.incrementAndGet();
  }

  public long recordDuplicate() {
    return duplicates.incrementAndGet();
  }

  /**
   * Copies the current counter values.
   *
   * @return immutable snapshot
   */
  public StatsSnapshot snapshot() {
    return new StatsSnapshot(
        messagesProcessed.get(),
        errors.get(),
        routeMisses.get(),
        duplicates.get(),
        startedAtMillis,
        lastMessageAtMillis.get());
  }
}
