package ca.gc.cra.bridge.application.port;

import java.time.Duration;

/**
 * Pause strategy used between retries and connect attempts, replaceable in tests.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Sleeper {
  /**
   * Blocks the calling thread.
   *
   * @param duration pause length; zero or negative returns immediately
   * @throws InterruptedException when interrupted while paused
   */
  void sleep(Duration duration) throws InterruptedException;

  /** Sleeper backed by {@link Thread#sleep(long)}. */
  Sleeper THREAD = duration -> {
    if (duration != null && !duration.isNegative() && !duration.isZero()) {
      Thread.sleep(duration.toMillis());
    }
  };
}
