package ca.gc.cra.bridge.infrastructure.exec;

import ca.gc.cra.bridge.application.port.ConnectionException;
import ca.gc.cra.bridge.application.port.Sleeper;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Bounded retry loop for broker connection attempts.
 * <p><strong>Why:</strong> Brokers in a compose stack start after the bridge; a few spaced attempts
 * absorb that without hiding a genuinely unreachable endpoint.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 * <p><strong>Observability:</strong> Logs each failed attempt at WARN and the final failure through
 * the thrown {@link ConnectionException}.</p>
 *
 * @since 0.1.0
 */
public final class RetryPolicy {
  private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

  public static final int DEFAULT_ATTEMPTS = 5;
  public static final Duration DEFAULT_BACKOFF = Duration.ofSeconds(5);

  private final int attempts;
  private final Duration backoff;
  private final Sleeper sleeper;

  /**
   * Operation attempted by {@link #execute(String, Attempt)}.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  public interface Attempt<T> {
    T run() throws Exception;
  }

  public RetryPolicy(int attempts, Duration backoff, Sleeper sleeper) {
    if (attempts < 1) {
      throw new IllegalArgumentException("attempts must be >= 1");
    }
    this.attempts = attempts;
    this.backoff = Objects.requireNonNull(backoff, "backoff");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  /**
   * Returns the default policy: five attempts five seconds apart.
   *
   * @return default policy
   */
  public static RetryPolicy defaults() {
    return new RetryPolicy(DEFAULT_ATTEMPTS, DEFAULT_BACKOFF, Sleeper.THREAD);
  }

  /**
   * Runs {@code attempt} until it succeeds or the attempts are exhausted.
   *
   * @param target label used in logs and the failure message
   * @param attempt operation to run
   * @param <T> result type
   * @return the first successful result
   * @throws ConnectionException when every attempt failed or the thread was interrupted
   */
  public <T> T execute(String target, Attempt<T> attempt) throws ConnectionException {
    Objects.requireNonNull(attempt, "attempt");
    Exception last = null;
    for (int i = 1; i <= attempts; i++) {
      try {
        T result = attempt.run();
        if (i > 1) {
          log.info("Connected to {} on attempt {}/{}", target, i, attempts);
        }
        return result;
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new ConnectionException("Interrupted while connecting to " + target, ex);
      } catch (Exception ex) {
        last = ex;
        log.warn("Connection attempt {}/{} to {} failed: {}", i, attempts, target, ex.toString());
      }
      if (i < attempts) {
        try {
          sleeper.sleep(backoff);
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          throw new ConnectionException("Interrupted while waiting to reconnect to " + target, ex);
        }
      }
    }
    throw new ConnectionException(
        "Unable to connect to " + target + " after " + attempts + " attempts", last);
  }

  public int attempts() {
    return attempts;
  }

  public Duration backoff() {
    return backoff;
  }
}
