package ca.gc.cra.bridge.application.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing and retry knobs of the supervisor loop.
 *
 * @param pollTimeout maximum wait for one source poll
 * @param heartbeatInterval interval between heartbeat log lines
 * @param emptyPollThreshold consecutive empty polls after which the source is probed
 * @param deliveryAttempts publish attempts per message before it is rejected
 * @param retryPause pause between publish attempts of the same message
 * @param requeueOnFailure whether exhausted messages are requeued on sources that support it
 * @param errorPause pause after an unexpected error in one loop iteration
 * @param flushTimeout bound on the destination flush during shutdown
 * @since 0.1.0
 */
public record SupervisorSettings(
    Duration pollTimeout,
    Duration heartbeatInterval,
    int emptyPollThreshold,
    int deliveryAttempts,
    Duration retryPause,
    boolean requeueOnFailure,
    Duration errorPause,
    Duration flushTimeout) {

  public static final Duration LOG_POLL_TIMEOUT = Duration.ofSeconds(5);
  public static final Duration QUEUE_POLL_TIMEOUT = Duration.ofSeconds(1);
  public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(60);
  public static final int DEFAULT_EMPTY_POLL_THRESHOLD = 100;
  public static final int DEFAULT_DELIVERY_ATTEMPTS = 3;
  public static final Duration DEFAULT_RETRY_PAUSE = Duration.ofSeconds(1);
  public static final Duration DEFAULT_ERROR_PAUSE = Duration.ofSeconds(1);
  public static final Duration DEFAULT_FLUSH_TIMEOUT = Duration.ofSeconds(10);

  public SupervisorSettings {
    requirePositive("pollTimeout", pollTimeout);
    requirePositive("heartbeatInterval", heartbeatInterval);
    Objects.requireNonNull(retryPause, "retryPause");
    Objects.requireNonNull(errorPause, "errorPause");
    requirePositive("flushTimeout", flushTimeout);
    if (emptyPollThreshold <= 0) {
      throw new IllegalArgumentException("emptyPollThreshold must be positive");
    }
    if (deliveryAttempts <= 0) {
      throw new IllegalArgumentException("deliveryAttempts must be positive");
    }
  }

  /**
   * Default settings for a source that polls with the given timeout.
   *
   * @param pollTimeout {@link #LOG_POLL_TIMEOUT} or {@link #QUEUE_POLL_TIMEOUT}
   * @return settings with defaults for everything else
   */
  public static SupervisorSettings defaults(Duration pollTimeout) {
    return new SupervisorSettings(
        pollTimeout,
        DEFAULT_HEARTBEAT_INTERVAL,
        DEFAULT_EMPTY_POLL_THRESHOLD,
        DEFAULT_DELIVERY_ATTEMPTS,
        DEFAULT_RETRY_PAUSE,
        true,
        DEFAULT_ERROR_PAUSE,
        DEFAULT_FLUSH_TIMEOUT);
  }

  private static void requirePositive(String name, Duration value) {
    Objects.requireNonNull(value, name);
    if (value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
  }
}
