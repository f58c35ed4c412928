package ca.gc.cra.bridge.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Locale;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runtime logging controls for the bridge process.
 * <p><strong>Why:</strong> Operators raise verbosity with {@code --verbose} and correlate log lines
 * from several bridge instances through the {@code direction} MDC key.</p>
 * <p><strong>Thread-safety:</strong> Level changes are intended for single-threaded startup. MDC
 * bindings apply to the calling thread only.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings only get a warning.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  /** MDC key carrying the lower-case replication direction tag. */
  public static final String DIRECTION_KEY = "direction";

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!Level.DEBUG.equals(root.getLevel())) {
        root.setLevel(Level.DEBUG);
      }
      return;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }

  /**
   * Binds the replication direction to the current thread's MDC.
   *
   * @param directionTag direction tag such as {@code K2R}
   */
  public static void bindDirection(String directionTag) {
    if (directionTag == null || directionTag.isBlank()) {
      return;
    }
    MDC.put(DIRECTION_KEY, directionTag.trim().toLowerCase(Locale.ROOT));
  }

  /** Removes the direction binding from the current thread's MDC. */
  public static void clearDirection() {
    MDC.remove(DIRECTION_KEY);
  }
}
