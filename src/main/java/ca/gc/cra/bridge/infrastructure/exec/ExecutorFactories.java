package ca.gc.cra.bridge.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the bridge's few background threads: broker client callbacks and the health
 * endpoint.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);
  private static final UncaughtExceptionHandler LOGGING_HANDLER =
      (thread, ex) -> log.error("Uncaught exception on thread {}", thread.getName(), ex);

  private ExecutorFactories() {}

  /**
   * Builds a thread factory that names threads {@code prefix-N}.
   *
   * @param prefix thread-name prefix; blank values fall back to {@code bridge}
   * @param daemon whether created threads should be daemons
   * @return thread factory logging uncaught exceptions
   */
  public static ThreadFactory namedThreadFactory(String prefix, boolean daemon) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "bridge" : prefix;
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(LOGGING_HANDLER);
      return thread;
    };
  }

  /**
   * Builds a single-threaded daemon executor with an unbounded queue.
   *
   * <p>Used for the health endpoint so that a slow scrape never blocks process exit.</p>
   *
   * @param prefix thread-name prefix
   * @return executor service; callers shut it down
   */
  public static ExecutorService newSingleDaemonExecutor(String prefix) {
    ThreadFactory factory = namedThreadFactory(Objects.requireNonNullElse(prefix, "bridge"), true);
    return new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        factory);
  }
}
