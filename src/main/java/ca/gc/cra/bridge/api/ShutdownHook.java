package ca.gc.cra.bridge.api;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JVM shutdown hook that drains the bridge and ends the process with the bridge's own status.
 *
 * <p>A termination signal makes the JVM exit with {@code 128 + signal} once hooks finish, and the
 * main thread's {@code System.exit} cannot override it. The hook therefore waits for the main
 * thread to publish its exit code and halts with it.</p>
 */
final class ShutdownHook implements Runnable {
  private static final Logger log = LoggerFactory.getLogger(ShutdownHook.class);

  /** The part of the running bridge the hook needs. */
  interface Drainable {
    void requestStop();

    boolean awaitStopped(Duration timeout) throws InterruptedException;
  }

  private final Drainable target;
  private final CompletableFuture<ExitCode> outcome;
  private final Duration grace;
  private final IntConsumer halt;

  ShutdownHook(Drainable target, CompletableFuture<ExitCode> outcome, Duration grace, IntConsumer halt) {
    this.target = Objects.requireNonNull(target, "target");
    this.outcome = Objects.requireNonNull(outcome, "outcome");
    this.grace = Objects.requireNonNull(grace, "grace");
    this.halt = Objects.requireNonNull(halt, "halt");
  }

  @Override
  public void run() {
    log.info("Shutdown requested; draining");
    target.requestStop();
    ExitCode code;
    try {
      if (target.awaitStopped(grace)) {
        code = outcome.get(grace.toMillis(), TimeUnit.MILLISECONDS);
      } else {
        log.warn("Bridge did not stop within {}s", grace.toSeconds());
        code = ExitCode.RUNTIME_FAILURE;
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for the bridge to drain");
      code = ExitCode.RUNTIME_FAILURE;
    } catch (TimeoutException ex) {
      log.warn("Bridge stopped but did not finish cleanup within {}s", grace.toSeconds());
      code = ExitCode.RUNTIME_FAILURE;
    } catch (ExecutionException ex) {
      log.error("Bridge ended abnormally", ex.getCause());
      code = ExitCode.RUNTIME_FAILURE;
    }
    log.info("Exiting with status {}", code.code());
    halt.accept(code.code());
  }
}
