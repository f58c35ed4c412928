package ca.gc.cra.bridge.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ShutdownHookTest {
  private final List<Integer> halts = new ArrayList<>();

  @Test
  void gracefulDrainHaltsWithSuccess() throws Exception {
    CompletableFuture<ExitCode> outcome = new CompletableFuture<>();
    StubBridge bridge = new StubBridge(true);
    Thread hook = new Thread(new ShutdownHook(bridge, outcome, Duration.ofSeconds(5), halts::add));

    hook.start();
    assertTrue(bridge.stopRequested.await(5, TimeUnit.SECONDS));
    outcome.complete(ExitCode.SUCCESS);
    hook.join(5_000);

    assertEquals(List.of(0), halts);
  }

  @Test
  void failedRunKeepsItsStatus() {
    CompletableFuture<ExitCode> outcome = CompletableFuture.completedFuture(ExitCode.CONNECTION_FAILURE);

    new ShutdownHook(new StubBridge(true), outcome, Duration.ofSeconds(1), halts::add).run();

    assertEquals(List.of(1), halts);
  }

  @Test
  void drainTimeoutHaltsWithFailure() {
    StubBridge bridge = new StubBridge(false);

    new ShutdownHook(bridge, new CompletableFuture<>(), Duration.ofMillis(10), halts::add).run();

    assertEquals(0, bridge.stopRequested.getCount());
    assertEquals(List.of(1), halts);
  }

  @Test
  void missingCleanupResultHaltsWithFailure() {
    new ShutdownHook(new StubBridge(true), new CompletableFuture<>(), Duration.ofMillis(10), halts::add).run();

    assertEquals(List.of(1), halts);
  }

  private static final class StubBridge implements ShutdownHook.Drainable {
    private final boolean stops;
    final CountDownLatch stopRequested = new CountDownLatch(1);

    StubBridge(boolean stops) {
      this.stops = stops;
    }

    @Override
    public void requestStop() {
      stopRequested.countDown();
    }

    @Override
    public boolean awaitStopped(Duration timeout) {
      return stops;
    }
  }
}
