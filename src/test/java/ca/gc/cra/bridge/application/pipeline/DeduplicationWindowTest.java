package ca.gc.cra.bridge.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class DeduplicationWindowTest {

  @Test
  void recordReportsFirstSightingOnly() {
    DeduplicationWindow window = new DeduplicationWindow();

    assertTrue(window.record("k2r:orders:0:1"));
    assertFalse(window.record("k2r:orders:0:1"));
    assertTrue(window.contains("k2r:orders:0:1"));
    assertEquals(1, window.size());
  }

  @Test
  void fullWindowEvictsOldestBatch() {
    DeduplicationWindow window = new DeduplicationWindow();
    for (int i = 0; i < 10_001; i++) {
      window.record("k2r:orders:0:" + i);
    }

    assertEquals(9_001, window.size());
    assertFalse(window.contains("k2r:orders:0:0"));
    assertFalse(window.contains("k2r:orders:0:999"));
    assertTrue(window.contains("k2r:orders:0:1000"));
    assertTrue(window.contains("k2r:orders:0:10000"));
  }

  @Test
  void clearForgetsEverything() {
    DeduplicationWindow window = new DeduplicationWindow(4, 2);
    window.record("a");
    window.record("b");

    window.clear();

    assertEquals(0, window.size());
    assertTrue(window.record("a"));
  }

  @Test
  void rejectsInvalidSizing() {
    assertThrows(IllegalArgumentException.class, () -> new DeduplicationWindow(0, 1));
    assertThrows(IllegalArgumentException.class, () -> new DeduplicationWindow(10, 11));
  }
}
