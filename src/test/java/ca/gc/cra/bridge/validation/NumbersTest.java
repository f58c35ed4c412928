package ca.gc.cra.bridge.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(10, Numbers.requireRange("prefetch", 10, 1, 64));
  }

  @Test
  void requireRangeRejectsValuesAboveMaximum() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("prefetch", 65, 1, 64));
  }

  @Test
  void parseBoundedIntUsesDefaultWhenBlank() {
    assertEquals(100, Numbers.parseBoundedInt(Map.of("maxPollRecords", " "), "maxPollRecords", 100, 1, 10_000));
  }

  @Test
  void parseBoundedIntRejectsNonNumeric() {
    assertThrows(
        IllegalArgumentException.class,
        () -> Numbers.parseBoundedInt(Map.of("maxPollRecords", "lots"), "maxPollRecords", 100, 1, 10_000));
  }

  @Test
  void parseBooleanIsStrict() {
    assertTrue(Numbers.parseBoolean(Map.of("publisherConfirms", "TRUE"), "publisherConfirms", false));
    assertFalse(Numbers.parseBoolean(Map.of(), "publisherConfirms", false));
    assertThrows(
        IllegalArgumentException.class,
        () -> Numbers.parseBoolean(Map.of("publisherConfirms", "ture"), "publisherConfirms", true));
  }
}
