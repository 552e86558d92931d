package ca.gc.cra.conduit.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(2_000, Numbers.requireRange("statsIntervalMs", 2_000, 250, 60_000));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("statsIntervalMs", 249, 250, 60_000));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("statsIntervalMs", 60_001, 250, 60_000));
  }

  @Test
  void requirePortAcceptsFullRange() {
    assertEquals(1, Numbers.requirePort("port", 1));
    assertEquals(65_535, Numbers.requirePort("port", 65_535));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requirePort("port", 0));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requirePort("port", 65_536));
  }

  @Test
  void parseLongNamesTheSettingOnFailure() {
    assertEquals(1500L, Numbers.parseLong("connectTimeoutMs", " 1500 "));
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class, () -> Numbers.parseLong("connectTimeoutMs", "fast"));
    assertTrue(ex.getMessage().contains("connectTimeoutMs"));
  }
}
