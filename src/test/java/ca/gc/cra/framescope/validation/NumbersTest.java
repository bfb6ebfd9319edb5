package ca.gc.cra.framescope.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(4, Numbers.requireRange("workers", 4, 1, 64));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("workers", 0, 1, 64));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("workers", 65, 1, 64));
  }

  @Test
  void requireNonNegativeNamesTheValue() {
    assertEquals(0, Numbers.requireNonNegative("bytes", 0));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireNonNegative("bytes", -3));
    assertTrue(ex.getMessage().startsWith("bytes must be >= 0"));
  }
}
