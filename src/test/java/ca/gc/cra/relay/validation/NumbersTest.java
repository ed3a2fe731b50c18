package ca.gc.cra.relay.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueInsideBounds() {
    assertEquals(5, Numbers.requireRange("maxRetries", 5, 0, 10));
    assertEquals(0, Numbers.requireRange("maxRetries", 0, 0, 10));
  }

  @Test
  void requireRangeReportsBounds() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("port", 70000, 1, 65535));
    assertEquals("port must be between 1 and 65535 (was 70000)", ex.getMessage());
  }

  @Test
  void requireAtLeastRejectsNonFiniteValues() {
    assertEquals(2.5, Numbers.requireAtLeast("backoffMultiplier", 2.5, 1.0));
    assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireAtLeast("backoffMultiplier", 0.5, 1.0));
    assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireAtLeast("backoffMultiplier", Double.NaN, 1.0));
    assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireAtLeast("backoffMultiplier", Double.POSITIVE_INFINITY, 1.0));
  }
}
