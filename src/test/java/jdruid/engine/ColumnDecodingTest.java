package jdruid.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import se.alipsa.jdruid.engine.ColumnDecoding;

class ColumnDecodingTest {

  @Test
  void roundsCardinalityEstimatesHalfUp() {
    assertEquals(2L, ColumnDecoding.ROUNDED.apply(2.4));
    assertEquals(3L, ColumnDecoding.ROUNDED.apply(2.5));
    assertEquals(3L, ColumnDecoding.ROUNDED.apply(2.6));
    assertEquals(0L, ColumnDecoding.ROUNDED.apply(0.49));
    assertEquals(-2L, ColumnDecoding.ROUNDED.apply(-2.5));
    assertEquals(17L, ColumnDecoding.ROUNDED.apply(17));
    assertEquals(4L, ColumnDecoding.ROUNDED.apply("3.5"));
  }

  @Test
  void roundedValuesOfNonNegativeInputAreNonNegative() {
    for (double value = 0.0; value < 50.0; value += 0.37) {
      Object rounded = ColumnDecoding.ROUNDED.apply(value);
      assertTrue((Long) rounded >= 0, "rounded value of " + value);
    }
  }

  @Test
  void roundingKeepsAbsentValuesAbsent() {
    assertNull(ColumnDecoding.ROUNDED.apply(null));
  }

  @Test
  void parsesIntegerEncodedText() {
    assertEquals(3, ColumnDecoding.PARSED_INTEGER.apply("3"));
    assertEquals(52, ColumnDecoding.PARSED_INTEGER.apply(" 52 "));
    assertEquals(-1, ColumnDecoding.PARSED_INTEGER.apply("-1"));
    assertEquals(7, ColumnDecoding.PARSED_INTEGER.apply(7L));
  }

  @Test
  void absentOrEmptyIntegerTextIsNotZero() {
    assertNull(ColumnDecoding.PARSED_INTEGER.apply(null));
    assertNull(ColumnDecoding.PARSED_INTEGER.apply(""));
    assertNull(ColumnDecoding.PARSED_INTEGER.apply("  "));
  }

  @Test
  void malformedIntegerTextFails() {
    assertThrows(NumberFormatException.class, () -> ColumnDecoding.PARSED_INTEGER.apply("monday"));
    assertThrows(NumberFormatException.class, () -> ColumnDecoding.PARSED_INTEGER.apply("1.5"));
  }

  @Test
  void numbersMustBeExactIntegers() {
    assertEquals(3, ColumnDecoding.PARSED_INTEGER.apply(3.0));
    assertEquals(Integer.MAX_VALUE, ColumnDecoding.PARSED_INTEGER.apply((long) Integer.MAX_VALUE));
    assertThrows(NumberFormatException.class, () -> ColumnDecoding.PARSED_INTEGER.apply(3000000000L));
    assertThrows(NumberFormatException.class, () -> ColumnDecoding.PARSED_INTEGER.apply(1.5));
    assertThrows(NumberFormatException.class, () -> ColumnDecoding.PARSED_INTEGER.apply(Double.NaN));
    assertThrows(NumberFormatException.class, () -> ColumnDecoding.PARSED_INTEGER.apply("3000000000"));
  }

  @Test
  void identityReturnsTheValue() {
    Object value = new Object();
    assertEquals(value, ColumnDecoding.IDENTITY.apply(value));
    assertNull(ColumnDecoding.IDENTITY.apply(null));
  }
}
