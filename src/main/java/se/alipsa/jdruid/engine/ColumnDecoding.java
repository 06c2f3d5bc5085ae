package se.alipsa.jdruid.engine;

import java.math.BigDecimal;

/**
 * The decoding applied to a column value when a result row is materialized.
 */
public enum ColumnDecoding {
  /**
   * The value is returned unchanged.
   */
  IDENTITY {
    @Override
    public Object apply(Object value) {
      return value;
    }
  },
  /**
   * Approximate cardinality estimates are rounded to the nearest integer, halves
   * rounding up.
   */
  ROUNDED {
    @Override
    public Object apply(Object value) {
      if (value == null) {
        return null;
      }
      if (value instanceof Number number) {
        return Math.round(number.doubleValue());
      }
      return Math.round(Double.parseDouble(value.toString().trim()));
    }
  },
  /**
   * Integer encoded values delivered as text are parsed; absent or empty values
   * stay {@code null}. Numbers that are not integral or do not fit an
   * {@code int} are rejected.
   */
  PARSED_INTEGER {
    @Override
    public Object apply(Object value) {
      if (value == null) {
        return null;
      }
      if (value instanceof Integer) {
        return value;
      }
      if (value instanceof Number number) {
        return exactInt(number);
      }
      String text = value.toString().trim();
      if (text.isEmpty()) {
        return null;
      }
      return Integer.parseInt(text);
    }
  };

  /**
   * Decode a raw column value.
   *
   * @param value
   *          the raw value (may be {@code null})
   * @return the decoded value
   * @throws NumberFormatException
   *           if a textual value cannot be decoded
   */
  public abstract Object apply(Object value);

  private static int exactInt(Number number) {
    try {
      return new BigDecimal(number.toString()).intValueExact();
    } catch (ArithmeticException | NumberFormatException e) {
      throw new NumberFormatException("Not an integer value: " + number);
    }
  }
}
