package se.alipsa.jdruid.engine;

import java.util.Map;

/**
 * Extracts one column value from a normalized row.
 */
@FunctionalInterface
public interface ValueGetter {

  /**
   * Read the value from the row.
   *
   * @param row
   *          the normalized row
   * @return the (decoded) value, may be {@code null}
   */
  Object get(Map<String, Object> row);
}
