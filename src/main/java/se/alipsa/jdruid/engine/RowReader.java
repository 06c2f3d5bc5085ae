package se.alipsa.jdruid.engine;

import java.util.Map;

/**
 * Minimal abstraction for sequential, single pass access to normalized rows.
 */
public interface RowReader {

  /**
   * Read the next available row.
   *
   * @return the next row, or {@code null} when exhausted
   */
  Map<String, Object> read();

  /**
   * Look at the next row without consuming it.
   *
   * @return the row the next {@link #read()} returns, or {@code null} when
   *         exhausted
   */
  Map<String, Object> peek();
}
