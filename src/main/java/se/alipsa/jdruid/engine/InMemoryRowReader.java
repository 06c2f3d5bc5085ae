package se.alipsa.jdruid.engine;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link RowReader} implementation backed by an in-memory list of rows.
 */
public final class InMemoryRowReader implements RowReader {

  private final List<Map<String, Object>> rows;
  private int index;

  /**
   * Create a new reader that iterates over the provided rows.
   *
   * @param rows
   *          the rows to expose through the reader
   */
  public InMemoryRowReader(List<Map<String, Object>> rows) {
    this.rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
    this.index = 0;
  }

  @Override
  public Map<String, Object> read() {
    Map<String, Object> row = peek();
    if (row != null) {
      index++;
    }
    return row;
  }

  @Override
  public Map<String, Object> peek() {
    if (index >= rows.size()) {
      return null;
    }
    return rows.get(index);
  }
}
