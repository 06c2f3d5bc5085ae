package se.alipsa.jdruid.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered column descriptors of a query result.
 *
 * @param cols
 *          the column descriptors in result order
 */
public record ResultMetadata(List<ColumnMetadata> cols) {

  /**
   * Canonical constructor, copies the supplied columns.
   *
   * @param cols
   *          the column descriptors in result order ({@code null} means none)
   */
  public ResultMetadata {
    cols = cols == null ? List.of() : List.copyOf(cols);
  }

  /**
   * The number of columns.
   *
   * @return the column count
   */
  public int getColumnCount() {
    return cols.size();
  }

  /**
   * The column names in result order.
   *
   * @return the names
   */
  public List<String> columnNames() {
    List<String> names = new ArrayList<>(cols.size());
    for (ColumnMetadata col : cols) {
      names.add(col.name());
    }
    return List.copyOf(names);
  }
}
