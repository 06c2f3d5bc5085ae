package se.alipsa.jdruid.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the value getters used to turn normalized rows into result rows.
 */
public final class ColumnGetters {

  private ColumnGetters() {
  }

  /**
   * Create a getter for a single column.
   *
   * @param column
   *          the projected column
   * @return a getter reading {@link ProjectedColumn#key()} and applying its
   *         decoding
   */
  public static ValueGetter forColumn(ProjectedColumn column) {
    String key = column.key();
    ColumnDecoding decoding = column.decoding();
    if (decoding == ColumnDecoding.IDENTITY) {
      return row -> row.get(key);
    }
    return row -> decoding.apply(row.get(key));
  }

  /**
   * Create getters for the projected columns, one per column in the same order.
   *
   * @param columns
   *          the projected columns
   * @return the getters
   */
  public static List<ValueGetter> forColumns(List<ProjectedColumn> columns) {
    List<ValueGetter> getters = new ArrayList<>(columns.size());
    for (ProjectedColumn column : columns) {
      getters.add(forColumn(column));
    }
    return getters;
  }

  /**
   * Create getters ordered by the supplied result column names.
   *
   * <p>
   * Each name is matched against the public name of a projected column so that
   * renamed columns keep their decoding. A name shared by several projected
   * columns takes them in projection order. Names without a match are read from
   * the row as-is.
   * </p>
   *
   * @param columnNames
   *          the result column names in final order
   * @param columns
   *          the projected columns the names were derived from
   * @return one getter per name
   */
  public static List<ValueGetter> forColumnNames(List<String> columnNames, List<ProjectedColumn> columns) {
    Map<String, Deque<ProjectedColumn>> byName = new LinkedHashMap<>();
    for (ProjectedColumn column : columns) {
      byName.computeIfAbsent(column.name(), k -> new ArrayDeque<>()).add(column);
    }
    List<ValueGetter> getters = new ArrayList<>(columnNames.size());
    for (String name : columnNames) {
      Deque<ProjectedColumn> candidates = byName.get(name);
      ProjectedColumn column;
      if (candidates == null) {
        column = ProjectedColumn.of(name);
      } else if (candidates.size() > 1) {
        column = candidates.poll();
      } else {
        column = candidates.peek();
      }
      getters.add(forColumn(column));
    }
    return getters;
  }
}
