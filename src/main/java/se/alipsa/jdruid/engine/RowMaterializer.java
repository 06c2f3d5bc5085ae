package se.alipsa.jdruid.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Applies value getters to normalized rows, producing fixed length result
 * rows.
 */
public final class RowMaterializer {

  private RowMaterializer() {
  }

  /**
   * Materialize a single row.
   *
   * @param row
   *          the normalized row
   * @param getters
   *          one getter per result column, in result order
   * @return an unmodifiable list with one value per getter ({@code null} values
   *         allowed)
   */
  public static List<Object> materialize(Map<String, Object> row, List<ValueGetter> getters) {
    List<Object> values = new ArrayList<>(getters.size());
    for (ValueGetter getter : getters) {
      values.add(getter.get(row));
    }
    return Collections.unmodifiableList(values);
  }

  /**
   * Lazily materialize all rows of a reader. The stream reads from
   * {@code rows} as it is consumed and can only be traversed once.
   *
   * @param rows
   *          the normalized rows
   * @param getters
   *          one getter per result column, in result order
   * @return a sequential stream of result rows
   */
  public static Stream<List<Object>> materialize(RowReader rows, List<ValueGetter> getters) {
    Objects.requireNonNull(rows, "rows");
    List<ValueGetter> fixed = List.copyOf(getters);
    Iterator<List<Object>> iterator = new Iterator<>() {
      @Override
      public boolean hasNext() {
        return rows.peek() != null;
      }

      @Override
      public List<Object> next() {
        Map<String, Object> row = rows.read();
        if (row == null) {
          throw new NoSuchElementException();
        }
        return materialize(row, fixed);
      }
    };
    return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED), false);
  }
}
