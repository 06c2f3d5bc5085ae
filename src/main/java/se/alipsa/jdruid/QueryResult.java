package se.alipsa.jdruid;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import se.alipsa.jdruid.model.ResultMetadata;

/**
 * Immutable, fully materialized query result.
 *
 * @param metadata
 *          the column descriptors
 * @param rows
 *          list of rows, each row is a list of column values
 */
public record QueryResult(ResultMetadata metadata, List<List<Object>> rows) {

  /**
   * Canonical constructor verifying arguments.
   *
   * @param metadata
   *          the column descriptors
   * @param rows
   *          rows
   */
  public QueryResult {
    Objects.requireNonNull(metadata, "metadata");
    rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
  }

  /**
   * The column names in result order.
   *
   * @return the names
   */
  public List<String> columnNames() {
    return metadata.columnNames();
  }

  /**
   * Convenience accessor returning the values of one column.
   *
   * @param name
   *          the column name
   * @return the values of the column in row order
   * @throws IllegalArgumentException
   *           if there is no such column
   */
  public List<Object> columnValues(String name) {
    int index = columnNames().indexOf(name);
    if (index < 0) {
      throw new IllegalArgumentException("No such column: " + name);
    }
    List<Object> values = new ArrayList<>(rows.size());
    for (List<Object> row : rows) {
      values.add(row.get(index));
    }
    return values;
  }

  /**
   * Create a callback that collects the streamed rows into a
   * {@link QueryResult}.
   *
   * @return a new collector, intended for a single execution
   */
  public static Collector collector() {
    return new Collector();
  }

  /**
   * {@link ResultCallback} draining the row stream eagerly.
   */
  public static final class Collector implements ResultCallback {

    private QueryResult result;

    private Collector() {
    }

    @Override
    public void respond(ResultMetadata metadata, Stream<List<Object>> rows) {
      if (result != null) {
        throw new IllegalStateException("Result already collected");
      }
      List<List<Object>> collected = new ArrayList<>();
      rows.forEachOrdered(collected::add);
      result = new QueryResult(metadata, collected);
    }

    /**
     * Whether a result has been received.
     *
     * @return {@code true} after a successful execution
     */
    public boolean hasResult() {
      return result != null;
    }

    /**
     * The collected result.
     *
     * @return the result
     * @throws IllegalStateException
     *           if no result has been received
     */
    public QueryResult result() {
      if (result == null) {
        throw new IllegalStateException("No result has been received");
      }
      return result;
    }
  }
}
