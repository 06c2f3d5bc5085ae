package se.alipsa.jdruid.engine;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The outcome of normalizing an engine payload: the projection in result order
 * and a single pass reader over flat rows keyed by column identifier.
 *
 * @param projections
 *          the column identifiers in result order
 * @param rows
 *          the normalized rows
 */
public record NormalizedResult(List<String> projections, RowReader rows) {

  /**
   * Canonical constructor.
   *
   * @param projections
   *          the column identifiers in result order ({@code null} means none)
   * @param rows
   *          the normalized rows
   */
  public NormalizedResult {
    projections = projections == null ? List.of() : List.copyOf(projections);
    Objects.requireNonNull(rows, "rows");
  }

  /**
   * The keys of the first row, without consuming it.
   *
   * @return the keys in row order, or an empty list when there are no rows
   */
  public List<String> firstRowKeys() {
    Map<String, Object> first = rows.peek();
    return first == null ? List.of() : List.copyOf(first.keySet());
  }
}
