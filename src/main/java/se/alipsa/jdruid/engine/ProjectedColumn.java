package se.alipsa.jdruid.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A column of the normalized result together with its public name and the
 * decoding its values need.
 *
 * <p>
 * The query compiler emits a few reserved identifiers: {@value #TIMESTAMP_INT}
 * holds an integer encoded date unit as text, {@value #DISTINCT_COUNT} holds a
 * floating point cardinality estimate and identifiers starting with
 * {@value #TRANSIENT_PREFIX} are helper columns that are never returned.
 * </p>
 *
 * @param key
 *          the identifier used in the engine rows
 * @param name
 *          the name the column is exposed under
 * @param decoding
 *          the decoding applied to values of the column
 * @param transientColumn
 *          whether the column is a helper that must be dropped from the result
 */
public record ProjectedColumn(String key, String name, ColumnDecoding decoding, boolean transientColumn) {

  /** Reserved identifier for integer encoded date units delivered as text. */
  public static final String TIMESTAMP_INT = "timestamp___int";
  /** Reserved identifier for approximate distinct counts. */
  public static final String DISTINCT_COUNT = "distinct___count";
  /** Prefix of helper columns. */
  public static final String TRANSIENT_PREFIX = "___";

  /**
   * Canonical constructor.
   *
   * @param key
   *          the identifier used in the engine rows
   * @param name
   *          the name the column is exposed under
   * @param decoding
   *          the decoding applied to values of the column
   * @param transientColumn
   *          whether the column is a helper that must be dropped from the result
   */
  public ProjectedColumn {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(decoding, "decoding");
  }

  /**
   * Classify an identifier.
   *
   * @param key
   *          the identifier as it appears in the engine rows
   * @return the projected column
   */
  public static ProjectedColumn of(String key) {
    Objects.requireNonNull(key, "key");
    return switch (key) {
      case TIMESTAMP_INT -> new ProjectedColumn(key, "timestamp", ColumnDecoding.PARSED_INTEGER, false);
      case DISTINCT_COUNT -> new ProjectedColumn(key, "count", ColumnDecoding.ROUNDED, false);
      default -> new ProjectedColumn(key, key, ColumnDecoding.IDENTITY, key.startsWith(TRANSIENT_PREFIX));
    };
  }

  /**
   * Classify a list of identifiers.
   *
   * @param keys
   *          identifiers in projection order
   * @return projected columns in the same order
   */
  public static List<ProjectedColumn> of(List<String> keys) {
    List<ProjectedColumn> columns = new ArrayList<>(keys.size());
    for (String key : keys) {
      columns.add(of(key));
    }
    return columns;
  }

  /**
   * Remove helper columns.
   *
   * @param columns
   *          projected columns
   * @return the columns that are not transient, order preserved
   */
  public static List<ProjectedColumn> withoutTransient(List<ProjectedColumn> columns) {
    List<ProjectedColumn> kept = new ArrayList<>(columns.size());
    for (ProjectedColumn column : columns) {
      if (!column.transientColumn()) {
        kept.add(column);
      }
    }
    return kept;
  }
}
