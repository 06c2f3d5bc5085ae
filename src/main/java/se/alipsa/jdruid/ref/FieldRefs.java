package se.alipsa.jdruid.ref;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import se.alipsa.jdruid.model.ColumnMetadata;

/**
 * Resolves result columns to canonical field reference clauses, e.g.
 * {@code ["field-id", 1]} or {@code ["fk->", ["field-id", 2], ["field-id", 1]]}.
 */
public final class FieldRefs {

  /** Clause referencing a field by id. */
  public static final String FIELD_ID = "field-id";
  /** Clause referencing a field reached through a foreign key. */
  public static final String FK = "fk->";
  /** Clause referencing a custom expression by name. */
  public static final String EXPRESSION = "expression";
  /** Clause referencing an aggregation by index. */
  public static final String AGGREGATION = "aggregation";
  /** Clause referencing a field of a joined table. */
  public static final String JOINED_FIELD = "joined-field";

  private FieldRefs() {
  }

  /**
   * Field reference of a column, without knowledge of the other result columns.
   *
   * @param column
   *          the column
   * @return the reference, or {@code null} when it cannot be determined
   */
  public static List<Object> fieldRefForColumn(ColumnMetadata column) {
    return fieldRefForColumn(column, null);
  }

  /**
   * Field reference of a column.
   *
   * <p>
   * Aggregation columns are referenced by their position among the aggregation
   * columns of {@code columns}, so they can only be resolved when the column list
   * is supplied. The column is located by identity.
   * </p>
   *
   * @param column
   *          the column
   * @param columns
   *          all result columns (may be {@code null})
   * @return the reference, or {@code null} when it cannot be determined
   */
  public static List<Object> fieldRefForColumn(ColumnMetadata column, List<ColumnMetadata> columns) {
    Objects.requireNonNull(column, "column");
    Object id = column.id();
    if (id != null) {
      if (id instanceof List<?> clause) {
        return new ArrayList<>(clause);
      }
      if (column.fkFieldId() != null) {
        return List.of(FK, List.of(FIELD_ID, column.fkFieldId()), List.of(FIELD_ID, id));
      }
      return List.of(FIELD_ID, id);
    }
    if (column.expressionName() != null) {
      return List.of(EXPRESSION, column.expressionName());
    }
    if (column.isAggregation() && columns != null) {
      int aggregationIndex = 0;
      for (ColumnMetadata candidate : columns) {
        if (candidate == column) {
          return List.of(AGGREGATION, aggregationIndex);
        }
        if (candidate != null && candidate.isAggregation()) {
          aggregationIndex++;
        }
      }
    }
    return null;
  }

  /**
   * Normalize a field reference: bare integers become {@code ["field-id", n]},
   * including the operands of the deprecated {@code ["fk->", 2, 1]} form.
   *
   * @param ref
   *          the reference (may be {@code null})
   * @return the normalized reference, or {@code null} when {@code ref} is
   *         {@code null}
   */
  public static Object normalizeFieldRef(Object ref) {
    if (ref == null) {
      return null;
    }
    if (ref instanceof Number number) {
      return List.of(FIELD_ID, number.intValue());
    }
    if (!(ref instanceof List<?> clause) || clause.isEmpty()) {
      return ref;
    }
    Object head = clause.get(0);
    if (FK.equals(head) && clause.size() == 3) {
      return List.of(FK, normalizeFieldRef(clause.get(1)), normalizeFieldRef(clause.get(2)));
    }
    if (JOINED_FIELD.equals(head) && clause.size() == 3) {
      return List.of(JOINED_FIELD, clause.get(1), normalizeFieldRef(clause.get(2)));
    }
    if (FIELD_ID.equals(head) && clause.size() == 2 && clause.get(1) instanceof Number number) {
      return List.of(FIELD_ID, number.intValue());
    }
    return clause;
  }

  /**
   * Find the column a table column setting refers to: first by (normalized)
   * field reference, then by name.
   *
   * @param columns
   *          the result columns
   * @param setting
   *          the column setting
   * @return the column, or {@code null} when none matches
   */
  public static ColumnMetadata findColumnForColumnSetting(List<ColumnMetadata> columns, ColumnSetting setting) {
    Objects.requireNonNull(columns, "columns");
    Objects.requireNonNull(setting, "setting");
    Object wanted = normalizeFieldRef(setting.fieldRef());
    if (wanted != null) {
      for (ColumnMetadata column : columns) {
        if (wanted.equals(normalizeFieldRef(fieldRefForColumn(column, columns)))) {
          return column;
        }
      }
    }
    if (setting.name() != null) {
      for (ColumnMetadata column : columns) {
        if (setting.name().equals(column.name())) {
          return column;
        }
      }
    }
    return null;
  }
}
