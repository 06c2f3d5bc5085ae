package se.alipsa.jdruid.model;

import java.util.Objects;

/**
 * Describes a single result column.
 *
 * <p>
 * The post-processing pipeline only fills in {@code name}; the remaining
 * attributes are supplied by the column annotation step. {@code id} is either
 * an integer field id or, for nested queries, a field clause (a {@link java.util.List}).
 * </p>
 *
 * @param name
 *          the column name as it appears in the result
 * @param displayName
 *          human readable name (may be {@code null})
 * @param baseType
 *          the base type, e.g. {@code type/Integer} (may be {@code null})
 * @param semanticType
 *          the semantic role, e.g. {@code type/Category} (may be {@code null})
 * @param id
 *          field id or field clause (may be {@code null})
 * @param fkFieldId
 *          id of the foreign key field the column was reached through (may be
 *          {@code null})
 * @param expressionName
 *          name of the custom expression producing the column (may be
 *          {@code null})
 * @param source
 *          where the column comes from, e.g. {@code fields}, {@code breakout} or
 *          {@code aggregation} (may be {@code null})
 */
public record ColumnMetadata(String name, String displayName, String baseType, String semanticType, Object id,
    Integer fkFieldId, String expressionName, String source) {

  /** Source value used for aggregation columns. */
  public static final String SOURCE_AGGREGATION = "aggregation";

  /**
   * Create a minimal descriptor carrying only a name.
   *
   * @param name
   *          the column name
   * @return the descriptor
   */
  public static ColumnMetadata named(String name) {
    return new ColumnMetadata(Objects.requireNonNull(name, "name"), null, null, null, null, null, null, null);
  }

  /**
   * Copy with another display name.
   *
   * @param displayName
   *          the human readable name
   * @return the new descriptor
   */
  public ColumnMetadata withDisplayName(String displayName) {
    return new ColumnMetadata(name, displayName, baseType, semanticType, id, fkFieldId, expressionName, source);
  }

  /**
   * Copy with another base type.
   *
   * @param baseType
   *          the base type
   * @return the new descriptor
   */
  public ColumnMetadata withBaseType(String baseType) {
    return new ColumnMetadata(name, displayName, baseType, semanticType, id, fkFieldId, expressionName, source);
  }

  /**
   * Copy with another semantic type.
   *
   * @param semanticType
   *          the semantic role
   * @return the new descriptor
   */
  public ColumnMetadata withSemanticType(String semanticType) {
    return new ColumnMetadata(name, displayName, baseType, semanticType, id, fkFieldId, expressionName, source);
  }

  /**
   * Copy with another id.
   *
   * @param id
   *          the field id or field clause
   * @return the new descriptor
   */
  public ColumnMetadata withId(Object id) {
    return new ColumnMetadata(name, displayName, baseType, semanticType, id, fkFieldId, expressionName, source);
  }

  /**
   * Copy with another foreign key field id.
   *
   * @param fkFieldId
   *          the id of the foreign key field
   * @return the new descriptor
   */
  public ColumnMetadata withFkFieldId(Integer fkFieldId) {
    return new ColumnMetadata(name, displayName, baseType, semanticType, id, fkFieldId, expressionName, source);
  }

  /**
   * Copy with another expression name.
   *
   * @param expressionName
   *          the custom expression name
   * @return the new descriptor
   */
  public ColumnMetadata withExpressionName(String expressionName) {
    return new ColumnMetadata(name, displayName, baseType, semanticType, id, fkFieldId, expressionName, source);
  }

  /**
   * Copy with another source.
   *
   * @param source
   *          where the column comes from
   * @return the new descriptor
   */
  public ColumnMetadata withSource(String source) {
    return new ColumnMetadata(name, displayName, baseType, semanticType, id, fkFieldId, expressionName, source);
  }

  /**
   * Whether the column is the result of an aggregation.
   *
   * @return {@code true} if {@link #source()} is {@value #SOURCE_AGGREGATION}
   */
  public boolean isAggregation() {
    return SOURCE_AGGREGATION.equals(source);
  }
}
