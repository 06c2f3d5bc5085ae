package se.alipsa.jdruid.ref;

import java.util.List;

/**
 * A saved table column setting referring to a result column by field reference
 * or by name.
 *
 * @param name
 *          the column name (may be {@code null})
 * @param fieldRef
 *          the field reference clause (may be {@code null})
 */
public record ColumnSetting(String name, List<Object> fieldRef) {

  /**
   * A setting referring to a column by name.
   *
   * @param name
   *          the column name
   * @return the setting
   */
  public static ColumnSetting byName(String name) {
    return new ColumnSetting(name, null);
  }

  /**
   * A setting referring to a column by field reference.
   *
   * @param fieldRef
   *          the field reference clause
   * @return the setting
   */
  public static ColumnSetting byFieldRef(List<Object> fieldRef) {
    return new ColumnSetting(null, fieldRef);
  }
}
