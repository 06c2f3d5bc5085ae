package se.alipsa.jdruid.engine;

import java.util.ArrayList;
import java.util.List;
import se.alipsa.jdruid.model.ColumnMetadata;
import se.alipsa.jdruid.model.ResultMetadata;

/**
 * Builds the minimal result metadata handed to column annotation. Reserved
 * identifiers are exposed under their public names so callers never see the
 * internal conversions.
 */
public final class ResultMetadataBuilder {

  private ResultMetadataBuilder() {
  }

  /**
   * Build metadata for the projected columns.
   *
   * @param columns
   *          the projected columns in result order
   * @return one name-only descriptor per column
   */
  public static ResultMetadata build(List<ProjectedColumn> columns) {
    List<ColumnMetadata> cols = new ArrayList<>(columns.size());
    for (ProjectedColumn column : columns) {
      cols.add(ColumnMetadata.named(column.name()));
    }
    return new ResultMetadata(cols);
  }
}
