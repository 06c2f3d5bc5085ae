package se.alipsa.jdruid;

import java.util.List;
import se.alipsa.jdruid.model.ColumnMetadata;
import se.alipsa.jdruid.model.ResultMetadata;

/**
 * Enriches the minimal result metadata with types and field information. The
 * order of the returned columns defines the final column order.
 */
@FunctionalInterface
public interface ColumnAnnotator {

  /**
   * Annotate the result columns.
   *
   * @param query
   *          the executed query
   * @param metadata
   *          name-only column descriptors
   * @return the enriched descriptors in final column order
   */
  List<ColumnMetadata> annotate(NativeQuery query, ResultMetadata metadata);

  /**
   * An annotator returning the minimal descriptors unchanged.
   *
   * @return the pass-through annotator
   */
  static ColumnAnnotator identity() {
    return (query, metadata) -> metadata.cols();
  }
}
