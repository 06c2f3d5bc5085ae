package se.alipsa.jdruid;

import java.util.List;
import java.util.stream.Stream;
import se.alipsa.jdruid.model.ResultMetadata;

/**
 * Receives the result of a successful query execution. Called exactly once per
 * successful execution and never after a failure.
 */
@FunctionalInterface
public interface ResultCallback {

  /**
   * Consume the result.
   *
   * @param metadata
   *          the column descriptors in result order
   * @param rows
   *          the fully decoded result rows, one value per column; the stream
   *          can only be traversed once
   */
  void respond(ResultMetadata metadata, Stream<List<Object>> rows);
}
