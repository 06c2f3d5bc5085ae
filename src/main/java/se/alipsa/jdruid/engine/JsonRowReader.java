package se.alipsa.jdruid.engine;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * {@link RowReader} that lazily converts the elements of a JSON array into
 * rows. Each element is converted only when it is read.
 */
public final class JsonRowReader implements RowReader {

  private final Iterator<JsonNode> elements;
  private final Function<JsonNode, Map<String, Object>> converter;
  private Map<String, Object> next;
  private boolean buffered;

  /**
   * Create a reader over the supplied elements.
   *
   * @param elements
   *          the payload elements, consumed once
   * @param converter
   *          turns one element into a row
   */
  public JsonRowReader(Iterator<JsonNode> elements, Function<JsonNode, Map<String, Object>> converter) {
    this.elements = Objects.requireNonNull(elements, "elements");
    this.converter = Objects.requireNonNull(converter, "converter");
  }

  @Override
  public Map<String, Object> read() {
    Map<String, Object> row = peek();
    buffered = false;
    next = null;
    return row;
  }

  @Override
  public Map<String, Object> peek() {
    if (!buffered) {
      next = elements.hasNext() ? converter.apply(elements.next()) : null;
      buffered = true;
    }
    return next;
  }
}
