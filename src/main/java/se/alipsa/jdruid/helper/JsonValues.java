package se.alipsa.jdruid.helper;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Conversion of Jackson trees into plain Java values. */
public final class JsonValues {

  private JsonValues() {
  }

  /**
   * Convert a JSON node into the corresponding Java value.
   *
   * @param node
   *          the node to convert (may be {@code null})
   * @return a {@link String}, {@link Number}, {@link Boolean}, {@link Map},
   *         {@link List} or {@code null} for JSON null and missing nodes
   */
  public static Object toJava(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return null;
    }
    if (node.isTextual()) {
      return node.asText();
    }
    if (node.isNumber()) {
      return node.numberValue();
    }
    if (node.isBoolean()) {
      return node.booleanValue();
    }
    if (node.isObject()) {
      return toRow(node);
    }
    if (node.isArray()) {
      List<Object> values = new ArrayList<>(node.size());
      for (JsonNode element : node) {
        values.add(toJava(element));
      }
      return values;
    }
    return node.toString();
  }

  /**
   * Convert a JSON object into a row mapping, preserving field order.
   *
   * @param node
   *          a JSON object; {@code null}, JSON null and missing nodes yield an
   *          empty row
   * @return a mutable, insertion ordered map of field name to Java value
   */
  public static Map<String, Object> toRow(JsonNode node) {
    Map<String, Object> row = new LinkedHashMap<>();
    if (node == null || node.isNull() || node.isMissingNode()) {
      return row;
    }
    if (!node.isObject()) {
      throw new IllegalStateException("Expected a JSON object but got " + node.getNodeType());
    }
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      row.put(field.getKey(), toJava(field.getValue()));
    }
    return row;
  }
}
