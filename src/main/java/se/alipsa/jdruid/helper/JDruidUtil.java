package se.alipsa.jdruid.helper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Properties;

/** Utility methods. */
public final class JDruidUtil {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private JDruidUtil() {
  }

  /**
   * Parses a URL query string into a Properties object.
   *
   * @param qs
   *          the query string
   * @return a Properties object containing the key-value pairs
   */
  @SuppressWarnings("PMD.AvoidLiteralsInIfCondition")
  public static Properties parseUrlQuery(String qs) {
    Properties p = new Properties();
    if (qs == null || qs.isEmpty()) {
      return p;
    }
    String s = qs.charAt(0) == '?' ? qs.substring(1) : qs;
    for (String kv : s.split("&")) {
      if (kv.isEmpty()) {
        continue;
      }
      String[] arr = kv.split("=", 2);
      String k = URLDecoder.decode(arr[0], StandardCharsets.UTF_8);
      String v = arr.length == 2 ? URLDecoder.decode(arr[1], StandardCharsets.UTF_8) : "";
      if (!k.isEmpty()) {
        p.setProperty(k, v);
      }
    }
    return p;
  }

  /**
   * Decode a native query body into a JSON tree.
   *
   * <p>
   * Strings are parsed as JSON, maps are converted field by field and trees are
   * returned unchanged.
   * </p>
   *
   * @param body
   *          the query body as supplied by the caller
   * @return the structured query
   * @throws JsonProcessingException
   *           if a string body is not valid JSON
   */
  public static JsonNode decodeQuery(Object body) throws JsonProcessingException {
    if (body instanceof JsonNode node) {
      return node;
    }
    if (body instanceof String text) {
      return MAPPER.readTree(text);
    }
    if (body instanceof Map<?, ?> map) {
      return MAPPER.valueToTree(map);
    }
    throw new IllegalArgumentException("Unsupported query body type: "
        + (body == null ? "null" : body.getClass().getName()));
  }

  /**
   * Check whether a query body carries any content.
   *
   * @param body
   *          the query body (may be {@code null})
   * @return {@code true} when the body is {@code null}, a blank string, an empty
   *         map or an empty/null JSON node
   */
  public static boolean isBlankQuery(Object body) {
    if (body == null) {
      return true;
    }
    if (body instanceof String text) {
      return text.isBlank();
    }
    if (body instanceof Map<?, ?> map) {
      return map.isEmpty();
    }
    if (body instanceof JsonNode node) {
      return node.isNull() || node.isMissingNode() || (node.isContainerNode() && node.isEmpty());
    }
    return false;
  }
}
