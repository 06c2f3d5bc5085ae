package se.alipsa.jdruid.engine;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jdruid.MiddlewareSettings;
import se.alipsa.jdruid.helper.DateTimeParsing;
import se.alipsa.jdruid.helper.JsonValues;

/**
 * Flattens the query type specific engine payloads into rows keyed by column
 * identifier.
 *
 * <table>
 * <caption>Payload layouts</caption>
 * <tr><th>Query type</th><th>Payload</th></tr>
 * <tr><td>select</td><td>{@code [{"result": {"events": [{"event": {...}}]}}]}</td></tr>
 * <tr><td>total</td><td>{@code [{"result": {...}}]}</td></tr>
 * <tr><td>topN</td><td>{@code [{"result": [{...}]}]}</td></tr>
 * <tr><td>groupBy</td><td>{@code [{"event": {...}}]}</td></tr>
 * <tr><td>timeseries</td><td>{@code [{"timestamp": "...", "result": {...}}]}</td></tr>
 * </table>
 */
public final class ResultNormalizer {

  /** Name of the engine timestamp field. */
  public static final String TIMESTAMP = "timestamp";

  private static final Logger log = LoggerFactory.getLogger(ResultNormalizer.class);

  private ResultNormalizer() {
  }

  /**
   * Normalize an engine payload.
   *
   * @param queryType
   *          the layout of {@code results}
   * @param projections
   *          the declared projection
   * @param timezone
   *          the zone decoded timestamps are converted to, or
   *          {@link Optional#empty()} when no conversion is needed
   * @param middleware
   *          the formatting preferences
   * @param results
   *          the raw payload returned by the engine
   * @return the normalized result; rows are converted lazily as they are read
   * @throws IllegalStateException
   *           if the payload does not have the layout of {@code queryType}
   */
  public static NormalizedResult normalize(QueryType queryType, List<String> projections,
      Optional<ZoneId> timezone, MiddlewareSettings middleware, JsonNode results) {
    Objects.requireNonNull(queryType, "queryType");
    Objects.requireNonNull(timezone, "timezone");
    Objects.requireNonNull(middleware, "middleware");
    List<String> declared = projections == null ? List.of() : projections;
    if (log.isDebugEnabled()) {
      log.debug("Normalizing {} results with projections {}, format rows {}", queryType.nativeName(), declared,
          middleware.formatRows());
    }
    boolean formatRows = middleware.formatRows();
    return switch (queryType) {
      case SELECT -> select(declared, timezone, results);
      case TOTAL -> new NormalizedResult(declared,
          new JsonRowReader(elements(queryType, results), wrapper -> JsonValues.toRow(wrapper.path("result"))));
      case TOP_N -> topN(declared, timezone, formatRows, results);
      case GROUP_BY -> new NormalizedResult(declared, new JsonRowReader(elements(queryType, results),
          wrapper -> decodeTimestampUnless(formatRows, JsonValues.toRow(wrapper.path("event")), timezone)));
      case TIMESERIES -> timeseries(declared, timezone, formatRows, results);
    };
  }

  private static NormalizedResult select(List<String> projections, Optional<ZoneId> timezone, JsonNode results) {
    Iterator<JsonNode> wrappers = elements(QueryType.SELECT, results);
    if (!wrappers.hasNext()) {
      return new NormalizedResult(projections, new JsonRowReader(Collections.emptyIterator(), JsonValues::toRow));
    }
    JsonNode events = wrappers.next().path("result").path("events");
    // row selections are always decoded, the format rows preference does not apply
    return new NormalizedResult(projections, new JsonRowReader(elements(QueryType.SELECT, events),
        event -> decodeTimestamp(JsonValues.toRow(event.path("event")), timezone)));
  }

  private static NormalizedResult topN(List<String> projections, Optional<ZoneId> timezone, boolean formatRows,
      JsonNode results) {
    Iterator<JsonNode> wrappers = elements(QueryType.TOP_N, results);
    if (!wrappers.hasNext()) {
      return new NormalizedResult(projections, new JsonRowReader(Collections.emptyIterator(), JsonValues::toRow));
    }
    JsonNode rows = wrappers.next().path("result");
    return new NormalizedResult(projections, new JsonRowReader(elements(QueryType.TOP_N, rows),
        row -> decodeTimestampUnless(formatRows, JsonValues.toRow(row), timezone)));
  }

  private static NormalizedResult timeseries(List<String> projections, Optional<ZoneId> timezone,
      boolean formatRows, JsonNode results) {
    List<String> withTimestamp = new ArrayList<>(projections);
    if (!withTimestamp.contains(TIMESTAMP)) {
      withTimestamp.add(TIMESTAMP);
    }
    return new NormalizedResult(withTimestamp, new JsonRowReader(elements(QueryType.TIMESERIES, results),
        bucket -> {
          Object timestamp = JsonValues.toJava(bucket.get(TIMESTAMP));
          Map<String, Object> row = new LinkedHashMap<>();
          row.put(TIMESTAMP, formatRows ? timestamp : DateTimeParsing.parse(timestamp, timezone));
          row.putAll(JsonValues.toRow(bucket.path("result")));
          return row;
        }));
  }

  private static Map<String, Object> decodeTimestampUnless(boolean formatRows, Map<String, Object> row,
      Optional<ZoneId> timezone) {
    return formatRows ? row : decodeTimestamp(row, timezone);
  }

  private static Map<String, Object> decodeTimestamp(Map<String, Object> row, Optional<ZoneId> timezone) {
    if (row.containsKey(TIMESTAMP)) {
      row.put(TIMESTAMP, DateTimeParsing.parse(row.get(TIMESTAMP), timezone));
    }
    return row;
  }

  private static Iterator<JsonNode> elements(QueryType queryType, JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return Collections.emptyIterator();
    }
    if (!node.isArray()) {
      throw new IllegalStateException("Unexpected " + queryType.nativeName() + " payload, expected an array but got "
          + node.getNodeType());
    }
    return node.elements();
  }
}
