package se.alipsa.jdruid;

import java.util.List;
import se.alipsa.jdruid.engine.QueryType;

/**
 * A compiled engine query as submitted for execution.
 *
 * @param query
 *          the query body: JSON text, a {@link java.util.Map} or a Jackson
 *          {@link com.fasterxml.jackson.databind.JsonNode}
 * @param queryType
 *          the result layout, or {@code null} to derive it from the
 *          {@code queryType} field of the body
 * @param mbql
 *          whether the query was compiled from a structured query, in which
 *          case {@code projections} describe the result columns
 * @param projections
 *          the declared projection (may contain reserved identifiers)
 * @param middleware
 *          the formatting preferences
 */
public record NativeQuery(Object query, QueryType queryType, boolean mbql, List<String> projections,
    MiddlewareSettings middleware) {

  /**
   * Canonical constructor.
   *
   * @param query
   *          the query body
   * @param queryType
   *          the result layout (may be {@code null})
   * @param mbql
   *          whether the query was compiled from a structured query
   * @param projections
   *          the declared projection ({@code null} means none)
   * @param middleware
   *          the formatting preferences ({@code null} means defaults)
   */
  public NativeQuery {
    projections = projections == null ? List.of() : List.copyOf(projections);
    middleware = middleware == null ? MiddlewareSettings.defaults() : middleware;
  }

  /**
   * A free form query whose columns are taken from the first result row.
   *
   * @param query
   *          the query body
   * @return the query, using default middleware settings
   */
  public static NativeQuery of(Object query) {
    return new NativeQuery(query, null, false, List.of(), null);
  }

  /**
   * A query compiled from a structured query.
   *
   * @param query
   *          the query body
   * @param queryType
   *          the result layout
   * @param projections
   *          the declared projection
   * @return the query, using default middleware settings
   */
  public static NativeQuery mbql(Object query, QueryType queryType, List<String> projections) {
    return new NativeQuery(query, queryType, true, projections, null);
  }

  /**
   * Copy of this query with other middleware settings.
   *
   * @param settings
   *          the formatting preferences
   * @return the new query
   */
  public NativeQuery withMiddleware(MiddlewareSettings settings) {
    return new NativeQuery(query, queryType, mbql, projections, settings);
  }
}
