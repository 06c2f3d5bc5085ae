package se.alipsa.jdruid.engine;

/**
 * The result layouts produced by the engine. Each query type returns a
 * differently nested payload.
 */
public enum QueryType {
  /**
   * Raw row selection; a single result holding a list of events.
   */
  SELECT("select"),
  /**
   * Single aggregate total; a list of wrappers each holding a result body.
   */
  TOTAL("total"),
  /**
   * Top-N grouping; a single element list holding the ranked rows.
   */
  TOP_N("topN"),
  /**
   * Group by; a list of event wrapped rows.
   */
  GROUP_BY("groupBy"),
  /**
   * Time-series bucketing; a list of buckets each with a timestamp and a result
   * body.
   */
  TIMESERIES("timeseries");

  private final String nativeName;

  QueryType(String nativeName) {
    this.nativeName = nativeName;
  }

  /**
   * The name the engine uses for this query type in the {@code queryType} field.
   *
   * @return the native name
   */
  public String nativeName() {
    return nativeName;
  }

  /**
   * Look up a query type by its native name.
   *
   * @param nativeName
   *          the value of the {@code queryType} field
   * @return the matching query type
   * @throws IllegalArgumentException
   *           if the name is {@code null} or not a supported query type
   */
  public static QueryType fromNativeName(String nativeName) {
    if (nativeName != null) {
      for (QueryType type : values()) {
        if (type.nativeName.equals(nativeName)) {
          return type;
        }
      }
    }
    throw new IllegalArgumentException("Unsupported query type: " + nativeName);
  }
}
