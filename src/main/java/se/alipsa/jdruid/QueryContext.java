package se.alipsa.jdruid;

import java.util.Objects;

/**
 * Request scoped settings of a query execution.
 *
 * @param databaseId
 *          the database the query runs against
 * @param timezoneProvider
 *          supplies the result timezone
 */
public record QueryContext(int databaseId, TimezoneProvider timezoneProvider) {

  /**
   * Canonical constructor.
   *
   * @param databaseId
   *          the database the query runs against
   * @param timezoneProvider
   *          supplies the result timezone
   */
  public QueryContext {
    Objects.requireNonNull(timezoneProvider, "timezoneProvider");
  }

  /**
   * A context reporting results in the JVM default timezone.
   *
   * @param databaseId
   *          the database the query runs against
   * @return the context
   */
  public static QueryContext forDatabase(int databaseId) {
    return new QueryContext(databaseId, TimezoneProvider.systemDefault());
  }
}
