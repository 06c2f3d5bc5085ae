package se.alipsa.jdruid;

/**
 * Source of engine connection details, keyed by database id.
 */
@FunctionalInterface
public interface DetailsStore {

  /**
   * Look up the connection details of a database.
   *
   * @param databaseId
   *          the database id
   * @return the connection details
   * @throws IllegalArgumentException
   *           if the database is unknown
   */
  ConnectionDetails details(int databaseId);
}
