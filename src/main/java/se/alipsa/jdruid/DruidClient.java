package se.alipsa.jdruid;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;

/**
 * Performs the engine round trip. Implementations own timeouts, retries and
 * cancellation.
 */
@FunctionalInterface
public interface DruidClient {

  /**
   * Execute a native query.
   *
   * @param details
   *          where to send the query
   * @param query
   *          the structured native query
   * @return the raw JSON payload returned by the engine
   * @throws IOException
   *           if the engine cannot be reached or reports an error
   */
  JsonNode execute(ConnectionDetails details, JsonNode query) throws IOException;
}
