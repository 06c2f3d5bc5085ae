package se.alipsa.jdruid;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Properties;

/**
 * {@link DetailsStore} backed by {@link Properties}.
 *
 * <p>
 * Each database is described by a connection URL under
 * {@code database.<id>.url}. Any other {@code database.<id>.<option>} entry is
 * added to the options of that database, overriding the URL query parameters.
 * </p>
 *
 * <pre>
 * database.1.url=druid://localhost:8082
 * database.1.timeout=30000
 * </pre>
 */
public final class PropertiesDetailsStore implements DetailsStore {

  private static final String PREFIX = "database.";
  private static final String URL_KEY = "url";

  private final Properties props;

  /**
   * Create a store from properties.
   *
   * @param props
   *          the configuration, copied
   */
  public PropertiesDetailsStore(Properties props) {
    Objects.requireNonNull(props, "props");
    this.props = new Properties();
    this.props.putAll(props);
  }

  /**
   * Load a store from a classpath resource.
   *
   * @param resource
   *          the resource name, e.g. {@code /jdruid.properties}
   * @return the store
   * @throws IOException
   *           if the resource is missing or cannot be read
   */
  public static PropertiesDetailsStore fromResource(String resource) throws IOException {
    Objects.requireNonNull(resource, "resource");
    try (InputStream in = PropertiesDetailsStore.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IOException("Resource not found: " + resource);
      }
      Properties props = new Properties();
      try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
        props.load(reader);
      }
      return new PropertiesDetailsStore(props);
    }
  }

  @Override
  public ConnectionDetails details(int databaseId) {
    String prefix = PREFIX + databaseId + ".";
    String url = props.getProperty(prefix + URL_KEY);
    if (url == null || url.isBlank()) {
      throw new IllegalArgumentException("No connection details for database " + databaseId);
    }
    Properties overrides = new Properties();
    for (String key : props.stringPropertyNames()) {
      if (key.startsWith(prefix) && !key.equals(prefix + URL_KEY)) {
        overrides.setProperty(key.substring(prefix.length()), props.getProperty(key));
      }
    }
    return ConnectionDetails.fromUrl(url.trim()).withOptions(overrides);
  }
}
