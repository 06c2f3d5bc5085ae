package se.alipsa.jdruid;

import java.net.URI;
import java.util.Objects;
import java.util.Properties;
import se.alipsa.jdruid.helper.JDruidUtil;

/**
 * Where and how to reach the engine broker.
 *
 * <p>
 * URL format: {@code druid://host[:port][/path][?key=value&...]}, e.g.
 * {@code druid://localhost:8082?ssl=true&timeout=30000}. The port defaults to
 * {@value #DEFAULT_PORT}.
 * </p>
 *
 * @param host
 *          the broker host
 * @param port
 *          the broker port
 * @param scheme
 *          {@code http} or {@code https}
 * @param path
 *          the query endpoint path
 * @param options
 *          remaining options such as {@code timeout} or {@code user}
 */
public record ConnectionDetails(String host, int port, String scheme, String path, Properties options) {

  /** URL prefix of connection URLs. */
  public static final String URL_PREFIX = "druid://";
  /** Default broker port. */
  public static final int DEFAULT_PORT = 8082;
  /** Default native query endpoint. */
  public static final String DEFAULT_PATH = "/druid/v2/";

  /**
   * Canonical constructor, copies the options.
   *
   * @param host
   *          the broker host
   * @param port
   *          the broker port
   * @param scheme
   *          {@code http} or {@code https}
   * @param path
   *          the query endpoint path
   * @param options
   *          remaining options ({@code null} means none)
   */
  public ConnectionDetails {
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(scheme, "scheme");
    Objects.requireNonNull(path, "path");
    Properties copy = new Properties();
    if (options != null) {
      copy.putAll(options);
    }
    options = copy;
  }

  /**
   * The remaining options.
   *
   * @return a copy of the options; changes to it do not affect these details
   */
  @Override
  public Properties options() {
    Properties copy = new Properties();
    copy.putAll(options);
    return copy;
  }

  /**
   * Parse a connection URL.
   *
   * @param url
   *          the connection URL
   * @return the connection details
   * @throws IllegalArgumentException
   *           if the URL is not a {@value #URL_PREFIX} URL or lacks a host
   */
  public static ConnectionDetails fromUrl(String url) {
    Objects.requireNonNull(url, "url");
    if (!url.startsWith(URL_PREFIX)) {
      throw new IllegalArgumentException("Not a druid URL: " + url);
    }
    String rest = url.substring(URL_PREFIX.length());
    Properties props = new Properties();
    int q = rest.indexOf('?');
    if (q >= 0) {
      props.putAll(JDruidUtil.parseUrlQuery(rest.substring(q + 1)));
      rest = rest.substring(0, q);
    }
    URI uri = URI.create("http://" + rest);
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("No host in druid URL: " + url);
    }
    int port = uri.getPort() < 0 ? DEFAULT_PORT : uri.getPort();
    String path = uri.getPath() == null || uri.getPath().isBlank() ? DEFAULT_PATH : uri.getPath();
    boolean ssl = Boolean.parseBoolean(props.getProperty("ssl", "false"));
    props.remove("ssl");
    return new ConnectionDetails(uri.getHost(), port, ssl ? "https" : "http", path, props);
  }

  /**
   * The HTTP endpoint native queries are posted to.
   *
   * @return the endpoint URI
   */
  public URI queryEndpoint() {
    return URI.create(scheme + "://" + host + ":" + port + path);
  }

  /**
   * Look up an option.
   *
   * @param key
   *          the option name
   * @param defaultValue
   *          value returned when the option is absent
   * @return the option value
   */
  public String option(String key, String defaultValue) {
    return options.getProperty(key, defaultValue);
  }

  /**
   * Copy of these details with additional options; existing options with the
   * same name are replaced.
   *
   * @param extra
   *          the options to add
   * @return the new details
   */
  public ConnectionDetails withOptions(Properties extra) {
    Properties merged = new Properties();
    merged.putAll(options);
    if (extra != null) {
      merged.putAll(extra);
    }
    return new ConnectionDetails(host, port, scheme, path, merged);
  }
}
