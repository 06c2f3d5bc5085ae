package se.alipsa.jdruid;

import java.util.Properties;

/**
 * Caller supplied formatting preferences.
 *
 * @param formatRows
 *          when {@code true} (the default) engine timestamps are returned in
 *          their encoded form, when {@code false} they are decoded to
 *          {@code java.time} values
 */
public record MiddlewareSettings(boolean formatRows) {

  private static final MiddlewareSettings DEFAULTS = new MiddlewareSettings(true);

  /**
   * The default settings.
   *
   * @return settings with format rows enabled
   */
  public static MiddlewareSettings defaults() {
    return DEFAULTS;
  }

  /**
   * Read settings from properties. Both {@code format-rows} and
   * {@code formatRows} are recognized; missing values fall back to the
   * defaults.
   *
   * @param props
   *          the properties (may be {@code null})
   * @return the settings
   */
  public static MiddlewareSettings fromProperties(Properties props) {
    if (props == null) {
      return DEFAULTS;
    }
    String value = props.getProperty("format-rows", props.getProperty("formatRows"));
    if (value == null || value.isBlank()) {
      return DEFAULTS;
    }
    return new MiddlewareSettings(Boolean.parseBoolean(value.trim()));
  }
}
