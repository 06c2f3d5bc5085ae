package se.alipsa.jdruid.helper;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.Optional;
import se.alipsa.jdruid.TimezoneProvider;

/**
 * Decides whether engine timestamps need a timezone conversion. The engine
 * reports in UTC so no conversion is needed when results are also reported in
 * UTC.
 */
public final class TimezoneResolver {

  private TimezoneResolver() {
  }

  /**
   * Resolve the conversion zone from a provider.
   *
   * @param provider
   *          the result timezone provider
   * @return the result timezone, or {@link Optional#empty()} when it is UTC
   */
  public static Optional<ZoneId> resolve(TimezoneProvider provider) {
    Objects.requireNonNull(provider, "provider");
    return resolve(provider.resultsTimezone());
  }

  /**
   * Resolve the conversion zone.
   *
   * @param resultsTimezone
   *          the result timezone
   * @return {@code resultsTimezone}, or {@link Optional#empty()} when it is UTC
   *         (including aliases such as {@code Etc/UTC} and {@code Z})
   */
  public static Optional<ZoneId> resolve(ZoneId resultsTimezone) {
    Objects.requireNonNull(resultsTimezone, "resultsTimezone");
    if (isUtc(resultsTimezone)) {
      return Optional.empty();
    }
    return Optional.of(resultsTimezone);
  }

  static boolean isUtc(ZoneId zone) {
    // fixed-rule regions such as UTC and Etc/UTC normalize to the offset
    return ZoneOffset.UTC.equals(zone.normalized());
  }
}
