package se.alipsa.jdruid;

import java.time.ZoneId;
import java.util.Objects;

/** Supplies the timezone results should be reported in. */
@FunctionalInterface
public interface TimezoneProvider {

  /**
   * The active result timezone.
   *
   * @return the timezone identifier, never {@code null}
   */
  ZoneId resultsTimezone();

  /**
   * A provider that always answers the supplied zone.
   *
   * @param zone
   *          the result timezone
   * @return a fixed provider
   */
  static TimezoneProvider of(ZoneId zone) {
    Objects.requireNonNull(zone, "zone");
    return () -> zone;
  }

  /**
   * A provider answering the JVM default timezone at the time of the call.
   *
   * @return a provider backed by {@link ZoneId#systemDefault()}
   */
  static TimezoneProvider systemDefault() {
    return ZoneId::systemDefault;
  }
}
