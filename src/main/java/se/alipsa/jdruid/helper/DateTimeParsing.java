package se.alipsa.jdruid.helper;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.Temporal;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decoding of engine timestamps into {@code java.time} values.
 *
 * <p>
 * The engine reports timestamps in UTC, either as ISO-8601 text or as epoch
 * milliseconds. When a result timezone is supplied, offset values are moved to
 * that zone keeping the same instant; otherwise the parsed offset is kept.
 * </p>
 */
public final class DateTimeParsing {

  private static final Pattern EPOCH_MILLIS = Pattern.compile("-?\\d+");

  private DateTimeParsing() {
  }

  /**
   * Decode a timestamp value.
   *
   * @param value
   *          the encoded value: ISO-8601 text, epoch milliseconds (number or
   *          numeric text) or an already decoded temporal value
   * @param zone
   *          the result timezone, or {@link Optional#empty()} when no conversion
   *          is needed
   * @return the decoded temporal value, or {@code null} when {@code value} is
   *         {@code null}
   * @throws DateTimeParseException
   *           if the text cannot be parsed
   */
  public static Object parse(Object value, Optional<ZoneId> zone) {
    if (value == null) {
      return null;
    }
    if (value instanceof OffsetDateTime odt) {
      return convert(odt, zone);
    }
    if (value instanceof ZonedDateTime zdt) {
      return convert(zdt.toOffsetDateTime(), zone);
    }
    if (value instanceof Instant instant) {
      return convert(instant.atOffset(ZoneOffset.UTC), zone);
    }
    if (value instanceof Temporal) {
      return value;
    }
    if (value instanceof Number number) {
      return fromEpochMillis(number.longValue(), zone);
    }
    return parseText(value.toString().trim(), zone);
  }

  private static Object parseText(String text, Optional<ZoneId> zone) {
    if (EPOCH_MILLIS.matcher(text).matches()) {
      return fromEpochMillis(Long.parseLong(text), zone);
    }
    int timeSeparator = text.indexOf('T');
    if (timeSeparator < 0) {
      return LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE);
    }
    if (hasOffset(text, timeSeparator)) {
      OffsetDateTime parsed = ZonedDateTime.parse(text, DateTimeFormatter.ISO_DATE_TIME).toOffsetDateTime();
      return convert(parsed, zone);
    }
    return LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
  }

  private static boolean hasOffset(String text, int timeSeparator) {
    String time = text.substring(timeSeparator + 1);
    return time.endsWith("Z") || time.endsWith("]") || time.indexOf('+') >= 0 || time.indexOf('-') >= 0;
  }

  private static OffsetDateTime fromEpochMillis(long millis, Optional<ZoneId> zone) {
    return convert(Instant.ofEpochMilli(millis).atOffset(ZoneOffset.UTC), zone);
  }

  private static OffsetDateTime convert(OffsetDateTime value, Optional<ZoneId> zone) {
    if (zone.isEmpty()) {
      return value;
    }
    return value.atZoneSameInstant(zone.get()).toOffsetDateTime();
  }
}
