package io.daybook.parser;

import io.daybook.DaybookException;
import io.daybook.Span;
import io.daybook.model.TemporalValue;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Parses {@code YYYYMMDD} and {@code YYYYMMDDTHHMMSS} values.
 *
 * <p>Values are floating local time: they are resolved in the zone passed in, and a trailing
 * {@code Z} is accepted but not honored. A wall-clock time inside a DST gap is pushed forward by
 * the length of the gap; an ambiguous time resolves to the earlier offset.
 */
public final class TemporalParser {
  static final String INVALID_FORMAT = "invalid date format";

  private static final int DATE_LENGTH = 8;
  private static final int DATE_TIME_LENGTH = 15;

  private TemporalParser() {}

  /**
   * Parses a date or date-time value.
   *
   * @param input the value text
   * @param zone the zone local times are resolved in
   * @return the parsed value
   * @throws DaybookException if the value has any other shape or out-of-range fields
   */
  public static TemporalValue parse(String input, ZoneId zone) throws DaybookException {
    if (input == null) {
      throw DaybookException.parse(INVALID_FORMAT, null, null);
    }
    String s = input.strip();

    requireDigits(s, 0, DATE_LENGTH);
    LocalDate date = toDate(s);
    if (s.length() == DATE_LENGTH) {
      return TemporalValue.date(date.atStartOfDay(zone).toInstant());
    }

    if (s.charAt(DATE_LENGTH) != 'T') {
      throw DaybookException.parse(INVALID_FORMAT, new Span(DATE_LENGTH, DATE_LENGTH + 1), s);
    }
    requireDigits(s, DATE_LENGTH + 1, DATE_TIME_LENGTH);
    boolean utcSuffix = s.length() == DATE_TIME_LENGTH + 1 && s.charAt(DATE_TIME_LENGTH) == 'Z';
    if (s.length() != DATE_TIME_LENGTH && !utcSuffix) {
      throw DaybookException.parse(INVALID_FORMAT, new Span(DATE_TIME_LENGTH, s.length()), s);
    }

    LocalTime time = toTime(s);
    ZonedDateTime zoned = ZonedDateTime.ofLocal(LocalDateTime.of(date, time), zone, null);
    return TemporalValue.dateTime(zoned.toInstant());
  }

  private static void requireDigits(String s, int from, int to) throws DaybookException {
    for (int i = from; i < to; i++) {
      if (i >= s.length()) {
        throw DaybookException.parse(INVALID_FORMAT, new Span(i, i + 1), s);
      }
      char c = s.charAt(i);
      if (c < '0' || c > '9') {
        throw DaybookException.parse(INVALID_FORMAT, new Span(i, i + 1), s);
      }
    }
  }

  private static LocalDate toDate(String s) throws DaybookException {
    int year = Integer.parseInt(s.substring(0, 4));
    int month = Integer.parseInt(s.substring(4, 6));
    int day = Integer.parseInt(s.substring(6, 8));
    try {
      return LocalDate.of(year, month, day);
    } catch (DateTimeException e) {
      throw DaybookException.parse(INVALID_FORMAT, new Span(4, DATE_LENGTH), s);
    }
  }

  private static LocalTime toTime(String s) throws DaybookException {
    int hour = Integer.parseInt(s.substring(9, 11));
    int minute = Integer.parseInt(s.substring(11, 13));
    int second = Integer.parseInt(s.substring(13, 15));
    try {
      return LocalTime.of(hour, minute, second);
    } catch (DateTimeException e) {
      throw DaybookException.parse(
          INVALID_FORMAT, new Span(DATE_LENGTH + 1, DATE_TIME_LENGTH), s);
    }
  }
}
