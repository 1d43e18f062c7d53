package io.daybook.eval;

import io.daybook.model.Frequency;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Calendar arithmetic on instants, done through local calendar fields.
 *
 * <h2>Normalization</h2>
 *
 * <p>{@link #advance} adds to the day, month or year field and then normalizes the way C {@code
 * mktime} does: a day of month past the end of the month rolls into the next month. So Jan 31 plus
 * one month is Mar 2 (Mar 3 in a leap year) and Feb 29 plus one year is Mar 1. This differs from
 * {@link LocalDate#plusMonths}, which clamps to the last day of the month.
 *
 * <h2>DST Handling</h2>
 *
 * <p>Recomposed wall-clock times are resolved with {@link ZonedDateTime#ofLocal}: inside a gap
 * they move forward by the gap length, inside a fold they take the earlier offset. Day boundaries
 * are always recomputed from the local date so a 23 or 25 hour day does not drift.
 */
public final class CalendarMath {
  private CalendarMath() {}

  /**
   * Returns local midnight of the day containing an instant.
   *
   * @param instant the instant
   * @param zone the zone
   * @return the start of the day
   */
  public static Instant startOfDay(Instant instant, ZoneId zone) {
    return LocalDate.ofInstant(instant, zone).atStartOfDay(zone).toInstant();
  }

  /**
   * Advances an instant by a number of calendar units.
   *
   * @param instant the instant
   * @param interval the number of units, may be negative
   * @param unit the unit; null leaves the instant unchanged
   * @param zone the zone
   * @return the advanced instant
   */
  public static Instant advance(Instant instant, int interval, Frequency unit, ZoneId zone) {
    if (unit == null) {
      return instant;
    }
    LocalDateTime t = LocalDateTime.ofInstant(instant, zone);
    long year = t.getYear();
    long month = t.getMonthValue();
    long day = t.getDayOfMonth();

    switch (unit) {
      case DAILY -> day += interval;
      case WEEKLY -> day += 7L * interval;
      case MONTHLY -> month += interval;
      case YEARLY -> year += interval;
    }

    LocalDate date = normalize(year, month, day);
    return ZonedDateTime.ofLocal(LocalDateTime.of(date, t.toLocalTime()), zone, null).toInstant();
  }

  /**
   * Returns local midnight of the day before the day containing an instant.
   *
   * @param instant the instant
   * @param zone the zone
   * @return the start of the previous day
   */
  public static Instant previousDay(Instant instant, ZoneId zone) {
    return startOfDay(advance(instant, -1, Frequency.DAILY, zone), zone);
  }

  /** Builds a date from possibly out-of-range fields, carrying overflow forward. */
  static LocalDate normalize(long year, long month, long day) {
    long monthIndex = year * 12 + (month - 1);
    int y = Math.toIntExact(Math.floorDiv(monthIndex, 12));
    int m = (int) Math.floorMod(monthIndex, 12) + 1;
    return LocalDate.of(y, m, 1).plusDays(day - 1);
  }
}
