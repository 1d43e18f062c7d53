package io.daybook.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A parsed date or date-time value.
 *
 * <p>For {@link Precision#DATE} values the instant is always local midnight of the calendar day,
 * so two date values of the same day are equal.
 *
 * @param precision whether the value is a date or a date-time
 * @param instant the instant the value resolves to, at second resolution
 */
public record TemporalValue(Precision precision, Instant instant) {
  /** Creates a new TemporalValue, truncating the instant to whole seconds. */
  public TemporalValue {
    Objects.requireNonNull(precision, "precision");
    Objects.requireNonNull(instant, "instant");
    instant = Instant.ofEpochSecond(instant.getEpochSecond());
  }

  /**
   * Creates a date value.
   *
   * @param midnight local midnight of the day
   * @return a new date value
   */
  public static TemporalValue date(Instant midnight) {
    return new TemporalValue(Precision.DATE, midnight);
  }

  /**
   * Creates a date-time value.
   *
   * @param instant the instant
   * @return a new date-time value
   */
  public static TemporalValue dateTime(Instant instant) {
    return new TemporalValue(Precision.DATE_TIME, instant);
  }

  /**
   * Returns a value of the same precision at another instant.
   *
   * @param other the new instant
   * @return a new value with this precision
   */
  public TemporalValue at(Instant other) {
    return new TemporalValue(precision, other);
  }

  /** Returns true if this is a date-only value. */
  public boolean isDate() {
    return precision == Precision.DATE;
  }
}
