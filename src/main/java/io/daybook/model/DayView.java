package io.daybook.model;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Day buckets for one query.
 *
 * @param days the non-empty buckets, sorted by day
 * @param todayIndex the index in {@code days} of the bucket for the current day, if present
 */
public record DayView(List<DayBucket> days, OptionalInt todayIndex) {
  /** Creates a new DayView with a defensive copy of the buckets. */
  public DayView {
    days = List.copyOf(days);
  }

  /**
   * Returns the bucket for the current day.
   *
   * @return the bucket, or empty if nothing happens today
   */
  public Optional<DayBucket> today() {
    return todayIndex.isPresent() ? Optional.of(days.get(todayIndex.getAsInt())) : Optional.empty();
  }
}
