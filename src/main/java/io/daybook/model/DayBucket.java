package io.daybook.model;

import java.time.Instant;
import java.util.List;

/**
 * The occurrences intersecting one calendar day.
 *
 * @param day local midnight of the day
 * @param placements the placements, ordered by occurrence start
 */
public record DayBucket(Instant day, List<Placement> placements) {
  /** Creates a new DayBucket with a defensive copy of the placements. */
  public DayBucket {
    placements = List.copyOf(placements);
  }
}
