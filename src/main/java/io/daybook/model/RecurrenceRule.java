package io.daybook.model;

/**
 * A parsed recurrence rule.
 *
 * @param frequency the unit to advance by (may be null if absent or unrecognized)
 * @param interval the number of units between occurrences (at least 1)
 * @param until the inclusive end bound (may be null)
 * @param count the maximum number of occurrences (may be null)
 */
public record RecurrenceRule(
    Frequency frequency, int interval, TemporalValue until, Integer count) {
  /** Creates a new RecurrenceRule, rejecting a non-positive interval. */
  public RecurrenceRule {
    if (interval < 1) {
      throw new IllegalArgumentException("interval must be positive: " + interval);
    }
  }
}
