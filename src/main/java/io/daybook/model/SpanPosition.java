package io.daybook.model;

/** Where a day falls within a multi-day, date-only occurrence. */
public enum SpanPosition {
  /** The occurrence fits in one day, or carries a time of day. */
  SINGLE,
  /** The first day of a multi-day occurrence. */
  START,
  /** A day strictly between the first and last day. */
  MIDDLE,
  /** The last day, the day before the exclusive end. */
  END
}
