package io.daybook.model;

import java.time.Instant;
import java.util.Objects;

/**
 * An inclusive range of instants a query is restricted to.
 *
 * @param start the first instant (inclusive)
 * @param end the last instant (inclusive)
 */
public record Window(Instant start, Instant end) {
  /** Creates a new Window. */
  public Window {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
  }

  /**
   * Checks whether an instant lies inside this window.
   *
   * @param instant the instant
   * @return true if {@code start <= instant <= end}
   */
  public boolean contains(Instant instant) {
    return !instant.isBefore(start) && !instant.isAfter(end);
  }
}
