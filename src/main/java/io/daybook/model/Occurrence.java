package io.daybook.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One concrete instantiation of an entry.
 *
 * @param entry the entry this occurrence was produced from (an exception entry if substituted)
 * @param start the start of this occurrence
 * @param end the exclusive end of this occurrence (may be null)
 */
public record Occurrence(Entry entry, TemporalValue start, TemporalValue end) {
  /** Creates a new Occurrence. */
  public Occurrence {
    Objects.requireNonNull(entry, "entry");
    Objects.requireNonNull(start, "start");
  }

  /**
   * Wraps an entry as its own single occurrence.
   *
   * @param entry the entry
   * @return an occurrence with the entry's own start and end
   */
  public static Occurrence of(Entry entry) {
    return new Occurrence(entry, entry.start(), entry.end());
  }

  /**
   * Rebinds an entry to a new start, keeping its length.
   *
   * @param entry the entry
   * @param start the new start instant
   * @return an occurrence starting at {@code start}; without end if the entry has none
   */
  public static Occurrence rebound(Entry entry, Instant start) {
    TemporalValue end = null;
    if (entry.end() != null) {
      Duration length = entry.length();
      end = entry.end().at(start.plus(length));
    }
    return new Occurrence(entry, entry.start().at(start), end);
  }

  /** Returns the summary of the underlying entry. */
  public String summary() {
    return entry.summary();
  }

  /** Returns the source path of the underlying entry. */
  public String sourcePath() {
    return entry.sourcePath();
  }

  /** Returns true if this occurrence was substituted by an exception entry. */
  public boolean isException() {
    return entry.isException();
  }
}
