package io.daybook.model;

import java.time.Duration;
import java.util.Objects;

/**
 * The validated representation of one event record.
 *
 * <p>An entry with a {@code recurrenceId} is an exception: it is never expanded on its own, only
 * substituted for the occurrence of another entry that starts at exactly that instant.
 *
 * @param start the start value (required)
 * @param end the exclusive end value (may be null)
 * @param recurrenceRule the raw recurrence rule text (may be null)
 * @param summary the trimmed summary, empty if the record had none
 * @param recurrenceId the instant of the occurrence this entry replaces (may be null)
 * @param sourcePath the file the entry was read from
 */
public record Entry(
    TemporalValue start,
    TemporalValue end,
    String recurrenceRule,
    String summary,
    TemporalValue recurrenceId,
    String sourcePath) {
  /** Creates a new Entry, requiring a start and normalizing the summary. */
  public Entry {
    Objects.requireNonNull(start, "start");
    summary = summary == null ? "" : summary.strip();
  }

  /**
   * Creates a one-off entry with just a start, end, and summary.
   *
   * @param start the start value
   * @param end the end value, may be null
   * @param summary the summary
   * @return a new entry without rule, recurrence id or source path
   */
  public static Entry of(TemporalValue start, TemporalValue end, String summary) {
    return new Entry(start, end, null, summary, null, null);
  }

  /**
   * Returns a copy with the specified recurrence rule.
   *
   * @param rule the raw rule text
   * @return a new Entry with the updated rule
   */
  public Entry withRecurrenceRule(String rule) {
    return new Entry(start, end, rule, summary, recurrenceId, sourcePath);
  }

  /**
   * Returns a copy with the specified recurrence id.
   *
   * @param id the instant of the occurrence to replace
   * @return a new Entry with the updated recurrence id
   */
  public Entry withRecurrenceId(TemporalValue id) {
    return new Entry(start, end, recurrenceRule, summary, id, sourcePath);
  }

  /**
   * Returns a copy with the specified source path.
   *
   * @param path the source path
   * @return a new Entry with the updated source path
   */
  public Entry withSourcePath(String path) {
    return new Entry(start, end, recurrenceRule, summary, recurrenceId, path);
  }

  /** Returns true if this entry overrides a single occurrence of another entry. */
  public boolean isException() {
    return recurrenceId != null;
  }

  /** Returns true if this entry carries a recurrence rule. */
  public boolean isRecurring() {
    return recurrenceRule != null;
  }

  /** Returns the distance from start to end, zero if the entry has no end. */
  public Duration length() {
    return end == null ? Duration.ZERO : Duration.between(start.instant(), end.instant());
  }
}
