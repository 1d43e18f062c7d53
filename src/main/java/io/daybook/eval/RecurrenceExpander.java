package io.daybook.eval;

import io.daybook.model.Entry;
import io.daybook.model.Occurrence;
import io.daybook.model.RecurrenceRule;
import io.daybook.model.Window;
import io.daybook.parser.RuleParser;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands an entry's recurrence rule into concrete occurrences.
 *
 * <h2>Iteration Safety Limits</h2>
 *
 * <p>Expansion stops at the first of: the instant passing {@code UNTIL}, {@code COUNT} generated
 * instants, the instant passing the end of the window, or {@code maxOccurrences} emitted
 * occurrences. Instants that end before the window are generated but not emitted, so they count
 * towards {@code COUNT} and not towards the cap. The cap always applies, so a rule with neither
 * {@code COUNT} nor {@code UNTIL} still terminates. A step that leaves the range {@link
 * java.time.LocalDate} supports ends the expansion of that entry.
 *
 * <p>A rule whose frequency is missing or unrecognized does not advance. Such a rule yields its
 * first occurrence and stops, rather than repeating the same instant up to the cap.
 *
 * <h2>Exceptions</h2>
 *
 * <p>An exception replaces the occurrence whose computed start equals its recurrence id exactly,
 * before any window filtering. A date recurrence id never matches a date-time occurrence unless
 * both resolve to the same instant.
 */
public final class RecurrenceExpander {
  private static final Logger logger = LoggerFactory.getLogger(RecurrenceExpander.class);

  /** Default maximum number of occurrences produced per entry. */
  public static final int MAX_OCCURRENCES = 1000;

  private final ZoneId zone;
  private final int maxOccurrences;

  /**
   * Creates an expander with the default cap.
   *
   * @param zone the zone calendar arithmetic is done in
   */
  public RecurrenceExpander(ZoneId zone) {
    this(zone, MAX_OCCURRENCES);
  }

  /**
   * Creates an expander.
   *
   * @param zone the zone calendar arithmetic is done in
   * @param maxOccurrences the maximum number of occurrences per entry, at most {@link
   *     #MAX_OCCURRENCES}
   */
  public RecurrenceExpander(ZoneId zone, int maxOccurrences) {
    if (maxOccurrences < 1 || maxOccurrences > MAX_OCCURRENCES) {
      throw new IllegalArgumentException(
          "maxOccurrences must be between 1 and " + MAX_OCCURRENCES + ": " + maxOccurrences);
    }
    this.zone = zone;
    this.maxOccurrences = maxOccurrences;
  }

  /**
   * Expands an entry within a window.
   *
   * @param entry the entry to expand
   * @param exceptions candidate exception entries
   * @param window the query window
   * @return the occurrences in order; exactly the entry itself if it has no rule
   */
  public List<Occurrence> expand(Entry entry, List<Entry> exceptions, Window window) {
    return expand(entry, exceptions, window, maxOccurrences);
  }

  /**
   * Expands an entry within a window with a tighter cap.
   *
   * @param entry the entry to expand
   * @param exceptions candidate exception entries
   * @param window the query window
   * @param limit the maximum number of occurrences; capped at this expander's maximum
   * @return the occurrences in order; exactly the entry itself if it has no rule
   */
  public List<Occurrence> expand(Entry entry, List<Entry> exceptions, Window window, int limit) {
    if (!entry.isRecurring()) {
      return List.of(Occurrence.of(entry));
    }

    RecurrenceRule rule = RuleParser.parse(entry.recurrenceRule(), zone);
    int cap = Math.min(limit, maxOccurrences);
    Duration length = entry.length();

    List<Occurrence> results = new ArrayList<>();
    Instant current = entry.start().instant();
    int generated = 0;

    while (results.size() < cap) {
      if (rule.until() != null && current.isAfter(rule.until().instant())) {
        break;
      }
      if (rule.count() != null && generated >= rule.count()) {
        break;
      }
      if (current.isAfter(window.end())) {
        break;
      }

      if (overlaps(current, length, window)) {
        results.add(occurrenceAt(entry, current, exceptions));
      }
      generated++;

      Instant next;
      try {
        next = CalendarMath.advance(current, rule.interval(), rule.frequency(), zone);
      } catch (DateTimeException | ArithmeticException e) {
        logger.warn(
            "Recurrence rule '{}' in {} steps outside the supported date range, stopping: {}",
            entry.recurrenceRule(),
            entry.sourcePath(),
            e.getMessage());
        break;
      }
      if (!next.isAfter(current)) {
        logger.warn(
            "Recurrence rule '{}' in {} does not advance, keeping the first occurrence only",
            entry.recurrenceRule(),
            entry.sourcePath());
        break;
      }
      current = next;
    }

    if (results.size() == maxOccurrences) {
      logger.debug(
          "Expansion of '{}' in {} stopped at {} occurrences",
          entry.summary(),
          entry.sourcePath(),
          maxOccurrences);
    }
    return results;
  }

  /** An occurrence starting at or before the window end overlaps it unless it ends before it. */
  private static boolean overlaps(Instant start, Duration length, Window window) {
    return !start.isBefore(window.start()) || !start.plus(length).isBefore(window.start());
  }

  private static Occurrence occurrenceAt(Entry entry, Instant start, List<Entry> exceptions) {
    for (Entry ex : exceptions) {
      if (ex.recurrenceId() != null && ex.recurrenceId().instant().equals(start)) {
        return Occurrence.of(ex);
      }
    }
    return Occurrence.rebound(entry, start);
  }
}
