package io.daybook.eval;

import io.daybook.model.DayBucket;
import io.daybook.model.DayView;
import io.daybook.model.Entry;
import io.daybook.model.Frequency;
import io.daybook.model.Occurrence;
import io.daybook.model.Placement;
import io.daybook.model.SpanPosition;
import io.daybook.model.Window;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands entries and distributes the occurrences over the days they intersect.
 *
 * <p>Occurrences are ordered by start; occurrences with the same start keep the order of the
 * entries they came from. An occurrence is placed on every day from its start day up to, but not
 * including, the day its exclusive end falls on; an occurrence without end covers its start day
 * only. Days outside the window receive no placements, and the walk stops at the window end.
 */
public final class DayProjector {
  private static final Logger logger = LoggerFactory.getLogger(DayProjector.class);

  /** Default maximum number of occurrences across all entries of one view. */
  public static final int MAX_TOTAL_OCCURRENCES = 100_000;

  private final RecurrenceExpander expander;
  private final ZoneId zone;
  private final Clock clock;
  private final int maxTotalOccurrences;

  /**
   * Creates a projector.
   *
   * @param expander the expander used for recurring entries
   * @param zone the zone days are computed in
   * @param clock the clock that defines "today"
   * @param maxTotalOccurrences the budget for expanded occurrences across all entries
   */
  public DayProjector(
      RecurrenceExpander expander, ZoneId zone, Clock clock, int maxTotalOccurrences) {
    if (maxTotalOccurrences < 1) {
      throw new IllegalArgumentException(
          "maxTotalOccurrences must be positive: " + maxTotalOccurrences);
    }
    this.expander = expander;
    this.zone = zone;
    this.clock = clock;
    this.maxTotalOccurrences = maxTotalOccurrences;
  }

  /**
   * Builds the day view of a set of entries.
   *
   * @param entries the entries, exceptions included
   * @param window the query window
   * @return the day buckets sorted by day, with the index of today's bucket if any
   */
  public DayView project(List<Entry> entries, Window window) {
    List<Occurrence> occurrences = expandAll(entries, window);
    occurrences.sort(Comparator.comparing(o -> o.start().instant()));

    Map<Instant, List<Placement>> days = new TreeMap<>();
    for (Occurrence occurrence : occurrences) {
      if (!window.contains(occurrence.start().instant())) {
        continue;
      }
      place(occurrence, window, days);
    }

    List<DayBucket> buckets = new ArrayList<>(days.size());
    Instant today = CalendarMath.startOfDay(clock.instant(), zone);
    OptionalInt todayIndex = OptionalInt.empty();
    for (Map.Entry<Instant, List<Placement>> day : days.entrySet()) {
      if (day.getKey().equals(today)) {
        todayIndex = OptionalInt.of(buckets.size());
      }
      buckets.add(new DayBucket(day.getKey(), day.getValue()));
    }

    logger.debug(
        "Projected {} occurrences of {} entries onto {} days",
        occurrences.size(),
        entries.size(),
        buckets.size());
    return new DayView(buckets, todayIndex);
  }

  private List<Occurrence> expandAll(List<Entry> entries, Window window) {
    List<Entry> exceptions = new ArrayList<>();
    for (Entry entry : entries) {
      if (entry.isException()) {
        exceptions.add(entry);
      }
    }

    List<Occurrence> occurrences = new ArrayList<>();
    for (Entry entry : entries) {
      if (entry.isException()) {
        continue;
      }
      int remaining = maxTotalOccurrences - occurrences.size();
      if (remaining <= 0) {
        logger.warn(
            "Expansion budget of {} occurrences exhausted, skipping remaining entries",
            maxTotalOccurrences);
        break;
      }
      occurrences.addAll(expander.expand(entry, exceptions, window, remaining));
    }
    return occurrences;
  }

  private void place(Occurrence occurrence, Window window, Map<Instant, List<Placement>> days) {
    Instant start = occurrence.start().instant();
    Instant end = occurrence.end() == null ? null : occurrence.end().instant();
    Instant startDay = CalendarMath.startOfDay(start, zone);
    Instant lastDay = end == null ? startDay : CalendarMath.previousDay(end, zone);
    boolean multiDay = occurrence.start().isDate() && lastDay.isAfter(startDay);

    Instant cursor = startDay;
    do {
      if (window.contains(cursor)) {
        SpanPosition position =
            multiDay ? classify(cursor, startDay, lastDay) : SpanPosition.SINGLE;
        days.computeIfAbsent(cursor, d -> new ArrayList<>())
            .add(new Placement(occurrence, position));
      }
      cursor = nextDay(cursor);
    } while (end != null && cursor.isBefore(end) && !cursor.isAfter(window.end()));
  }

  /** Recomputes midnight since a day is not always 24 hours long. */
  private Instant nextDay(Instant day) {
    return CalendarMath.startOfDay(CalendarMath.advance(day, 1, Frequency.DAILY, zone), zone);
  }

  private static SpanPosition classify(Instant day, Instant startDay, Instant lastDay) {
    if (day.equals(startDay)) {
      return SpanPosition.START;
    }
    if (day.equals(lastDay)) {
      return SpanPosition.END;
    }
    return SpanPosition.MIDDLE;
  }
}
