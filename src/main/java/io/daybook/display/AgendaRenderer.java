package io.daybook.display;

import io.daybook.model.DayBucket;
import io.daybook.model.DayView;
import io.daybook.model.Occurrence;
import io.daybook.model.Placement;
import io.daybook.model.SpanPosition;
import io.daybook.model.TemporalValue;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;

/**
 * Renders a day view as agenda lines.
 *
 * <p>Example output:
 *
 * <pre>
 * Mon 2024-03-11 09:00AM - 10:00AM Standup
 *                12:30PM -         Lunch
 *                                  &lt;-&gt;Conference
 * Tue 2024-03-12                   &lt;-|Conference
 * </pre>
 */
public final class AgendaRenderer {
  private static final DateTimeFormatter DAY_FORMAT =
      DateTimeFormatter.ofPattern("EEE yyyy-MM-dd", Locale.ENGLISH);
  private static final DateTimeFormatter TIME_FORMAT =
      DateTimeFormatter.ofPattern("hh:mma", Locale.ENGLISH);

  private AgendaRenderer() {}

  /**
   * Renders a day view.
   *
   * @param view the day view
   * @param zone the zone days and times are shown in
   * @return the rendered agenda
   */
  public static Agenda render(DayView view, ZoneId zone) {
    List<AgendaLine> lines = new ArrayList<>();
    OptionalInt currentLine = OptionalInt.empty();

    for (int i = 0; i < view.days().size(); i++) {
      DayBucket bucket = view.days().get(i);
      if (view.todayIndex().isPresent() && view.todayIndex().getAsInt() == i) {
        currentLine = OptionalInt.of(lines.size() + 1);
      }
      String day = DAY_FORMAT.format(bucket.day().atZone(zone));
      boolean first = true;
      for (Placement placement : bucket.placements()) {
        Occurrence occurrence = placement.occurrence();
        String time = renderTime(occurrence, placement.position(), zone);
        String summary = prefix(placement.position()) + occurrence.summary();
        String text =
            first
                ? String.format("%s %17s %s", day, time, summary)
                : String.format(" %31s %s", time, summary);
        lines.add(new AgendaLine(text, occurrence));
        first = false;
      }
    }

    return new Agenda(lines, currentLine);
  }

  private static String renderTime(Occurrence occurrence, SpanPosition position, ZoneId zone) {
    // all-day entries carry no time
    if (position != SpanPosition.SINGLE || occurrence.start().isDate()) {
      return "";
    }
    String start = formatTime(occurrence.start(), zone);
    String end = occurrence.end() == null ? "" : formatTime(occurrence.end(), zone);
    return String.format("%7s - %7s", start, end);
  }

  private static String formatTime(TemporalValue value, ZoneId zone) {
    return TIME_FORMAT.format(value.instant().atZone(zone));
  }

  private static String prefix(SpanPosition position) {
    return switch (position) {
      case START -> "|->";
      case MIDDLE -> "<->";
      case END -> "<-|";
      case SINGLE -> "";
    };
  }
}
