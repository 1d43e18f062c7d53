package io.daybook;

import io.daybook.config.DaybookConfig;
import io.daybook.display.Agenda;
import io.daybook.display.AgendaRenderer;
import io.daybook.eval.DayProjector;
import io.daybook.eval.RecurrenceExpander;
import io.daybook.model.DayView;
import io.daybook.model.Entry;
import io.daybook.model.Window;
import io.daybook.parser.EntryBuilder;
import io.daybook.parser.TemporalParser;
import io.daybook.source.CalendarLoader;
import io.daybook.source.DirectoryLister;
import io.daybook.source.LoadedCalendar;
import io.daybook.source.TextFileReader;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;
import java.util.List;

/**
 * The main entry point for loading calendar directories and building day views.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Daybook daybook = Daybook.create();
 * LoadedCalendar calendar = daybook.loadCalendar(Path.of("~/calendars/work"));
 * DayView view = daybook.buildDayView(calendar.entries(), daybook.window("20240101", "20241231"));
 * for (DayBucket day : view.days()) {
 *     System.out.println(day.day() + ": " + day.placements().size() + " events");
 * }
 * }</pre>
 *
 * <p>Instances hold no state between calls; loading and projecting are pure functions of their
 * arguments, the configuration, and the clock.
 */
public final class Daybook {
  private final DaybookConfig config;
  private final Clock clock;
  private final CalendarLoader loader;
  private final DayProjector projector;

  private Daybook(DaybookConfig config, Clock clock, CalendarLoader loader) {
    this.config = config;
    this.clock = clock;
    this.loader = loader;
    RecurrenceExpander expander = new RecurrenceExpander(config.zone(), config.maxOccurrences());
    this.projector =
        new DayProjector(expander, config.zone(), clock, config.maxTotalOccurrences());
  }

  /**
   * Creates a daybook from the default configuration and the system clock.
   *
   * @return a new daybook
   */
  public static Daybook create() {
    DaybookConfig config = new DaybookConfig();
    return create(config, Clock.system(config.zone()));
  }

  /**
   * Creates a daybook reading from the file system.
   *
   * @param config the configuration
   * @param clock the clock defining "today" and the default window
   * @return a new daybook
   */
  public static Daybook create(DaybookConfig config, Clock clock) {
    return create(
        config,
        clock,
        DirectoryLister.fileSystem(),
        TextFileReader.fileSystem(config.charset()));
  }

  /**
   * Creates a daybook with custom directory and file access.
   *
   * @param config the configuration
   * @param clock the clock defining "today" and the default window
   * @param lister lists calendar directories
   * @param reader reads calendar files
   * @return a new daybook
   */
  public static Daybook create(
      DaybookConfig config, Clock clock, DirectoryLister lister, TextFileReader reader) {
    CalendarLoader loader = new CalendarLoader(lister, reader, new EntryBuilder(config.zone()));
    return new Daybook(config, clock, loader);
  }

  /**
   * Loads every event of a calendar directory.
   *
   * @param directory the directory holding one calendar file per event (or several)
   * @return the calendar name, entries, and diagnostics for anything skipped
   */
  public LoadedCalendar loadCalendar(Path directory) {
    return loader.load(directory);
  }

  /**
   * Expands entries within a window and buckets them by day.
   *
   * @param entries the entries, exceptions included
   * @param window the query window
   * @return the day view
   */
  public DayView buildDayView(List<Entry> entries, Window window) {
    return projector.project(entries, window);
  }

  /**
   * Expands entries within the default window and buckets them by day.
   *
   * @param entries the entries, exceptions included
   * @return the day view
   */
  public DayView buildDayView(List<Entry> entries) {
    return buildDayView(entries, defaultWindow());
  }

  /**
   * Renders a day view as agenda lines.
   *
   * @param view the day view
   * @return the agenda
   */
  public Agenda render(DayView view) {
    return AgendaRenderer.render(view, config.zone());
  }

  /**
   * Returns the window used when the caller gives none.
   *
   * @return the default window
   */
  public Window defaultWindow() {
    return config.defaultWindow(clock);
  }

  /**
   * Builds a window from date or date-time strings; either bound may be null to keep the default.
   *
   * @param start the first instant, e.g. "20240101"
   * @param end the last instant, e.g. "20241231T235959"
   * @return the window
   * @throws DaybookException if a bound is not a valid date or date-time
   */
  public Window window(String start, String end) throws DaybookException {
    Window defaults = defaultWindow();
    return new Window(
        start == null ? defaults.start() : TemporalParser.parse(start, zone()).instant(),
        end == null ? defaults.end() : TemporalParser.parse(end, zone()).instant());
  }

  /**
   * Returns the zone floating times are resolved in.
   *
   * @return the zone
   */
  public ZoneId zone() {
    return config.zone();
  }
}
