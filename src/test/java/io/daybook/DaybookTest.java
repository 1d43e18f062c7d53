package io.daybook;

import static org.junit.jupiter.api.Assertions.*;

import io.daybook.config.DaybookConfig;
import io.daybook.display.Agenda;
import io.daybook.model.DayView;
import io.daybook.model.Window;
import io.daybook.source.LoadedCalendar;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.OptionalInt;
import java.util.Properties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DaybookTest {
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-01-02T08:00:00Z"), ZoneOffset.UTC);

  @TempDir Path tempDir;

  private Daybook daybook;

  @BeforeEach
  void setUp() {
    Properties props = new Properties();
    props.setProperty(DaybookConfig.ZONE, "UTC");
    daybook = Daybook.create(new DaybookConfig(props), CLOCK);
  }

  @Test
  void loadsProjectsAndRendersCalendar() throws IOException, DaybookException {
    Path work = Files.createDirectory(tempDir.resolve("work"));
    Files.writeString(
        work.resolve("standup.ics"),
        "BEGIN:VEVENT\n"
            + "DTSTART:20240101T090000\n"
            + "DTEND:20240101T091500\n"
            + "RRULE:FREQ=DAILY;COUNT=3\n"
            + "SUMMARY:Standup\n"
            + "END:VEVENT\n"
            + "BEGIN:VEVENT\n"
            + "DTSTART:20240102T100000\n"
            + "DTEND:20240102T101500\n"
            + "RECURRENCE-ID:20240102T090000\n"
            + "SUMMARY:Standup (moved)\n"
            + "END:VEVENT\n");
    Files.writeString(
        work.resolve("offsite.ics"),
        "BEGIN:VEVENT\nDTSTART:20240103\nDTEND:20240105\nSUMMARY:Offsite\nEND:VEVENT\n");

    LoadedCalendar calendar = daybook.loadCalendar(work);
    assertEquals("work", calendar.name());
    assertFalse(calendar.hasDiagnostics());

    DayView view = daybook.buildDayView(calendar.entries(), daybook.window("20240101", "20240131"));
    Agenda agenda = daybook.render(view);

    assertEquals(
        List.of(
            "Mon 2024-01-01 09:00AM - 09:15AM Standup",
            "Tue 2024-01-02 10:00AM - 10:15AM Standup (moved)",
            "Wed 2024-01-03                   |->Offsite",
            "               09:00AM - 09:15AM Standup",
            "Thu 2024-01-04                   <-|Offsite"),
        agenda.texts());
    assertEquals(OptionalInt.of(1), view.todayIndex());
    assertEquals(OptionalInt.of(2), agenda.currentLine());
  }

  @Test
  void defaultWindowIsUsedWhenNoneGiven() throws IOException {
    Path cal = Files.createDirectory(tempDir.resolve("history"));
    Files.writeString(
        cal.resolve("old.ics"),
        "BEGIN:VEVENT\nDTSTART:19990101\nSUMMARY:Party\nEND:VEVENT\n");

    DayView view = daybook.buildDayView(daybook.loadCalendar(cal).entries());

    assertEquals(1, view.days().size());
    assertEquals(Instant.parse("1999-01-01T00:00:00Z"), view.days().get(0).day());
  }

  @Test
  void windowKeepsDefaultForMissingBound() throws DaybookException {
    Window window = daybook.window(null, "20240201");

    assertEquals(daybook.defaultWindow().start(), window.start());
    assertEquals(Instant.parse("2024-02-01T00:00:00Z"), window.end());
  }

  @Test
  void invalidWindowBoundIsParseError() {
    DaybookException e =
        assertThrows(DaybookException.class, () -> daybook.window("2024-01-01", null));

    assertEquals(ErrorKind.PARSE, e.kind());
    assertEquals("error: invalid date format\n  2024-01-01\n      ^", e.displayRich());
  }

  @Test
  void missingDirectoryYieldsEmptyCalendar() {
    Path missing = tempDir.resolve("nowhere");
    LoadedCalendar calendar = daybook.loadCalendar(missing);

    assertTrue(calendar.entries().isEmpty());
    assertTrue(calendar.hasDiagnostics());
    assertEquals(ErrorKind.IO, calendar.diagnostics().get(0).kind());
    assertTrue(daybook.buildDayView(calendar.entries()).days().isEmpty());
  }

  @Test
  void ioErrorRendersPath() {
    DaybookException e = DaybookException.io("could not read file", "/tmp/x.ics", null);

    assertEquals("error: could not read file: /tmp/x.ics", e.displayRich());
    assertTrue(e.span().isEmpty());
    assertEquals("/tmp/x.ics", e.input().orElseThrow());
  }
}
