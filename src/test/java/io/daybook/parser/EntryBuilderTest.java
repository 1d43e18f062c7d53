package io.daybook.parser;

import static org.junit.jupiter.api.Assertions.*;

import io.daybook.DaybookException;
import io.daybook.ErrorKind;
import io.daybook.model.Entry;
import java.time.Instant;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EntryBuilderTest {
  private final EntryBuilder builder = new EntryBuilder(ZoneId.of("UTC"));

  @Test
  void testBuildsAllFields() throws DaybookException {
    Entry entry =
        builder.build(
            record(
                "DTSTART", "20240101T090000",
                "DTEND", "20240101T100000",
                "RRULE", "FREQ=DAILY;COUNT=3",
                "SUMMARY", "  Standup \t",
                "RECURRENCE-ID", "20240102T090000"));

    assertEquals(Instant.parse("2024-01-01T09:00:00Z"), entry.start().instant());
    assertEquals(Instant.parse("2024-01-01T10:00:00Z"), entry.end().instant());
    assertEquals("FREQ=DAILY;COUNT=3", entry.recurrenceRule());
    assertEquals("Standup", entry.summary());
    assertEquals(Instant.parse("2024-01-02T09:00:00Z"), entry.recurrenceId().instant());
    assertEquals("/cal/event.ics", entry.sourcePath());
    assertTrue(entry.isException());
    assertTrue(entry.isRecurring());
  }

  @Test
  void testOptionalFieldsMayBeAbsent() throws DaybookException {
    Entry entry = builder.build(record("DTSTART", "20240101"));
    assertNull(entry.end());
    assertNull(entry.recurrenceRule());
    assertNull(entry.recurrenceId());
    assertEquals("", entry.summary());
    assertFalse(entry.isException());
  }

  @Test
  void testMissingStartIsRejected() {
    DaybookException e =
        assertThrows(DaybookException.class, () -> builder.build(record("SUMMARY", "x")));
    assertEquals(ErrorKind.PARSE, e.kind());
    assertEquals("no start date", e.getMessage());
  }

  @Test
  void testMalformedStartIsRejected() {
    DaybookException e =
        assertThrows(
            DaybookException.class, () -> builder.build(record("DTSTART", "2024-01-01")));
    assertEquals("invalid date format", e.getMessage());
  }

  @Test
  void testMalformedOptionalFieldsBecomeAbsent() throws DaybookException {
    Entry entry =
        builder.build(
            record("DTSTART", "20240101", "DTEND", "later", "RECURRENCE-ID", "2024-01-01"));
    assertNull(entry.end());
    assertNull(entry.recurrenceId());
    assertFalse(entry.isException());
  }

  private static EventRecord record(String... keyValues) {
    Map<String, String> fields = new HashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      fields.put(keyValues[i], keyValues[i + 1]);
    }
    return new EventRecord(fields, "/cal/event.ics");
  }
}
