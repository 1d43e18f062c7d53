package io.daybook.parser;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RecordParserTest {

  @Test
  void testParsesEventsAndIgnoresOuterLines() {
    String text =
        String.join(
            "\r\n",
            "BEGIN:VCALENDAR",
            "VERSION:2.0",
            "BEGIN:VEVENT",
            "DTSTART:20240101T090000",
            "SUMMARY:First",
            "END:VEVENT",
            "BEGIN:VEVENT",
            "DTSTART;VALUE=DATE:20240102",
            "SUMMARY:Second",
            "END:VEVENT",
            "END:VCALENDAR");

    List<EventRecord> records = RecordParser.parse(text, "/cal/a.ics");

    assertEquals(2, records.size());
    assertEquals(Optional.of("First"), records.get(0).field("SUMMARY"));
    assertEquals(Optional.of("20240102"), records.get(1).field("DTSTART"));
    assertEquals(Optional.empty(), records.get(0).field("VERSION"));
    assertEquals("/cal/a.ics", records.get(1).sourcePath());
  }

  @Test
  void testUnknownKeysAreRetained() {
    String text = "BEGIN:VEVENT\nDTSTART:20240101\nUID:abc-123\nEND:VEVENT\n";
    EventRecord record = RecordParser.parse(text, "x").get(0);
    assertEquals(Optional.of("abc-123"), record.field("UID"));
  }

  @Test
  void testMalformedLinesAreSkipped() {
    String text = "BEGIN:VEVENT\nDTSTART:20240101\n continued text\nSUMMARY:Kept\nEND:VEVENT";
    EventRecord record = RecordParser.parse(text, "x").get(0);
    assertEquals(2, record.fields().size());
    assertEquals(Optional.of("Kept"), record.field("SUMMARY"));
  }

  @Test
  void testEndWithoutBeginIsIgnored() {
    String text = "END:VEVENT\nBEGIN:VEVENT\nDTSTART:20240101\nEND:VEVENT\nEND:VEVENT";
    assertEquals(1, RecordParser.parse(text, "x").size());
  }

  @Test
  void testUnterminatedRecordIsDropped() {
    String text =
        "BEGIN:VEVENT\nSUMMARY:Lost\nBEGIN:VEVENT\nSUMMARY:Kept\nEND:VEVENT\n"
            + "BEGIN:VEVENT\nSUMMARY:Never closed\n";
    List<EventRecord> records = RecordParser.parse(text, "x");
    assertEquals(1, records.size());
    assertEquals(Optional.of("Kept"), records.get(0).field("SUMMARY"));
  }

  @Test
  void testKeysAreCaseSensitiveAndLastValueWins() {
    String text = "BEGIN:VEVENT\nsummary:lower\nSUMMARY:one\nSUMMARY:two\nEND:VEVENT";
    EventRecord record = RecordParser.parse(text, "x").get(0);
    assertEquals(Optional.of("two"), record.field("SUMMARY"));
    assertEquals(Optional.of("lower"), record.field("summary"));
  }

  @Test
  void testEmptyText() {
    assertTrue(RecordParser.parse("", "x").isEmpty());
  }
}
