package io.daybook.parser;

import static org.junit.jupiter.api.Assertions.*;

import io.daybook.DaybookException;
import io.daybook.ErrorKind;
import io.daybook.Span;
import io.daybook.model.Precision;
import io.daybook.model.TemporalValue;
import java.time.Instant;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

class TemporalParserTest {
  private static final ZoneId UTC = ZoneId.of("UTC");
  private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

  @Test
  void testParseDate() throws DaybookException {
    TemporalValue v = TemporalParser.parse("20240115", UTC);
    assertEquals(Precision.DATE, v.precision());
    assertEquals(Instant.parse("2024-01-15T00:00:00Z"), v.instant());
    assertTrue(v.isDate());
  }

  @Test
  void testParseDateTime() throws DaybookException {
    TemporalValue v = TemporalParser.parse("20240115T093005", UTC);
    assertEquals(Precision.DATE_TIME, v.precision());
    assertEquals(Instant.parse("2024-01-15T09:30:05Z"), v.instant());
  }

  @Test
  void testDateIsLocalMidnight() throws DaybookException {
    TemporalValue v = TemporalParser.parse("20240115", NEW_YORK);
    assertEquals(Instant.parse("2024-01-15T05:00:00Z"), v.instant());
  }

  @Test
  void testDateTimeIsFloatingLocalTime() throws DaybookException {
    TemporalValue winter = TemporalParser.parse("20240115T093000", NEW_YORK);
    TemporalValue summer = TemporalParser.parse("20240715T093000", NEW_YORK);
    assertEquals(Instant.parse("2024-01-15T14:30:00Z"), winter.instant());
    assertEquals(Instant.parse("2024-07-15T13:30:00Z"), summer.instant());
  }

  @Test
  void testUtcSuffixIsNotHonored() throws DaybookException {
    TemporalValue v = TemporalParser.parse("20240115T093000Z", NEW_YORK);
    assertEquals(TemporalParser.parse("20240115T093000", NEW_YORK), v);
  }

  @Test
  void testDstGapMovesForward() throws DaybookException {
    // 02:30 does not exist on 2024-03-10 in New York
    TemporalValue v = TemporalParser.parse("20240310T023000", NEW_YORK);
    assertEquals(Instant.parse("2024-03-10T07:30:00Z"), v.instant());
  }

  @Test
  void testSurroundingWhitespaceIsIgnored() throws DaybookException {
    assertEquals(TemporalParser.parse("20240115", UTC), TemporalParser.parse(" 20240115 ", UTC));
  }

  @Test
  void testInvalidShapes() {
    assertInvalid("2024-01-15", new Span(4, 5));
    assertInvalid("2024011", new Span(7, 8));
    assertInvalid("20240115X093000", new Span(8, 9));
    assertInvalid("20240115T0930", new Span(13, 14));
    assertInvalid("20240115T093000+0100", new Span(15, 20));
    assertInvalid("", new Span(0, 1));
  }

  @Test
  void testOutOfRangeFields() {
    assertInvalid("20241315", new Span(4, 8));
    assertInvalid("20230229", new Span(4, 8));
    assertInvalid("20240115T250000", new Span(9, 15));
  }

  @Test
  void testNullInput() {
    DaybookException e =
        assertThrows(DaybookException.class, () -> TemporalParser.parse(null, UTC));
    assertEquals(ErrorKind.PARSE, e.kind());
    assertTrue(e.span().isEmpty());
  }

  @Test
  void testDisplayRich() {
    DaybookException e =
        assertThrows(DaybookException.class, () -> TemporalParser.parse("2024-01-15", UTC));
    assertEquals("error: invalid date format\n  2024-01-15\n      ^", e.displayRich());
  }

  private static void assertInvalid(String input, Span span) {
    DaybookException e =
        assertThrows(DaybookException.class, () -> TemporalParser.parse(input, UTC), input);
    assertEquals(ErrorKind.PARSE, e.kind());
    assertEquals("invalid date format", e.getMessage());
    assertEquals(span, e.span().orElseThrow(), input);
  }
}
