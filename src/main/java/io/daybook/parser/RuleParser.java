package io.daybook.parser;

import io.daybook.DaybookException;
import io.daybook.Span;
import io.daybook.model.Frequency;
import io.daybook.model.RecurrenceRule;
import io.daybook.model.TemporalValue;
import java.time.ZoneId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses {@code RRULE} values of the form {@code FREQ=WEEKLY;INTERVAL=2;COUNT=10}.
 *
 * <p>Only {@code FREQ}, {@code INTERVAL}, {@code UNTIL} and {@code COUNT} are interpreted; other
 * tokens are ignored. A malformed value is logged and the part falls back to its default, so
 * parsing never fails.
 */
public final class RuleParser {
  private static final Logger logger = LoggerFactory.getLogger(RuleParser.class);

  private RuleParser() {}

  /**
   * Parses a recurrence rule.
   *
   * @param text the rule text
   * @param zone the zone an {@code UNTIL} value is resolved in
   * @return the parsed rule; frequency is null if absent or unrecognized
   */
  public static RecurrenceRule parse(String text, ZoneId zone) {
    Frequency frequency = null;
    int interval = 1;
    TemporalValue until = null;
    Integer count = null;

    int offset = 0;
    for (String token : text.split(";", -1)) {
      Span span = new Span(offset, offset + token.length());
      offset += token.length() + 1;

      int eq = token.indexOf('=');
      if (eq < 0) {
        continue;
      }
      String key = token.substring(0, eq).strip();
      String value = token.substring(eq + 1).strip();

      try {
        switch (key) {
          case "FREQ" -> frequency = parseFrequency(value, span, text);
          case "INTERVAL" -> interval = parseCount(value, span, text, 1);
          case "COUNT" -> count = parseCount(value, span, text, 0);
          case "UNTIL" -> until = parseUntil(value, span, text, zone);
          default -> {
            // BYDAY, WKST and the rest are not interpreted
          }
        }
      } catch (DaybookException e) {
        logger.warn("Ignoring {} in recurrence rule '{}': {}", key, text, e.getMessage());
      }
    }

    return new RecurrenceRule(frequency, interval, until, count);
  }

  private static Frequency parseFrequency(String value, Span span, String text)
      throws DaybookException {
    return Frequency.fromName(value)
        .orElseThrow(
            () -> DaybookException.rule("unrecognized frequency '" + value + "'", span, text));
  }

  private static int parseCount(String value, Span span, String text, int min)
      throws DaybookException {
    int n;
    try {
      n = Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw DaybookException.rule("expected a number, got '" + value + "'", span, text);
    }
    if (n < min) {
      throw DaybookException.rule("value must be at least " + min + ", got " + n, span, text);
    }
    return n;
  }

  private static TemporalValue parseUntil(String value, Span span, String text, ZoneId zone)
      throws DaybookException {
    try {
      return TemporalParser.parse(value, zone);
    } catch (DaybookException e) {
      throw DaybookException.rule("invalid UNTIL value '" + value + "'", span, text);
    }
  }
}
