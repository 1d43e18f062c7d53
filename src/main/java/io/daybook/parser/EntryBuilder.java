package io.daybook.parser;

import io.daybook.DaybookException;
import io.daybook.model.Entry;
import io.daybook.model.TemporalValue;
import java.time.ZoneId;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Turns raw event records into validated entries. */
public final class EntryBuilder {
  private static final Logger logger = LoggerFactory.getLogger(EntryBuilder.class);

  static final String DTSTART = "DTSTART";
  static final String DTEND = "DTEND";
  static final String RRULE = "RRULE";
  static final String SUMMARY = "SUMMARY";
  static final String RECURRENCE_ID = "RECURRENCE-ID";

  private final ZoneId zone;

  /**
   * Creates a builder resolving floating times in the given zone.
   *
   * @param zone the zone
   */
  public EntryBuilder(ZoneId zone) {
    this.zone = zone;
  }

  /**
   * Builds an entry from a record.
   *
   * <p>A record without a parseable {@code DTSTART} is rejected. An unparseable {@code DTEND} or
   * {@code RECURRENCE-ID} leaves that field absent.
   *
   * @param record the raw record
   * @return the entry
   * @throws DaybookException if the start is missing or malformed
   */
  public Entry build(EventRecord record) throws DaybookException {
    Optional<String> rawStart = record.field(DTSTART);
    if (rawStart.isEmpty()) {
      throw DaybookException.parse("no start date", null, null);
    }
    TemporalValue start = TemporalParser.parse(rawStart.get(), zone);

    return new Entry(
        start,
        optionalValue(record, DTEND),
        record.field(RRULE).orElse(null),
        record.field(SUMMARY).orElse(""),
        optionalValue(record, RECURRENCE_ID),
        record.sourcePath());
  }

  private TemporalValue optionalValue(EventRecord record, String name) {
    Optional<String> raw = record.field(name);
    if (raw.isEmpty()) {
      return null;
    }
    try {
      return TemporalParser.parse(raw.get(), zone);
    } catch (DaybookException e) {
      logger.debug(
          "Dropping {} '{}' in {}: {}", name, raw.get(), record.sourcePath(), e.getMessage());
      return null;
    }
  }
}
