package io.daybook.parser;

import io.daybook.lexer.ContentLine;
import io.daybook.lexer.ContentLineLexer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Groups the lines between {@code BEGIN:VEVENT} and {@code END:VEVENT} into records. */
public final class RecordParser {
  static final String BEGIN_MARKER = "BEGIN:VEVENT";
  static final String END_MARKER = "END:VEVENT";

  private RecordParser() {}

  /**
   * Parses all event records in a text.
   *
   * <p>Lines outside a record are ignored. A record is emitted only on its end marker; a second
   * begin marker discards the unterminated record. Lines inside a record that are not of the form
   * {@code KEY[;params]:VALUE} are skipped. If a key repeats, the last value wins.
   *
   * @param text the calendar text
   * @param sourcePath the file the text was read from
   * @return the records in the order they appear
   */
  public static List<EventRecord> parse(String text, String sourcePath) {
    List<EventRecord> records = new ArrayList<>();
    Map<String, String> open = null;

    for (String line : ContentLineLexer.lines(text)) {
      if (line.startsWith(BEGIN_MARKER)) {
        open = new HashMap<>();
      } else if (line.startsWith(END_MARKER)) {
        if (open != null) {
          records.add(new EventRecord(open, sourcePath));
        }
        open = null;
      } else if (open != null) {
        Optional<ContentLine> parsed = ContentLineLexer.lex(line);
        if (parsed.isPresent()) {
          open.put(parsed.get().name(), parsed.get().value());
        }
      }
    }

    return records;
  }
}
