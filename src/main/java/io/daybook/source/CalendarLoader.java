package io.daybook.source;

import io.daybook.DaybookException;
import io.daybook.Diagnostic;
import io.daybook.model.Entry;
import io.daybook.parser.EntryBuilder;
import io.daybook.parser.EventRecord;
import io.daybook.parser.RecordParser;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads every event of a calendar directory.
 *
 * <p>Each regular file directly inside the directory is read as calendar text. A missing
 * directory, an unreadable file or an event without a valid start is reported and skipped; the
 * load itself never fails.
 */
public final class CalendarLoader {
  private static final Logger logger = LoggerFactory.getLogger(CalendarLoader.class);

  private final DirectoryLister lister;
  private final TextFileReader reader;
  private final EntryBuilder builder;

  /**
   * Creates a loader.
   *
   * @param lister lists the calendar directory
   * @param reader reads each file
   * @param builder turns records into entries
   */
  public CalendarLoader(DirectoryLister lister, TextFileReader reader, EntryBuilder builder) {
    this.lister = lister;
    this.reader = reader;
    this.builder = builder;
  }

  /**
   * Loads a calendar directory.
   *
   * @param directory the directory
   * @return the calendar name, its entries, and any diagnostics
   */
  public LoadedCalendar load(Path directory) {
    Path dir = directory.toAbsolutePath().normalize();
    String name = dir.getFileName() == null ? dir.toString() : dir.getFileName().toString();
    List<Entry> entries = new ArrayList<>();
    List<Diagnostic> diagnostics = new ArrayList<>();

    List<DirectoryEntry> children;
    try {
      children = listDirectory(dir);
    } catch (DaybookException e) {
      report(e, dir.toString(), diagnostics);
      return new LoadedCalendar(name, entries, diagnostics);
    }

    for (DirectoryEntry child : children) {
      if (!child.isFile()) {
        continue;
      }
      Path file = dir.resolve(child.name());
      try {
        String text = readFile(file);
        for (EventRecord record : RecordParser.parse(text, file.toString())) {
          addEntry(record, entries, diagnostics);
        }
      } catch (DaybookException e) {
        report(e, file.toString(), diagnostics);
      }
    }

    logger.debug(
        "Loaded {} entries from calendar '{}' with {} diagnostics",
        entries.size(),
        name,
        diagnostics.size());
    return new LoadedCalendar(name, entries, diagnostics);
  }

  private List<DirectoryEntry> listDirectory(Path dir) throws DaybookException {
    try {
      return lister.list(dir);
    } catch (IOException e) {
      throw DaybookException.io("directory does not exist or cannot be read", dir.toString(), e);
    }
  }

  private String readFile(Path file) throws DaybookException {
    try {
      return reader.read(file);
    } catch (IOException e) {
      throw DaybookException.io("could not read file", file.toString(), e);
    }
  }

  private void addEntry(EventRecord record, List<Entry> entries, List<Diagnostic> diagnostics) {
    try {
      entries.add(builder.build(record));
    } catch (DaybookException e) {
      report(e, record.sourcePath(), diagnostics);
    }
  }

  private static void report(DaybookException e, String path, List<Diagnostic> diagnostics) {
    logger.warn("Skipping {}: {}", path, e.getMessage());
    diagnostics.add(Diagnostic.of(e, path));
  }
}
