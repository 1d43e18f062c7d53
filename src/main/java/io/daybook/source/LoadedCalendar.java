package io.daybook.source;

import io.daybook.Diagnostic;
import io.daybook.model.Entry;
import java.util.List;

/**
 * The entries of one calendar directory.
 *
 * @param name the display name, the directory's base name
 * @param entries the valid entries, exceptions included, in file order
 * @param diagnostics the problems met while loading
 */
public record LoadedCalendar(String name, List<Entry> entries, List<Diagnostic> diagnostics) {
  /** Creates a new LoadedCalendar with defensive copies of lists. */
  public LoadedCalendar {
    entries = List.copyOf(entries);
    diagnostics = List.copyOf(diagnostics);
  }

  /** Returns true if any directory, file, or record was skipped. */
  public boolean hasDiagnostics() {
    return !diagnostics.isEmpty();
  }
}
