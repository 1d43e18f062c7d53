package io.daybook.display;

import java.util.List;
import java.util.OptionalInt;
import java.util.stream.Collectors;

/**
 * A rendered day view.
 *
 * @param lines the lines in display order
 * @param currentLine the 1-based line where today's entries begin, if any
 */
public record Agenda(List<AgendaLine> lines, OptionalInt currentLine) {
  /** Creates a new Agenda with a defensive copy of the lines. */
  public Agenda {
    lines = List.copyOf(lines);
  }

  /**
   * Returns the line texts.
   *
   * @return the texts in display order
   */
  public List<String> texts() {
    return lines.stream().map(AgendaLine::text).collect(Collectors.toList());
  }

  @Override
  public String toString() {
    return String.join("\n", texts());
  }
}
