package io.daybook.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Splits raw calendar text into lines and lines into {@link ContentLine}s. */
public final class ContentLineLexer {
  private final String line;
  private int pos;

  private ContentLineLexer(String line) {
    this.line = line;
    this.pos = 0;
  }

  /**
   * Splits text on CR and LF, dropping empty lines.
   *
   * @param text the raw text
   * @return the non-empty lines in order
   */
  public static List<String> lines(String text) {
    List<String> lines = new ArrayList<>();
    int start = 0;
    for (int i = 0; i <= text.length(); i++) {
      if (i == text.length() || isLineBreak(text.charAt(i))) {
        if (i > start) {
          lines.add(text.substring(start, i));
        }
        start = i + 1;
      }
    }
    return lines;
  }

  /**
   * Lexes one content line.
   *
   * <p>The name runs up to the first ';' or ':', the value starts after the first ':' that follows
   * the name. Anything between is parameter text.
   *
   * @param line the line to lex
   * @return the content line, or empty if the line has no name or no colon
   */
  public static Optional<ContentLine> lex(String line) {
    return new ContentLineLexer(line).doLex();
  }

  private Optional<ContentLine> doLex() {
    int nameStart = pos;
    while (pos < line.length() && !isNameTerminator(line.charAt(pos))) {
      pos++;
    }
    if (pos == nameStart) {
      return Optional.empty();
    }
    String name = line.substring(nameStart, pos);

    int colon = line.indexOf(':', pos);
    if (colon < 0) {
      return Optional.empty();
    }

    String params = "";
    if (line.charAt(pos) == ';') {
      params = line.substring(pos + 1, colon);
    }
    return Optional.of(new ContentLine(name, params, line.substring(colon + 1)));
  }

  private static boolean isNameTerminator(char c) {
    return c == ';' || c == ':';
  }

  private static boolean isLineBreak(char c) {
    return c == '\r' || c == '\n';
  }
}
