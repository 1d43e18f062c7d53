package io.daybook;

import java.util.Optional;

/** Exception thrown for errors in reading calendars, parsing values, or interpreting rules. */
public final class DaybookException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The location of the offending characters in the input. */
  private final Span span;

  /** The value string that failed, or the path that could not be read. */
  private final String input;

  private DaybookException(
      ErrorKind kind, String message, Span span, String input, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.span = span;
    this.input = input;
  }

  /**
   * Creates a new I/O error.
   *
   * @param message the error message
   * @param path the path that could not be read
   * @param cause the underlying failure, may be null
   * @return a new DaybookException for an I/O error
   */
  public static DaybookException io(String message, String path, Throwable cause) {
    return new DaybookException(ErrorKind.IO, message, null, path, cause);
  }

  /**
   * Creates a new parse error.
   *
   * @param message the error message
   * @param span the location of the error in the input, may be null
   * @param input the value string being parsed
   * @return a new DaybookException for a parse error
   */
  public static DaybookException parse(String message, Span span, String input) {
    return new DaybookException(ErrorKind.PARSE, message, span, input, null);
  }

  /**
   * Creates a new recurrence rule error.
   *
   * @param message the error message
   * @param span the location of the error in the rule text
   * @param input the rule text
   * @return a new DaybookException for a rule error
   */
  public static DaybookException rule(String message, Span span, String input) {
    return new DaybookException(ErrorKind.RULE, message, span, input, null);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the span where the error occurred, if available.
   *
   * @return the span, or empty if not available
   */
  public Optional<Span> span() {
    return Optional.ofNullable(span);
  }

  /**
   * Returns the failing input or path, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  /**
   * Formats a rich error message with an underline below the offending characters.
   *
   * <p>For parse and rule errors with span and input, produces output like:
   *
   * <pre>
   * error: invalid date format
   *   2024-01-15
   *       ^
   * </pre>
   *
   * @return a formatted error message
   */
  public String displayRich() {
    if (kind != ErrorKind.IO && span != null && input != null) {
      StringBuilder sb = new StringBuilder();
      sb.append("error: ").append(getMessage()).append("\n");
      sb.append("  ").append(input).append("\n");
      sb.append(" ".repeat(span.start() + 2));
      sb.append("^".repeat(span.length()));
      return sb.toString();
    }

    if (kind == ErrorKind.IO && input != null) {
      return "error: " + getMessage() + ": " + input;
    }

    return "error: " + getMessage();
  }
}
