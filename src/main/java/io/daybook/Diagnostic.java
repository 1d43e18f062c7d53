package io.daybook;

/**
 * A recoverable problem reported while loading a calendar.
 *
 * @param kind the error kind
 * @param sourcePath the directory or file the problem relates to
 * @param message a human-readable description
 */
public record Diagnostic(ErrorKind kind, String sourcePath, String message) {

  /**
   * Creates a diagnostic from a caught exception.
   *
   * @param e the exception
   * @param sourcePath the directory or file the exception relates to
   * @return a new diagnostic
   */
  public static Diagnostic of(DaybookException e, String sourcePath) {
    return new Diagnostic(e.kind(), sourcePath, e.getMessage());
  }

  @Override
  public String toString() {
    return kind + ": " + message + " (" + sourcePath + ")";
  }
}
