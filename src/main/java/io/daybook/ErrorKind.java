package io.daybook;

/** The type of error that occurred while loading or interpreting calendar data. */
public enum ErrorKind {
  /** I/O error - directory missing or unreadable, file unreadable. */
  IO("io"),
  /** Parse error - malformed date value or missing mandatory field. */
  PARSE("parse"),
  /** Rule error - malformed recurrence rule value. */
  RULE("rule");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
