package io.daybook.model;

/** The resolution of a temporal value. */
public enum Precision {
  /** A calendar day (e.g., 20240115). */
  DATE,
  /** A wall-clock time to the second (e.g., 20240115T090000). */
  DATE_TIME
}
