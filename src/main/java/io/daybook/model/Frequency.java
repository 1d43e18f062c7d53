package io.daybook.model;

import java.util.Optional;

/** The unit a recurrence rule advances by. */
public enum Frequency {
  DAILY,
  WEEKLY,
  MONTHLY,
  YEARLY;

  /**
   * Looks up a frequency by its rule name. Matching is case-sensitive.
   *
   * @param name the name as written in the rule (e.g., "WEEKLY")
   * @return the frequency, or empty if the name is not recognized
   */
  public static Optional<Frequency> fromName(String name) {
    for (Frequency f : values()) {
      if (f.name().equals(name)) {
        return Optional.of(f);
      }
    }
    return Optional.empty();
  }
}
