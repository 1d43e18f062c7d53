package io.daybook.parser;

import java.util.Map;
import java.util.Optional;

/**
 * The raw fields of one {@code VEVENT} block.
 *
 * @param fields property name to raw value; parameters are not retained
 * @param sourcePath the file the record was read from
 */
public record EventRecord(Map<String, String> fields, String sourcePath) {
  /** Creates a new EventRecord with a defensive copy of the fields. */
  public EventRecord {
    fields = Map.copyOf(fields);
  }

  /**
   * Returns the raw value of a field.
   *
   * @param name the property name, case-sensitive
   * @return the value, or empty if the record has no such field
   */
  public Optional<String> field(String name) {
    return Optional.ofNullable(fields.get(name));
  }
}
