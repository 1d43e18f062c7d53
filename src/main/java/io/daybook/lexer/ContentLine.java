package io.daybook.lexer;

/**
 * One {@code KEY[;params]:VALUE} line of an event record.
 *
 * @param name the property name (e.g., "DTSTART")
 * @param params the raw parameter text between the name and the colon, without the leading ';'
 *     (empty if none)
 * @param value the property value, everything after the first colon
 */
public record ContentLine(String name, String params, String value) {}
