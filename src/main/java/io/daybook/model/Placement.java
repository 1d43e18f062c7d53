package io.daybook.model;

/**
 * An occurrence placed on one day.
 *
 * @param occurrence the occurrence
 * @param position the span classification for the day it is placed on
 */
public record Placement(Occurrence occurrence, SpanPosition position) {}
