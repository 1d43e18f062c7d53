package io.daybook.display;

import io.daybook.model.Occurrence;

/**
 * One rendered line and the occurrence it shows.
 *
 * @param text the line text
 * @param occurrence the occurrence, whose source path a host can open
 */
public record AgendaLine(String text, Occurrence occurrence) {}
