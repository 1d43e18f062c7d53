package io.daybook.source;

/**
 * A direct child of a calendar directory.
 *
 * @param name the file name
 * @param isFile true for regular files
 */
public record DirectoryEntry(String name, boolean isFile) {}
