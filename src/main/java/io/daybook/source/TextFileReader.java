package io.daybook.source;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads the full text of a calendar file. */
@FunctionalInterface
public interface TextFileReader {

  /**
   * Reads a file.
   *
   * @param file the file
   * @return its content
   * @throws IOException if the file cannot be read or decoded
   */
  String read(Path file) throws IOException;

  /**
   * Returns a reader backed by the default file system.
   *
   * @param charset the charset to decode with
   * @return the reader
   */
  static TextFileReader fileSystem(Charset charset) {
    return file -> Files.readString(file, charset);
  }
}
