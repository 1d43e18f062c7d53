package io.daybook.source;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Lists the direct children of a directory. */
@FunctionalInterface
public interface DirectoryLister {

  /**
   * Lists a directory.
   *
   * @param directory the directory
   * @return the children
   * @throws IOException if the directory is missing or cannot be read
   */
  List<DirectoryEntry> list(Path directory) throws IOException;

  /**
   * Returns a lister backed by the default file system, ordered by name.
   *
   * @return the lister
   */
  static DirectoryLister fileSystem() {
    return directory -> {
      try (Stream<Path> children = Files.list(directory)) {
        return children
            .sorted()
            .map(p -> new DirectoryEntry(p.getFileName().toString(), Files.isRegularFile(p)))
            .collect(Collectors.toList());
      }
    };
  }
}
