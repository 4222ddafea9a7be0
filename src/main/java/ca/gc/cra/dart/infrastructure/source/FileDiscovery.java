package ca.gc.cra.dart.infrastructure.source;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Lists the regular files of a directory that match a glob, ordered by file name.
 *
 * <p>Directory iteration order is filesystem dependent; sorting makes event application order, and therefore the
 * last-writer-wins deadline fields, reproducible across machines.</p>
 *
 * @since 0.1.0
 */
public final class FileDiscovery {

  private FileDiscovery() {}

  /**
   * Lists matching files (non-recursive).
   *
   * @param directory directory to scan; must exist
   * @param glob {@link java.nio.file.FileSystem#getPathMatcher glob} applied to file names, e.g. {@code *.log}
   * @return matching regular files sorted by name; empty when none match
   * @throws IOException if the directory cannot be listed
   */
  public static List<Path> discover(Path directory, String glob) throws IOException {
    Objects.requireNonNull(directory, "directory");
    Objects.requireNonNull(glob, "glob");
    List<Path> files = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, glob)) {
      for (Path entry : stream) {
        if (Files.isRegularFile(entry)) {
          files.add(entry);
        }
      }
    }
    files.sort(Comparator.comparing((Path p) -> p.getFileName().toString()));
    return files;
  }
}
