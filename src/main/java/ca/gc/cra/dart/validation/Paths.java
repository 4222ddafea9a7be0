package ca.gc.cra.dart.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem checks for analyzer input directories and output files.
 * <p><strong>Why:</strong> A run should fail before any file is read when an input directory is missing or an
 * output would silently replace a previous report.</p>
 * <p><strong>Thread-safety:</strong> Stateless; the filesystem may still change between validation and use.</p>
 *
 * @since 0.1.0
 * @see Strings
 * @see Numbers
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates an input directory.
   *
   * @param name parameter name used in messages
   * @param path candidate directory
   * @return the absolute, normalized directory
   * @throws IllegalArgumentException if the path is missing, not a directory, or unreadable
   */
  public static Path requireReadableDir(String name, Path path) {
    Path normalized = normalize(name, path);
    if (!Files.exists(normalized)) {
      throw new IllegalArgumentException(name + " directory does not exist: " + normalized);
    }
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException(name + " is not a directory: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " directory is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates an output file target, optionally creating missing parent directories.
   *
   * @param name parameter name used in messages
   * @param path candidate file
   * @param allowOverwrite when {@code false}, an existing file is rejected
   * @param createParents when {@code false}, a missing parent is accepted and left uncreated (dry runs)
   * @return the absolute, normalized file path
   * @throws IllegalArgumentException if the target is a directory, exists without {@code allowOverwrite},
   *     or its parent cannot be created or written
   */
  public static Path validateOutputFile(String name, Path path, boolean allowOverwrite, boolean createParents) {
    Path normalized = normalize(name, path);
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException(name + " must be a file, not a directory: " + normalized);
    }
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
      if (!allowOverwrite) {
        throw new IllegalArgumentException(
            name + " " + normalized + " already exists; re-run with --allow-overwrite to replace it");
      }
      if (!Files.isWritable(normalized)) {
        throw new IllegalArgumentException(name + " is not writable: " + normalized);
      }
      return normalized;
    }
    Path parent = normalized.getParent();
    if (parent == null) {
      throw new IllegalArgumentException(name + " has no parent directory: " + normalized);
    }
    if (!createParents && !Files.exists(parent)) {
      return normalized;
    }
    try {
      Files.createDirectories(parent);
    } catch (IOException ex) {
      throw new IllegalArgumentException(
          "unable to create parent directory for " + name + " " + normalized + ": " + ex.getMessage(), ex);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException(name + " parent directory is not writable: " + parent);
    }
    return normalized;
  }

  private static Path normalize(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    String raw = path.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException(name + " must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }
}
