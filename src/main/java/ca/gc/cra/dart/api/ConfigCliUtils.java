package ca.gc.cra.dart.api;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Helpers shared by commands that accept a YAML {@code config=PATH} next to {@code key=value} arguments.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes {@code config} (or {@code --config}) from {@code args} and returns its path.
   *
   * @param args mutable CLI map
   * @return configured YAML path, if any
   * @throws IllegalArgumentException if the value is not a valid path
   */
  static Optional<Path> extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return Optional.empty();
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        try {
          return Optional.of(Path.of(value.trim()));
        } catch (InvalidPathException ex) {
          throw new IllegalArgumentException("config is not a valid path: " + value, ex);
        }
      }
    }
    return Optional.empty();
  }
}
