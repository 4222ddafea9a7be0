package ca.gc.cra.dart.api;

import ca.gc.cra.dart.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} CLI arguments into a map.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9._-]*$");

  private CliArgsParser() {}

  /**
   * Splits each argument on its first {@code '='}.
   *
   * @param args raw arguments; {@code null} yields an empty map
   * @return mutable map in argument order
   * @throws IllegalArgumentException if an argument is not {@code key=value}, a key is malformed or repeated, or a
   *     value contains control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int idx = arg.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = arg.substring(idx + 1).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      if (map.containsKey(key)) {
        throw new IllegalArgumentException("argument " + key + " given more than once");
      }
      // key= is an explicit reset to the default
      if (!value.isEmpty()) {
        value = Strings.requireNonBlank(key, value);
      }
      map.put(key, value);
    }
    return map;
  }
}
