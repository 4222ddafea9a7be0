package ca.gc.cra.dart.validation;

import java.nio.file.FileSystems;
import java.util.Objects;
import java.util.regex.PatternSyntaxException;

/**
 * <strong>What:</strong> String validation for CLI and YAML values.
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Failures raise {@link IllegalArgumentException} with the parameter name.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a value is non-null, non-blank, and free of control characters.
   *
   * @param name parameter name used in messages; {@code null} becomes {@code "value"}
   * @param value candidate text
   * @return the trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a file-name glob such as {@code *.qlog}.
   *
   * @param name parameter name used in messages
   * @param glob candidate glob
   * @return the trimmed glob
   * @throws IllegalArgumentException if the glob is blank, contains a path separator, or does not compile
   */
  public static String requireGlob(String name, String glob) {
    String trimmed = requireNonBlank(name, glob);
    if (trimmed.indexOf('/') >= 0 || trimmed.indexOf('\\') >= 0) {
      throw new IllegalArgumentException(message(name, "must match file names only (no path separators)"));
    }
    try {
      FileSystems.getDefault().getPathMatcher("glob:" + trimmed);
    } catch (PatternSyntaxException ex) {
      throw new IllegalArgumentException(message(name, "is not a valid glob: " + ex.getDescription()), ex);
    }
    return trimmed;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
