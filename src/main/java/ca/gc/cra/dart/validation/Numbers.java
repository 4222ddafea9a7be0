package ca.gc.cra.dart.validation;

/**
 * Inclusive range checks for numeric configuration values.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a value lies within {@code [min, max]}.
   *
   * @param name parameter name included in diagnostics; blank becomes {@code "value"}
   * @param value candidate value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value}
   * @throws IllegalArgumentException if {@code value} is out of range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a floating-point value is finite and lies within {@code [min, max]}.
   *
   * @param name parameter name included in diagnostics
   * @param value candidate value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value}
   * @throws IllegalArgumentException if {@code value} is NaN, infinite, or out of range
   */
  public static double requireRange(String name, double value, double min, double max) {
    if (!Double.isFinite(value) || value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
