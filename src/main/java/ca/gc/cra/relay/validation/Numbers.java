package ca.gc.cra.relay.validation;

/**
 * Numeric range checks for configuration values.
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a value falls within an inclusive range.
   *
   * @param name parameter name used in diagnostics
   * @param value candidate value
   * @param min inclusive minimum
   * @param max inclusive maximum
   * @return {@code value}
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a floating point value is finite and at least {@code min}.
   *
   * @param name parameter name used in diagnostics
   * @param value candidate value
   * @param min inclusive minimum
   * @return {@code value}
   */
  public static double requireAtLeast(String name, double value, double min) {
    if (!Double.isFinite(value) || value < min) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be a finite number >= " + min + " (was " + value + ")");
    }
    return value;
  }
}
