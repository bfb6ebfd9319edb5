package ca.gc.cra.framescope.validation;

/**
 * <strong>What:</strong> Numeric validation helpers for configuration parsing.
 * <p><strong>Why:</strong> Rejects out-of-range worker counts, queue sizes, timeouts, and truncation limits before
 * the observer allocates threads or queues.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a value falls within an inclusive range.
   *
   * @param name parameter name used in the error message; {@code "value"} when blank
   * @param value candidate value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value} for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a value is zero or positive.
   *
   * @param name parameter name used in the error message
   * @param value candidate value
   * @return {@code value}
   * @throws IllegalArgumentException if {@code value} is negative
   */
  public static long requireNonNegative(String name, long value) {
    if (value < 0) {
      throw new IllegalArgumentException(label(name) + " must be >= 0 (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
