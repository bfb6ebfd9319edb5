package ca.gc.cra.framescope.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> String validation for CLI and configuration input.
 * <ul>
 *   <li>Reject blank or control-character values.</li>
 *   <li>Enforce printable ASCII for values forwarded to telemetry exporters.</li>
 * </ul>
 *
 * @implNote Control characters are detected with {@link Character#isISOControl(char)}.
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a value is non-null, non-blank, and free of control characters.
   *
   * @param name parameter name for diagnostics
   * @param value candidate text
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains control characters
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
   * Ensures a value contains only printable ASCII and fits the length budget.
   *
   * @param name parameter name for diagnostics
   * @param value candidate text
   * @param maxLength maximum length in characters
   * @return validated value
   * @throws IllegalArgumentException if the value is too long or has non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  /**
   * Reports whether a value contains ISO control characters.
   *
   * @param value text to scan
   * @return {@code true} when any character is a control character
   */
  public static boolean containsControl(CharSequence value) {
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
