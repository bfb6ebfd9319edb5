package ca.gc.cra.framescope.logging;

/**
 * <strong>What:</strong> Logging hygiene helpers that keep frame content readable and bounded.
 * <p><strong>Why:</strong> Transcripts and LLM output can be arbitrarily long; log lines must stay one screen wide
 * without splitting multi-byte characters.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Limits are counted in Unicode code points, so surrogate pairs are never cut in half.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  /** Marker appended to truncated text. */
  public static final String ELLIPSIS = "...";

  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates text to {@code maxChars} code points, appending {@link #ELLIPSIS} when anything was removed.
   *
   * @param value text to truncate; {@code null} yields {@code "<null>"}
   * @param maxChars maximum code points retained; must be {@code >= 0}
   * @return original text when within the limit, otherwise the prefix followed by {@code ...}
   * @throws IllegalArgumentException if {@code maxChars} is negative
   */
  public static String truncate(String value, int maxChars) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxChars < 0) {
      throw new IllegalArgumentException("maxChars must be >= 0");
    }
    int codePoints = value.codePointCount(0, value.length());
    if (codePoints <= maxChars) {
      return value;
    }
    int end = value.offsetByCodePoints(0, maxChars);
    return value.substring(0, end) + ELLIPSIS;
  }
}
