package ca.gc.cra.framescope.config;

import ca.gc.cra.framescope.validation.Numbers;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable switches controlling what the pipeline observer captures.
 * <p><strong>Why:</strong> Gates expensive decode and log work before it is scheduled, so frames the operator does
 * not care about cost only a classification check and a counter increment.</p>
 * <p><strong>Role:</strong> Configuration record handed to {@code PipelineObserver} at construction; re-creating
 * the observer is the only way to change it.</p>
 * <p><strong>Thread-safety:</strong> Record is immutable; safe for concurrent reads.</p>
 *
 * @param enabled master switch; when {@code false} frames are counted but never captured
 * @param enableBinaryLogging serialize and decode captured frames on a background worker
 * @param enableAudioCapture include audio-bearing frames in capture
 * @param enableTextCapture include text, transcription, and LLM frames in capture
 * @param enableTimingMetrics maintain inter-frame latency statistics
 * @param truncateTextAt maximum characters of text shown before truncation; must be {@code >= 0}
 * @since 0.1.0
 */
public record ObservabilityConfig(
    boolean enabled,
    boolean enableBinaryLogging,
    boolean enableAudioCapture,
    boolean enableTextCapture,
    boolean enableTimingMetrics,
    int truncateTextAt) {

  /** Configuration key prefix used in YAML files. */
  public static final String SECTION = "observability";

  static final int DEFAULT_TRUNCATE_TEXT_AT = 80;
  static final int MAX_TRUNCATE_TEXT_AT = 1_000_000;

  /**
   * Rejects invalid truncation limits so an observer is never built in an invalid state.
   *
   * @throws IllegalArgumentException if {@code truncateTextAt} is negative
   */
  public ObservabilityConfig {
    if (truncateTextAt < 0) {
      throw new IllegalArgumentException("truncateTextAt must be >= 0 (was " + truncateTextAt + ")");
    }
  }

  /**
   * Returns the defaults: capture enabled, binary logging on, audio capture off, text capture on, timing on,
   * text truncated at 80 characters.
   *
   * @return default configuration
   */
  public static ObservabilityConfig defaults() {
    return new ObservabilityConfig(true, true, false, true, true, DEFAULT_TRUNCATE_TEXT_AT);
  }

  /**
   * Returns a configuration that counts frames but captures nothing.
   *
   * @return disabled configuration
   */
  public static ObservabilityConfig disabled() {
    return new ObservabilityConfig(false, false, false, false, false, DEFAULT_TRUNCATE_TEXT_AT);
  }

  /**
   * Builds a configuration from flat key/value pairs, falling back to {@link #defaults()} per key.
   * <p>Keys may be bare ({@code enableAudioCapture}) or section-qualified
   * ({@code observability.enableAudioCapture}); the qualified form wins.</p>
   *
   * @param values flattened configuration; must not be {@code null}
   * @return validated configuration
   * @throws IllegalArgumentException if a boolean is not {@code true}/{@code false} or a number is out of range
   */
  public static ObservabilityConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    ObservabilityConfig d = defaults();
    boolean enabled = parseBoolean(values, "enabled", d.enabled());
    boolean binary = parseBoolean(values, "enableBinaryLogging", d.enableBinaryLogging());
    boolean audio = parseBoolean(values, "enableAudioCapture", d.enableAudioCapture());
    boolean text = parseBoolean(values, "enableTextCapture", d.enableTextCapture());
    boolean timing = parseBoolean(values, "enableTimingMetrics", d.enableTimingMetrics());
    int truncate = parseInt(values, "truncateTextAt", d.truncateTextAt());
    return new ObservabilityConfig(enabled, binary, audio, text, timing, truncate);
  }

  /**
   * Returns a copy with a different truncation limit.
   *
   * @param limit new limit in characters
   * @return updated configuration
   */
  public ObservabilityConfig withTruncateTextAt(int limit) {
    return new ObservabilityConfig(
        enabled, enableBinaryLogging, enableAudioCapture, enableTextCapture, enableTimingMetrics, limit);
  }

  /**
   * Returns a copy with audio capture toggled.
   *
   * @param capture whether audio frames are captured
   * @return updated configuration
   */
  public ObservabilityConfig withAudioCapture(boolean capture) {
    return new ObservabilityConfig(
        enabled, enableBinaryLogging, capture, enableTextCapture, enableTimingMetrics, truncateTextAt);
  }

  /**
   * Returns a copy with binary logging toggled.
   *
   * @param binary whether captured frames are serialized and decoded
   * @return updated configuration
   */
  public ObservabilityConfig withBinaryLogging(boolean binary) {
    return new ObservabilityConfig(
        enabled, binary, enableAudioCapture, enableTextCapture, enableTimingMetrics, truncateTextAt);
  }

  /**
   * Returns a copy with text capture toggled.
   *
   * @param capture whether text frames are captured
   * @return updated configuration
   */
  public ObservabilityConfig withTextCapture(boolean capture) {
    return new ObservabilityConfig(
        enabled, enableBinaryLogging, enableAudioCapture, capture, enableTimingMetrics, truncateTextAt);
  }

  static String lookup(Map<String, String> values, String section, String key) {
    String qualified = values.get(section + '.' + key);
    if (qualified != null && !qualified.isBlank()) {
      return qualified.trim();
    }
    String bare = values.get(key);
    return bare == null || bare.isBlank() ? null : bare.trim();
  }

  private static boolean parseBoolean(Map<String, String> values, String key, boolean defaultValue) {
    String raw = lookup(values, SECTION, key);
    if (raw == null) {
      return defaultValue;
    }
    return switch (raw.toLowerCase(Locale.ROOT)) {
      case "true" -> true;
      case "false" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was '" + raw + "')");
    };
  }

  private static int parseInt(Map<String, String> values, String key, int defaultValue) {
    String raw = lookup(values, SECTION, key);
    if (raw == null) {
      return defaultValue;
    }
    try {
      return (int) Numbers.requireRange(key, Long.parseLong(raw), 0, MAX_TRUNCATE_TEXT_AT);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + raw + "')", ex);
    }
  }
}
