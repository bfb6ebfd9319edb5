package ca.gc.cra.framescope.domain.frame;

import java.util.Locale;

/**
 * Direction a frame travels relative to the pipeline, as reported by the host pipeline.
 *
 * @since 0.1.0
 */
public enum FrameDirection {
  /** Toward the output stage (transport out, speaker). */
  DOWNSTREAM,
  /** Toward the input/capture stage. */
  UPSTREAM,
  /** Pipeline control metadata that is neither downstream nor upstream. */
  CONTROL;

  /**
   * Returns the lowercase label used in payload statistics and log output.
   *
   * @return label such as {@code downstream}
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a direction label, accepting the enum name in any case.
   *
   * @param raw label such as {@code downstream}; {@code null} or blank yields {@link #CONTROL}
   * @return parsed direction
   * @throws IllegalArgumentException if the label is not recognized
   */
  public static FrameDirection fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return CONTROL;
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    return switch (normalized) {
      case "DOWNSTREAM", "DOWN" -> DOWNSTREAM;
      case "UPSTREAM", "UP" -> UPSTREAM;
      case "CONTROL", "OTHER" -> CONTROL;
      default -> throw new IllegalArgumentException("Unknown frame direction: " + raw);
    };
  }
}
