package ca.gc.cra.framescope.domain.frame;

import java.util.Objects;

/**
 * Stable identifier for a frame's logical type, used to key counters and latency buckets.
 * <p>Two keys built from the same type name are equal in every observer of the process.</p>
 *
 * @param value frame type name (for example {@code TranscriptionFrame}); never blank
 * @since 0.1.0
 */
public record FrameTypeKey(String value) implements Comparable<FrameTypeKey> {
  /**
   * Validates the type name.
   *
   * @throws IllegalArgumentException if {@code value} is blank
   */
  public FrameTypeKey {
    Objects.requireNonNull(value, "value");
    if (value.isBlank()) {
      throw new IllegalArgumentException("frame type key must not be blank");
    }
  }

  /**
   * Builds the key for a frame.
   *
   * @param frame observed frame
   * @return key derived from the frame's type name
   */
  public static FrameTypeKey of(Frame frame) {
    return new FrameTypeKey(Objects.requireNonNull(frame, "frame").typeName());
  }

  /**
   * Builds the key for a type name.
   *
   * @param typeName frame type name
   * @return key wrapping {@code typeName}
   */
  public static FrameTypeKey of(String typeName) {
    return new FrameTypeKey(typeName);
  }

  @Override
  public int compareTo(FrameTypeKey other) {
    return value.compareTo(other.value);
  }

  @Override
  public String toString() {
    return value;
  }
}
