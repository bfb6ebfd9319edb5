package ca.gc.cra.framescope.infrastructure.replay;

import ca.gc.cra.framescope.domain.frame.Frame;
import ca.gc.cra.framescope.domain.frame.FrameDirection;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * One frame read back from a recorded frame log.
 *
 * @param frame reconstructed frame
 * @param direction direction it travelled
 * @param observedAtMicros recorded observation time, empty when the log did not carry one
 * @param lineNumber 1-based line in the source file
 */
public record RecordedFrame(Frame frame, FrameDirection direction, OptionalLong observedAtMicros, long lineNumber) {
  public RecordedFrame {
    Objects.requireNonNull(frame, "frame");
    Objects.requireNonNull(direction, "direction");
    observedAtMicros = observedAtMicros == null ? OptionalLong.empty() : observedAtMicros;
  }
}
