package ca.gc.cra.framescope.domain.decode;

import ca.gc.cra.framescope.domain.frame.FrameDirection;
import ca.gc.cra.framescope.domain.frame.FrameTypeKey;
import java.util.Objects;

/**
 * Decode result tagged with the originating frame's identity and arrival time.
 *
 * @param frameId originating frame id
 * @param typeKey originating frame type
 * @param direction direction the frame travelled
 * @param observedAtMicros arrival timestamp of the originating frame
 * @param log decode result
 * @since 0.1.0
 */
public record DecodedRecord(
    long frameId,
    FrameTypeKey typeKey,
    FrameDirection direction,
    long observedAtMicros,
    ProtobufMessageLog log) {

  public DecodedRecord {
    Objects.requireNonNull(typeKey, "typeKey");
    Objects.requireNonNull(direction, "direction");
    Objects.requireNonNull(log, "log");
  }
}
