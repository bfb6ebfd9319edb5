package ca.gc.cra.framescope.application.port;

import ca.gc.cra.framescope.domain.frame.Frame;
import java.io.IOException;

/**
 * <strong>What:</strong> Host-supplied function that turns a frame into its wire representation.
 * <p><strong>Why:</strong> The observer decodes exactly the bytes the pipeline would put on the wire, without knowing
 * how they are produced.</p>
 * <p><strong>Role:</strong> External collaborator treated as a black box; it may be slow, so the observer only invokes
 * it from background decode tasks.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent calls from several decode workers.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface FrameSerializer {
  /**
   * Serializes a frame.
   *
   * @param frame frame to serialize; never {@code null}
   * @return serialized bytes; an empty array when the frame has no wire form
   * @throws IOException when serialization fails
   */
  byte[] serialize(Frame frame) throws IOException;

  /** Serializer for hosts that never attach a wire form; every frame yields an empty payload. */
  FrameSerializer NONE = frame -> new byte[0];
}
