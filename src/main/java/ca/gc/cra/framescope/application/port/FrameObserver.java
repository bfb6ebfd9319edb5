package ca.gc.cra.framescope.application.port;

import ca.gc.cra.framescope.domain.frame.Frame;
import ca.gc.cra.framescope.domain.frame.FrameDirection;

/**
 * <strong>What:</strong> Notification surface the host pipeline calls once per frame.
 * <p><strong>Role:</strong> Port consumed by the host; implemented by {@code PipelineObserver}.</p>
 * <p><strong>Thread-safety:</strong> The host delivers frames one at a time; implementations must return quickly,
 * must not alter the frame, and must never throw back into the pipeline.</p>
 *
 * @since 0.1.0
 */
public interface FrameObserver {
  /**
   * Notifies the observer that a frame crossed a processor boundary.
   *
   * @param frame frame being delivered; never {@code null}
   * @param direction direction reported by the pipeline
   * @param observedAtMicros arrival timestamp in epoch microseconds
   */
  void onFrame(Frame frame, FrameDirection direction, long observedAtMicros);
}
