package ca.gc.cra.framescope.application.observer;

import ca.gc.cra.framescope.domain.frame.FrameDirection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Remembers the previous observation time per direction channel and the start of the session.
 * <p>Thread-safe. Every call advances the channel reference, whether or not the caller records the sample.</p>
 */
final class ChannelClock {
  private final Map<FrameDirection, Long> lastSeenMicros = new EnumMap<>(FrameDirection.class);
  private long sessionStartMicros;
  private boolean started;

  /**
   * Stamps a frame on its channel.
   *
   * @param direction channel the frame travels on
   * @param observedAtMicros observation time in microseconds
   * @return session-relative time and the gap to the previous frame on the same channel
   */
  synchronized Tick advance(FrameDirection direction, long observedAtMicros) {
    Objects.requireNonNull(direction, "direction");
    if (!started) {
      sessionStartMicros = observedAtMicros;
      started = true;
    }
    Long previous = lastSeenMicros.put(direction, observedAtMicros);
    OptionalDouble sinceLastMs = previous == null
        ? OptionalDouble.empty()
        : OptionalDouble.of((observedAtMicros - previous) / 1_000d);
    return new Tick((observedAtMicros - sessionStartMicros) / 1_000_000d, sinceLastMs);
  }

  synchronized void reset() {
    lastSeenMicros.clear();
    started = false;
    sessionStartMicros = 0L;
  }

  record Tick(double sessionSeconds, OptionalDouble sinceLastMs) {}
}
