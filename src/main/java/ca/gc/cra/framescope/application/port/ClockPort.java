package ca.gc.cra.framescope.application.port;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps for frames the host delivers without one.
 * <p><strong>Why:</strong> Keeps latency computations deterministic under test by allowing a fake clock.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 * <p><strong>Performance:</strong> Expected to be constant-time; it is read on the notification path.</p>
 *
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in microseconds.
   *
   * @return microseconds since 1970-01-01T00:00:00Z; subject to system clock adjustments
   */
  long nowMicros();

  /** Default clock backed by {@link Instant#now()}. */
  ClockPort SYSTEM = () -> ChronoUnit.MICROS.between(Instant.EPOCH, Instant.now());
}
