package ca.gc.cra.framescope.domain.stats;

/**
 * Aggregate of inter-frame latency samples for one frame type.
 * <p>The average is derived from {@code sumMs / count} and never stored. Once {@code count >= 1},
 * {@code minMs <= avgMs() <= maxMs}; with {@code count == 0} every field is zero.</p>
 *
 * @param count number of samples
 * @param minMs smallest sample in milliseconds
 * @param maxMs largest sample in milliseconds
 * @param sumMs running sum of samples in milliseconds
 * @since 0.1.0
 */
public record LatencyStat(long count, double minMs, double maxMs, double sumMs) {

  /** Aggregate with no samples. */
  public static final LatencyStat EMPTY = new LatencyStat(0, 0d, 0d, 0d);

  /**
   * Validates sample bookkeeping.
   *
   * @throws IllegalArgumentException if {@code count} is negative or bounds are inverted
   */
  public LatencyStat {
    if (count < 0) {
      throw new IllegalArgumentException("count must be >= 0");
    }
    if (count > 0 && minMs > maxMs) {
      throw new IllegalArgumentException("minMs must be <= maxMs");
    }
  }

  /**
   * Returns a new aggregate including {@code sampleMs}. Negative or NaN samples count as zero.
   *
   * @param sampleMs elapsed milliseconds
   * @return updated aggregate
   */
  public LatencyStat plus(double sampleMs) {
    double sample = Double.isNaN(sampleMs) || sampleMs < 0d ? 0d : sampleMs;
    if (count == 0) {
      return new LatencyStat(1, sample, sample, sample);
    }
    return new LatencyStat(count + 1, Math.min(minMs, sample), Math.max(maxMs, sample), sumMs + sample);
  }

  /**
   * Returns the mean sample, clamped into {@code [minMs, maxMs]} to absorb floating-point rounding.
   *
   * @return average latency in milliseconds; zero when empty
   */
  public double avgMs() {
    if (count == 0) {
      return 0d;
    }
    double avg = sumMs / count;
    return Math.min(maxMs, Math.max(minMs, avg));
  }
}
