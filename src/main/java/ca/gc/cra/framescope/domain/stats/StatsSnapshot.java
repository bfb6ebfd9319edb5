package ca.gc.cra.framescope.domain.stats;

import ca.gc.cra.framescope.domain.decode.DecodedRecord;
import ca.gc.cra.framescope.domain.frame.FrameTypeKey;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable point-in-time copy of everything the observer tracks.
 *
 * @param frameCounts frames seen per type
 * @param latencyStats latency aggregates per type (types with at least one sample)
 * @param payloadTotals serialized payload accounting
 * @param recentDecodes most recent decode results, oldest first
 * @since 0.1.0
 */
public record StatsSnapshot(
    Map<FrameTypeKey, Long> frameCounts,
    Map<FrameTypeKey, LatencyStat> latencyStats,
    PayloadTotals payloadTotals,
    List<DecodedRecord> recentDecodes) {

  /** Snapshot of a freshly reset tracker. */
  public static final StatsSnapshot EMPTY =
      new StatsSnapshot(Map.of(), Map.of(), PayloadTotals.EMPTY, List.of());

  /** Takes sorted, unmodifiable copies of all collections. */
  public StatsSnapshot {
    frameCounts = frameCounts == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(frameCounts));
    latencyStats = latencyStats == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(latencyStats));
    payloadTotals = payloadTotals == null ? PayloadTotals.EMPTY : payloadTotals;
    recentDecodes = recentDecodes == null ? List.of() : List.copyOf(recentDecodes);
  }

  /**
   * Returns the count for a frame type.
   *
   * @param key frame type
   * @return frames seen, zero when the type never appeared
   */
  public long countOf(FrameTypeKey key) {
    return frameCounts.getOrDefault(key, 0L);
  }

  /**
   * Returns the total number of frames seen across all types.
   *
   * @return sum of all counters
   */
  public long totalFrames() {
    long total = 0;
    for (long count : frameCounts.values()) {
      total += count;
    }
    return total;
  }
}
