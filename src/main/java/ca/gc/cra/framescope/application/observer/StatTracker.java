package ca.gc.cra.framescope.application.observer;

import ca.gc.cra.framescope.domain.decode.DecodedRecord;
import ca.gc.cra.framescope.domain.frame.FrameDirection;
import ca.gc.cra.framescope.domain.frame.FrameTypeKey;
import ca.gc.cra.framescope.domain.stats.LatencyStat;
import ca.gc.cra.framescope.domain.stats.PayloadTotals;
import ca.gc.cra.framescope.domain.stats.StatsSnapshot;
import ca.gc.cra.framescope.validation.Numbers;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <strong>What:</strong> Frame counters, per-type latency aggregates, and payload accounting.
 * <p><strong>Why:</strong> Two writers share this state: the synchronous notification path (counts, latency) and
 * background decode completions (payload bytes). Both must interleave safely.</p>
 * <p><strong>Thread-safety:</strong> One {@link ReentrantLock} guards every mutation and every snapshot, so a
 * reader never observes a partial update. Snapshots are deep copies.</p>
 * <p><strong>Generations:</strong> Background writers pass the generation they were scheduled under.
 * {@link #reset()} advances the generation, so completions from tasks scheduled before a reset are discarded
 * even when the task could not be cancelled in time. {@link #fence()} does the same without clearing.</p>
 * <p><strong>Performance:</strong> Every update is O(1); snapshots are O(tracked types + retained records).</p>
 *
 * @since 0.1.0
 */
public final class StatTracker {
  private final ReentrantLock lock = new ReentrantLock();
  private final int recentRecordLimit;

  private final Map<FrameTypeKey, Long> frameCounts = new HashMap<>();
  private final Map<FrameTypeKey, LatencyStat> latency = new HashMap<>();
  private final Map<FrameDirection, Long> messagesByDirection = new EnumMap<>(FrameDirection.class);
  private final Map<FrameDirection, Long> bytesByDirection = new EnumMap<>(FrameDirection.class);
  private final Map<FrameTypeKey, Long> bytesByType = new HashMap<>();
  private final ArrayDeque<DecodedRecord> recent = new ArrayDeque<>();
  private long totalBytes;
  private long undecodable;
  private long serializationFailures;
  private long timeouts;
  private long rejected;
  private long generation;

  /**
   * Creates a tracker.
   *
   * @param recentRecordLimit number of recent decode results retained; zero disables retention
   */
  public StatTracker(int recentRecordLimit) {
    this.recentRecordLimit = (int) Numbers.requireNonNegative("recentRecordLimit", recentRecordLimit);
  }

  /**
   * Returns the generation background tasks must carry to publish results.
   *
   * @return current generation
   */
  public long generation() {
    lock.lock();
    try {
      return generation;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Counts one frame of the given type.
   *
   * @param key frame type
   */
  public void recordSeen(FrameTypeKey key) {
    Objects.requireNonNull(key, "key");
    lock.lock();
    try {
      frameCounts.merge(key, 1L, Long::sum);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Adds a latency sample for the given type. Negative samples are clamped to zero.
   *
   * @param key frame type
   * @param elapsedMs milliseconds since the previous frame on the same channel
   */
  public void recordLatency(FrameTypeKey key, double elapsedMs) {
    Objects.requireNonNull(key, "key");
    lock.lock();
    try {
      latency.merge(key, LatencyStat.EMPTY.plus(elapsedMs), (current, ignored) -> current.plus(elapsedMs));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Adds serialized payload bytes to the running totals.
   *
   * @param scheduledGeneration generation the writing task was scheduled under
   * @param direction direction of the originating frame
   * @param key type of the originating frame
   * @param bytes payload size; must be {@code >= 0}
   * @return {@code true} when recorded, {@code false} when the generation is stale
   */
  public boolean recordPayloadBytes(long scheduledGeneration, FrameDirection direction, FrameTypeKey key, long bytes) {
    Numbers.requireNonNegative("bytes", bytes);
    lock.lock();
    try {
      if (scheduledGeneration != generation) {
        return false;
      }
      addBytes(direction, key, bytes);
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Records a completed decode: payload bytes, direction message count, undecodable tally, and the recent-record
   * ring, all in one critical section.
   *
   * @param scheduledGeneration generation the writing task was scheduled under
   * @param record decode result with its originating frame identity
   * @return {@code true} when recorded, {@code false} when the generation is stale
   */
  public boolean recordDecoded(long scheduledGeneration, DecodedRecord record) {
    Objects.requireNonNull(record, "record");
    lock.lock();
    try {
      if (scheduledGeneration != generation) {
        return false;
      }
      addBytes(record.direction(), record.typeKey(), record.log().byteSize());
      if (!record.log().decodable()) {
        undecodable++;
      }
      if (recentRecordLimit > 0) {
        if (recent.size() == recentRecordLimit) {
          recent.removeFirst();
        }
        recent.addLast(record);
      }
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Counts a serializer failure.
   *
   * @param scheduledGeneration generation the failing task was scheduled under
   * @return {@code true} when counted, {@code false} when the generation is stale
   */
  public boolean recordSerializationFailure(long scheduledGeneration) {
    lock.lock();
    try {
      if (scheduledGeneration != generation) {
        return false;
      }
      serializationFailures++;
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Counts a decode task cancelled by its timeout.
   *
   * @param scheduledGeneration generation the task was scheduled under
   * @return {@code true} when counted, {@code false} when the generation is stale
   */
  public boolean recordTimeout(long scheduledGeneration) {
    lock.lock();
    try {
      if (scheduledGeneration != generation) {
        return false;
      }
      timeouts++;
      return true;
    } finally {
      lock.unlock();
    }
  }

  /** Counts a decode task dropped because the worker queue was full. */
  public void recordRejected() {
    lock.lock();
    try {
      rejected++;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns an immutable copy of all tracked state.
   *
   * @return snapshot sharing no mutable state with the tracker
   */
  public StatsSnapshot snapshot() {
    lock.lock();
    try {
      PayloadTotals totals = new PayloadTotals(
          totalBytes,
          messagesByDirection,
          bytesByDirection,
          bytesByType,
          undecodable,
          serializationFailures,
          timeouts,
          rejected);
      return new StatsSnapshot(frameCounts, latency, totals, new ArrayList<>(recent));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Clears everything and advances the generation. Idempotent apart from the generation bump.
   *
   * @return the new generation
   */
  public long reset() {
    lock.lock();
    try {
      frameCounts.clear();
      latency.clear();
      messagesByDirection.clear();
      bytesByDirection.clear();
      bytesByType.clear();
      recent.clear();
      totalBytes = 0;
      undecodable = 0;
      serializationFailures = 0;
      timeouts = 0;
      rejected = 0;
      generation++;
      return generation;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Advances the generation without clearing, so tasks still in flight can no longer publish.
   *
   * @return the new generation
   */
  public long fence() {
    lock.lock();
    try {
      generation++;
      return generation;
    } finally {
      lock.unlock();
    }
  }

  private void addBytes(FrameDirection direction, FrameTypeKey key, long bytes) {
    totalBytes += bytes;
    messagesByDirection.merge(direction, 1L, Long::sum);
    bytesByDirection.merge(direction, bytes, Long::sum);
    bytesByType.merge(key, bytes, Long::sum);
  }
}
