package ca.gc.cra.framescope.application.observer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.framescope.domain.decode.DecodedRecord;
import ca.gc.cra.framescope.domain.decode.ProtobufMessageLog;
import ca.gc.cra.framescope.domain.frame.FrameDirection;
import ca.gc.cra.framescope.domain.frame.FrameTypeKey;
import ca.gc.cra.framescope.domain.stats.LatencyStat;
import ca.gc.cra.framescope.domain.stats.StatsSnapshot;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class StatTrackerTest {
  private static final FrameTypeKey STT = FrameTypeKey.of("TranscriptionFrame");
  private static final FrameTypeKey AUDIO = FrameTypeKey.of("InputAudioRawFrame");

  @Test
  void countsAndLatencyAccumulatePerType() {
    StatTracker tracker = new StatTracker(4);
    tracker.recordSeen(STT);
    tracker.recordSeen(STT);
    tracker.recordSeen(AUDIO);
    tracker.recordLatency(STT, 50d);
    tracker.recordLatency(STT, 70d);

    StatsSnapshot snapshot = tracker.snapshot();
    assertEquals(2L, snapshot.countOf(STT));
    assertEquals(1L, snapshot.countOf(AUDIO));
    assertEquals(3L, snapshot.totalFrames());
    LatencyStat stat = snapshot.latencyStats().get(STT);
    assertEquals(2L, stat.count());
    assertEquals(50d, stat.minMs());
    assertEquals(70d, stat.maxMs());
    assertEquals(60d, stat.avgMs(), 1e-9);
  }

  @Test
  void negativeLatencyIsClampedToZero() {
    StatTracker tracker = new StatTracker(0);
    tracker.recordLatency(STT, -5d);
    tracker.recordLatency(STT, Double.NaN);

    LatencyStat stat = tracker.snapshot().latencyStats().get(STT);
    assertEquals(2L, stat.count());
    assertEquals(0d, stat.minMs());
    assertEquals(0d, stat.maxMs());
  }

  @Test
  void decodedRecordsUpdateDirectionTotals() {
    StatTracker tracker = new StatTracker(8);
    long generation = tracker.generation();
    assertTrue(tracker.recordDecoded(generation, record(1, FrameDirection.DOWNSTREAM, 40, true)));
    assertTrue(tracker.recordDecoded(generation, record(2, FrameDirection.UPSTREAM, 10, false)));
    assertTrue(tracker.recordPayloadBytes(generation, FrameDirection.DOWNSTREAM, STT, 5));

    var totals = tracker.snapshot().payloadTotals();
    assertEquals(55L, totals.totalBytes());
    assertEquals(2L, totals.downstreamCount());
    assertEquals(45L, totals.downstreamBytes());
    assertEquals(1L, totals.upstreamCount());
    assertEquals(10L, totals.upstreamBytes());
    assertEquals(3L, totals.totalMessages());
    assertEquals(1L, totals.undecodable());
    assertEquals(Map.of(STT, 55L), totals.bytesByType());
  }

  @Test
  void staleGenerationIsDiscarded() {
    StatTracker tracker = new StatTracker(8);
    long before = tracker.generation();
    tracker.recordSeen(STT);
    long after = tracker.reset();

    assertTrue(after > before);
    assertFalse(tracker.recordDecoded(before, record(1, FrameDirection.DOWNSTREAM, 40, true)));
    assertFalse(tracker.recordPayloadBytes(before, FrameDirection.DOWNSTREAM, STT, 40));
    assertFalse(tracker.recordSerializationFailure(before));
    assertFalse(tracker.recordTimeout(before));

    StatsSnapshot snapshot = tracker.snapshot();
    assertTrue(snapshot.frameCounts().isEmpty());
    assertEquals(0L, snapshot.payloadTotals().totalBytes());
    assertEquals(0L, snapshot.payloadTotals().serializationFailures());
    assertEquals(0L, snapshot.payloadTotals().timeouts());
    assertTrue(snapshot.recentDecodes().isEmpty());
  }

  @Test
  void resetTwiceLeavesEverythingEmpty() {
    StatTracker tracker = new StatTracker(8);
    tracker.recordSeen(STT);
    tracker.recordLatency(STT, 10d);
    tracker.recordRejected();
    tracker.recordDecoded(tracker.generation(), record(1, FrameDirection.DOWNSTREAM, 12, true));

    tracker.reset();
    tracker.reset();

    StatsSnapshot snapshot = tracker.snapshot();
    assertTrue(snapshot.frameCounts().isEmpty());
    assertTrue(snapshot.latencyStats().isEmpty());
    assertEquals(0L, snapshot.payloadTotals().totalMessages());
    assertEquals(0L, snapshot.payloadTotals().rejected());
    assertTrue(snapshot.recentDecodes().isEmpty());
  }

  @Test
  void fenceKeepsStatisticsButRejectsEarlierGenerations() {
    StatTracker tracker = new StatTracker(8);
    long before = tracker.generation();
    tracker.recordSeen(STT);
    tracker.recordDecoded(before, record(1, FrameDirection.DOWNSTREAM, 12, true));

    long after = tracker.fence();

    assertTrue(after > before);
    assertFalse(tracker.recordDecoded(before, record(2, FrameDirection.DOWNSTREAM, 5, true)));
    assertFalse(tracker.recordTimeout(before));
    StatsSnapshot snapshot = tracker.snapshot();
    assertEquals(1L, snapshot.countOf(STT));
    assertEquals(1L, snapshot.payloadTotals().totalMessages());
    assertEquals(12L, snapshot.payloadTotals().totalBytes());
    assertEquals(0L, snapshot.payloadTotals().timeouts());
  }

  @Test
  void recentDecodesKeepOnlyTheNewest() {
    StatTracker tracker = new StatTracker(2);
    long generation = tracker.generation();
    for (int id = 1; id <= 3; id++) {
      tracker.recordDecoded(generation, record(id, FrameDirection.DOWNSTREAM, 1, true));
    }

    List<DecodedRecord> recent = tracker.snapshot().recentDecodes();
    assertEquals(2, recent.size());
    assertEquals(2L, recent.get(0).frameId());
    assertEquals(3L, recent.get(1).frameId());
  }

  @Test
  void snapshotIsNotAffectedByLaterUpdates() {
    StatTracker tracker = new StatTracker(2);
    tracker.recordSeen(STT);
    StatsSnapshot first = tracker.snapshot();
    tracker.recordSeen(STT);

    assertEquals(1L, first.countOf(STT));
    assertEquals(2L, tracker.snapshot().countOf(STT));
    assertThrows(UnsupportedOperationException.class, () -> first.frameCounts().put(AUDIO, 1L));
  }

  @Test
  void concurrentWritersNeverLoseUpdates() throws InterruptedException {
    StatTracker tracker = new StatTracker(16);
    int threads = 4;
    int perThread = 1_000;
    CountDownLatch start = new CountDownLatch(1);
    List<Thread> workers = new ArrayList<>();
    for (int t = 0; t < threads; t++) {
      Thread worker = new Thread(() -> {
        try {
          start.await();
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          return;
        }
        long generation = tracker.generation();
        for (int i = 0; i < perThread; i++) {
          tracker.recordSeen(STT);
          tracker.recordLatency(STT, i % 10);
          tracker.recordPayloadBytes(generation, FrameDirection.DOWNSTREAM, STT, 2);
        }
      });
      workers.add(worker);
      worker.start();
    }
    start.countDown();
    for (Thread worker : workers) {
      worker.join(TimeUnit.SECONDS.toMillis(10));
    }

    StatsSnapshot snapshot = tracker.snapshot();
    assertEquals((long) threads * perThread, snapshot.countOf(STT));
    assertEquals((long) threads * perThread, snapshot.latencyStats().get(STT).count());
    assertEquals(2L * threads * perThread, snapshot.payloadTotals().totalBytes());
  }

  @Test
  void rejectsNegativeRetention() {
    assertThrows(IllegalArgumentException.class, () -> new StatTracker(-1));
  }

  private static DecodedRecord record(long id, FrameDirection direction, int bytes, boolean decodable) {
    ProtobufMessageLog log = decodable
        ? ProtobufMessageLog.decoded("TranscriptionFrame", Map.of("text", "hi"), bytes)
        : ProtobufMessageLog.undecodable("TranscriptionFrame", bytes);
    return new DecodedRecord(id, STT, direction, id * 1_000L, log);
  }
}
