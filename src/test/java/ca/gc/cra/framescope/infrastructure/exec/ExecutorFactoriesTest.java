package ca.gc.cra.framescope.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void decodePoolUsesNamedDaemonThreads() throws Exception {
    ThreadPoolExecutor pool = ExecutorFactories.newDecodePool(1, 1, "test-decode", null);
    AtomicReference<Thread> worker = new AtomicReference<>();
    CountDownLatch ran = new CountDownLatch(1);
    try {
      pool.execute(() -> {
        worker.set(Thread.currentThread());
        ran.countDown();
      });
      assertTrue(ran.await(5, TimeUnit.SECONDS));
      assertEquals("test-decode-0", worker.get().getName());
      assertTrue(worker.get().isDaemon());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void fullQueueRejectsInsteadOfBlocking() throws Exception {
    ThreadPoolExecutor pool = ExecutorFactories.newDecodePool(1, 1, "test-decode", null);
    CountDownLatch release = new CountDownLatch(1);
    try {
      pool.execute(() -> awaitQuietly(release));
      pool.execute(() -> { });
      assertThrows(RejectedExecutionException.class, () -> pool.execute(() -> { }));
    } finally {
      release.countDown();
      pool.shutdownNow();
    }
  }

  @Test
  void uncaughtFailuresReachHandler() throws Exception {
    CountDownLatch handled = new CountDownLatch(1);
    ThreadPoolExecutor pool = ExecutorFactories.newDecodePool(
        1, 4, "test-decode", (thread, ex) -> handled.countDown());
    try {
      pool.execute(() -> {
        throw new IllegalStateException("boom");
      });
      assertTrue(handled.await(5, TimeUnit.SECONDS));
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void watchdogDropsDelayedTasksOnShutdown() throws Exception {
    ScheduledExecutorService watchdog = ExecutorFactories.newWatchdog("", null);
    watchdog.schedule(() -> { }, 1, TimeUnit.HOURS);

    watchdog.shutdown();
    assertTrue(watchdog.awaitTermination(5, TimeUnit.SECONDS));
  }

  @Test
  void rejectsNonPositiveSizes() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newDecodePool(0, 1, "x", null));
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newDecodePool(1, 0, "x", null));
  }

  private static void awaitQuietly(CountDownLatch latch) {
    try {
      latch.await();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }
}
