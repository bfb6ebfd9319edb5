package ca.gc.cra.framescope.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the observer's background executors.
 * <p>All threads are daemon threads so an observer that is never closed cannot keep the host JVM alive.</p>
 */
public final class ExecutorFactories {
  private static final String DEFAULT_DECODE_PREFIX = "framescope-decode";
  private static final String DEFAULT_WATCHDOG_PREFIX = "framescope-watchdog";

  private ExecutorFactories() {}

  /**
   * Builds a bounded decode pool. Submissions beyond {@code queueCapacity} pending tasks are rejected with
   * {@link java.util.concurrent.RejectedExecutionException} instead of blocking the caller.
   *
   * @param workers number of worker threads to allocate
   * @param queueCapacity maximum number of queued tasks
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor
   */
  public static ThreadPoolExecutor newDecodePool(
      int workers, int queueCapacity, String prefix, UncaughtExceptionHandler handler) {
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive");
    }
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be positive");
    }
    ThreadFactory factory = threadFactory(prefix, DEFAULT_DECODE_PREFIX, handler);
    return new ThreadPoolExecutor(
        workers,
        workers,
        0L,
        TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(queueCapacity),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds the single-threaded scheduler that enforces per-task decode timeouts.
   *
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler installed on the thread
   * @return scheduler whose cancelled timers are removed from its queue eagerly
   */
  public static ScheduledExecutorService newWatchdog(String prefix, UncaughtExceptionHandler handler) {
    ScheduledThreadPoolExecutor scheduler =
        new ScheduledThreadPoolExecutor(1, threadFactory(prefix, DEFAULT_WATCHDOG_PREFIX, handler));
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    return scheduler;
  }

  private static ThreadFactory threadFactory(String prefix, String fallback, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? fallback : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(true);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
