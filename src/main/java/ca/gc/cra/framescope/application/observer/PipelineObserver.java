package ca.gc.cra.framescope.application.observer;

import ca.gc.cra.framescope.application.json.JsonSupport;
import ca.gc.cra.framescope.application.port.ClockPort;
import ca.gc.cra.framescope.application.port.FrameObserver;
import ca.gc.cra.framescope.application.port.FrameSerializer;
import ca.gc.cra.framescope.application.port.MetricsPort;
import ca.gc.cra.framescope.application.port.PayloadDecoder;
import ca.gc.cra.framescope.config.DecodeSettings;
import ca.gc.cra.framescope.config.ObservabilityConfig;
import ca.gc.cra.framescope.domain.decode.DecodedRecord;
import ca.gc.cra.framescope.domain.decode.ProtobufMessageLog;
import ca.gc.cra.framescope.domain.frame.Frame;
import ca.gc.cra.framescope.domain.frame.FrameCategory;
import ca.gc.cra.framescope.domain.frame.FrameDirection;
import ca.gc.cra.framescope.domain.frame.FrameTypeKey;
import ca.gc.cra.framescope.domain.stats.LatencyStat;
import ca.gc.cra.framescope.domain.stats.StatsSnapshot;
import ca.gc.cra.framescope.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.framescope.logging.LoggingConfigurator;
import ca.gc.cra.framescope.validation.Strings;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Observes every frame a pipeline delivers, keeps per-type counts and inter-frame latency,
 * and decodes serialized payloads in the background.
 * <p><strong>Why:</strong> Diagnosing a live voice pipeline needs a frame-by-frame view without slowing the
 * pipeline down; the delivery thread only pays for classification and two O(1) stat updates.</p>
 * <p><strong>Role:</strong> Application service implementing {@link FrameObserver}; orchestrates
 * {@link FrameClassifier}, {@link StatTracker}, {@link FrameSerializer} and {@link PayloadDecoder}.</p>
 * <p><strong>Lifecycle:</strong> {@link ObserverState#IDLE} to {@link ObserverState#ACTIVE} on {@link #attach()} or
 * the first frame; {@link #reset()} passes through {@link ObserverState#DRAINING} and ends idle;
 * {@link #close()} stops background work for good, after which frames are still counted.</p>
 * <p><strong>Concurrency:</strong> {@link #onFrame} may be called from several pipeline threads. Background work
 * runs on a bounded pool; when the queue is full the task is dropped and counted rather than blocking the caller.
 * A watchdog cancels tasks that outlive {@link DecodeSettings#taskTimeout()}. Results of tasks scheduled before
 * a reset are discarded through the tracker's generation fence.</p>
 * <p><strong>Logging:</strong> Frame lines at DEBUG and decode detail at TRACE on
 * {@value LoggingConfigurator#FRAME_LOGGER}; summaries at INFO. Worker threads carry the observer name in the
 * {@code observer} MDC key.</p>
 * <p><strong>Metrics:</strong> Keys listed in {@link ObserverMetrics}.</p>
 *
 * @since 0.1.0
 */
public final class PipelineObserver implements FrameObserver, AutoCloseable {
  /** MDC key carrying the observer name on worker threads. */
  public static final String MDC_OBSERVER = "observer";

  private static final Logger log = LoggerFactory.getLogger(PipelineObserver.class);
  private static final Logger frameLog = LoggerFactory.getLogger(LoggingConfigurator.FRAME_LOGGER);

  private final String name;
  private final ObservabilityConfig config;
  private final DecodeSettings settings;
  private final FrameSerializer serializer;
  private final PayloadDecoder decoder;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final FrameClassifier classifier = new FrameClassifier();
  private final FrameLogFormatter formatter;
  private final StatTracker tracker;
  private final ChannelClock channels = new ChannelClock();

  private final Object lifecycleLock = new Object();
  private final AtomicReference<ObserverState> state = new AtomicReference<>(ObserverState.IDLE);
  private final ScheduledExecutorService watchdog;
  private volatile ThreadPoolExecutor pool;
  private volatile boolean closed;

  /**
   * Creates an observer. Background threads start on the first scheduled task.
   *
   * @param name observer name used in thread names, logs and the MDC
   * @param config capture switches
   * @param settings decode pool sizing and timeouts
   * @param serializer produces the wire form of frames that do not carry one
   * @param decoder decodes wire forms for logging and payload statistics
   * @param metrics operational metrics sink
   * @param clock timestamp source for {@link #onFrame(Frame, FrameDirection)}
   */
  public PipelineObserver(
      String name,
      ObservabilityConfig config,
      DecodeSettings settings,
      FrameSerializer serializer,
      PayloadDecoder decoder,
      MetricsPort metrics,
      ClockPort clock) {
    this.name = Strings.requireNonBlank("name", name);
    this.config = Objects.requireNonNull(config, "config");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.serializer = Objects.requireNonNull(serializer, "serializer");
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.formatter = new FrameLogFormatter(config.truncateTextAt(), new JsonSupport());
    this.tracker = new StatTracker(settings.recentRecordLimit());
    this.watchdog = ExecutorFactories.newWatchdog(name + "-watchdog", this::onUncaught);
    this.pool = newPool();
  }

  /**
   * Marks the observer active. No effect unless idle and open.
   *
   * @return {@code true} when this call moved the observer from idle to active
   */
  public boolean attach() {
    if (closed) {
      return false;
    }
    boolean attached = state.compareAndSet(ObserverState.IDLE, ObserverState.ACTIVE);
    if (attached) {
      log.debug("Observer {} attached", name);
    }
    return attached;
  }

  /**
   * Observes a frame stamped with the configured clock.
   *
   * @param frame delivered frame
   * @param direction direction of travel; {@code null} is treated as control
   */
  public void onFrame(Frame frame, FrameDirection direction) {
    onFrame(frame, direction, clock.nowMicros());
  }

  @Override
  public void onFrame(Frame frame, FrameDirection direction, long observedAtMicros) {
    Objects.requireNonNull(frame, "frame");
    FrameDirection channel = direction == null ? FrameDirection.CONTROL : direction;
    try {
      if (state.get() == ObserverState.IDLE) {
        attach();
      }
      long generation = tracker.generation();
      FrameTypeKey key = FrameTypeKey.of(frame);
      FrameCategory category = classifier.classify(frame);
      tracker.recordSeen(key);
      metrics.increment(ObserverMetrics.FRAMES_SEEN);

      ChannelClock.Tick tick = channels.advance(channel, observedAtMicros);
      boolean timing = config.enabled() && config.enableTimingMetrics();
      OptionalDouble latencyMs = timing ? tick.sinceLastMs() : OptionalDouble.empty();
      if (latencyMs.isPresent()) {
        tracker.recordLatency(key, latencyMs.getAsDouble());
      }

      if (!classifier.isCapturable(category, config) || state.get() != ObserverState.ACTIVE) {
        return;
      }
      schedule(new Capture(
          frame, key, category, channel, observedAtMicros, tick.sessionSeconds(), latencyMs, generation));
    } catch (RuntimeException ex) {
      metrics.increment(ObserverMetrics.NOTIFY_FAILED);
      log.warn("Observer {} failed to process frame {} ({})", name, frame.id(), frame.typeName(), ex);
    }
  }

  /**
   * Returns frame counts keyed by type name, in type-name order.
   *
   * @return immutable copy
   */
  public Map<String, Long> getFrameCounts() {
    Map<String, Long> counts = new LinkedHashMap<>();
    tracker.snapshot().frameCounts().forEach((key, count) -> counts.put(key.value(), count));
    return Map.copyOf(counts);
  }

  /**
   * Returns latency aggregates keyed by type name. Types seen only once per channel have no entry.
   *
   * @return immutable copy
   */
  public Map<String, LatencyStat> getLatencyStats() {
    Map<String, LatencyStat> stats = new LinkedHashMap<>();
    tracker.snapshot().latencyStats().forEach((key, stat) -> stats.put(key.value(), stat));
    return Map.copyOf(stats);
  }

  /**
   * Returns a consistent snapshot of counts, latency, payload totals and recent decodes.
   *
   * @return immutable snapshot
   */
  public StatsSnapshot getSummary() {
    return tracker.snapshot();
  }

  /** Logs the session summary at INFO. */
  public void printSummary() {
    List<String> lines = FrameLogFormatter.summaryLines(getSummary());
    for (String line : lines) {
      log.info(line);
    }
  }

  /**
   * Returns the lifecycle state.
   *
   * @return current state
   */
  public ObserverState state() {
    return state.get();
  }

  /**
   * Returns the observer name.
   *
   * @return name given at construction
   */
  public String name() {
    return name;
  }

  /**
   * Clears all statistics, cancels pending background work and leaves the observer idle. Work that does not stop
   * within the drain timeout is abandoned; its results are discarded. Safe to call repeatedly. Never throws.
   */
  public void reset() {
    synchronized (lifecycleLock) {
      state.set(ObserverState.DRAINING);
      try {
        tracker.reset();
        channels.reset();
        if (!closed) {
          ThreadPoolExecutor previous = pool;
          pool = newPool();
          cancelAndDrain(previous);
        }
        metrics.increment(ObserverMetrics.RESET);
        log.debug("Observer {} reset", name);
      } catch (RuntimeException ex) {
        log.warn("Observer {} reset did not complete cleanly", name, ex);
      } finally {
        state.set(ObserverState.IDLE);
      }
    }
  }

  /**
   * Stops background work. Queued tasks get up to the drain timeout to finish before they are cancelled.
   * Statistics are kept so the summary can still be read. Tasks still running after that are abandoned and can no
   * longer change the statistics once this method returns. Idempotent.
   */
  @Override
  public void close() {
    synchronized (lifecycleLock) {
      if (closed) {
        return;
      }
      closed = true;
      state.set(ObserverState.DRAINING);
      try {
        ThreadPoolExecutor previous = pool;
        pool = null;
        if (previous != null) {
          finishAndDrain(previous);
        }
        tracker.fence();
        watchdog.shutdownNow();
        log.debug("Observer {} closed", name);
      } finally {
        state.set(ObserverState.IDLE);
      }
    }
  }

  private ThreadPoolExecutor newPool() {
    return ExecutorFactories.newDecodePool(
        settings.workers(), settings.queueCapacity(), "framescope-decode", this::onUncaught);
  }

  private void schedule(Capture capture) {
    ThreadPoolExecutor executor = pool;
    if (executor == null) {
      return;
    }
    CaptureTask task = new CaptureTask(capture, System.nanoTime());
    try {
      executor.execute(task);
    } catch (RejectedExecutionException ex) {
      tracker.recordRejected();
      metrics.increment(ObserverMetrics.DECODE_REJECTED);
      log.debug("Observer {} dropped capture of frame {}: decode queue full or shutting down",
          name, capture.frame().id());
      return;
    }
    metrics.increment(ObserverMetrics.DECODE_SCHEDULED);
    try {
      task.armTimer(watchdog.schedule(
          () -> expire(task, executor), settings.taskTimeout().toNanos(), TimeUnit.NANOSECONDS));
    } catch (RejectedExecutionException ex) {
      log.debug("Observer {} watchdog stopped; frame {} runs without timeout", name, capture.frame().id());
    }
  }

  private void expire(CaptureTask task, ThreadPoolExecutor executor) {
    if (!task.timeOut()) {
      return;
    }
    executor.remove(task);
    if (tracker.recordTimeout(task.generation())) {
      metrics.increment(ObserverMetrics.DECODE_TIMEOUT);
      log.debug("Observer {} cancelled capture of frame {} after {} ms",
          name, task.capture().frame().id(), settings.taskTimeout().toMillis());
    }
  }

  private void cancelAndDrain(ThreadPoolExecutor executor) {
    for (Runnable pending : executor.shutdownNow()) {
      if (pending instanceof CaptureTask task) {
        task.abandon();
      }
    }
    awaitDrain(executor);
  }

  private void finishAndDrain(ThreadPoolExecutor executor) {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(settings.drainTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
        cancelAndDrain(executor);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }

  private void awaitDrain(ThreadPoolExecutor executor) {
    try {
      if (!executor.awaitTermination(settings.drainTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
        metrics.increment(ObserverMetrics.RESET_ABANDONED);
        log.warn("Observer {} abandoned {} capture task(s) still running after {} ms",
            name, executor.getActiveCount(), settings.drainTimeout().toMillis());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while draining capture tasks for observer {}", name);
    }
  }

  private void onUncaught(Thread thread, Throwable ex) {
    metrics.increment(ObserverMetrics.DECODE_UNCAUGHT);
    log.error("Uncaught failure on {} for observer {}", thread.getName(), name, ex);
  }

  private void runCapture(CaptureTask task) {
    Capture capture = task.capture();
    Frame frame = capture.frame();
    if (frameLog.isDebugEnabled()) {
      frameLog.debug(formatter.frameLine(
          capture.sessionSeconds(),
          capture.direction(),
          classifier.tagFor(frame),
          frame,
          capture.category(),
          capture.latencyMs()));
    }
    if (!classifier.shouldDecode(config)) {
      return;
    }

    byte[] bytes;
    try {
      bytes = frame.serializedForm().orElse(null);
      if (bytes == null) {
        bytes = serializer.serialize(frame);
      }
    } catch (IOException | RuntimeException ex) {
      if (task.complete() && tracker.recordSerializationFailure(task.generation())) {
        metrics.increment(ObserverMetrics.DECODE_SERIALIZE_FAILED);
        log.debug("Observer {} could not serialize frame {} ({})", name, frame.id(), frame.typeName(), ex);
      }
      return;
    }
    if (bytes == null || bytes.length == 0) {
      return;
    }

    ProtobufMessageLog decoded = decoder.decode(frame.typeName(), bytes);
    if (!task.complete()) {
      return;
    }
    DecodedRecord record =
        new DecodedRecord(frame.id(), capture.key(), capture.direction(), capture.observedAtMicros(), decoded);
    if (!tracker.recordDecoded(task.generation(), record)) {
      return;
    }
    metrics.increment(ObserverMetrics.DECODE_COMPLETED);
    if (!decoded.decodable()) {
      metrics.increment(ObserverMetrics.DECODE_UNDECODABLE);
    }
    metrics.observe(ObserverMetrics.DECODE_LATENCY_NANOS, System.nanoTime() - task.submittedNanos());
    frameLog.trace("  protobuf: {}", decoded);
  }

  private record Capture(
      Frame frame,
      FrameTypeKey key,
      FrameCategory category,
      FrameDirection direction,
      long observedAtMicros,
      double sessionSeconds,
      OptionalDouble latencyMs,
      long generation) {}

  /**
   * One unit of background work. Exactly one of completion, timeout or abandonment settles it; only a task that
   * settles as completed publishes results.
   */
  private final class CaptureTask implements Runnable {
    private static final int PENDING = 0;
    private static final int RUNNING = 1;
    private static final int DONE = 2;
    private static final int TIMED_OUT = 3;
    private static final int ABANDONED = 4;

    private final Capture capture;
    private final long generation;
    private final long submittedNanos;
    private final AtomicInteger status = new AtomicInteger(PENDING);
    private volatile ScheduledFuture<?> timer;
    private Thread worker;

    private CaptureTask(Capture capture, long submittedNanos) {
      this.capture = capture;
      this.generation = capture.generation();
      this.submittedNanos = submittedNanos;
    }

    @Override
    public void run() {
      if (!status.compareAndSet(PENDING, RUNNING)) {
        return;
      }
      synchronized (this) {
        worker = Thread.currentThread();
      }
      MDC.put(MDC_OBSERVER, name);
      try {
        runCapture(this);
      } finally {
        complete();
        MDC.remove(MDC_OBSERVER);
        synchronized (this) {
          worker = null;
        }
        // an interrupt aimed at this task must not leak into the next one on this thread
        Thread.interrupted();
      }
    }

    /** Settles the task as completed; {@code false} when a timeout or reset got there first. */
    boolean complete() {
      boolean settled = status.compareAndSet(RUNNING, DONE);
      ScheduledFuture<?> pendingTimer = timer;
      if (pendingTimer != null && status.get() != TIMED_OUT) {
        pendingTimer.cancel(false);
      }
      return settled;
    }

    boolean timeOut() {
      if (status.compareAndSet(PENDING, TIMED_OUT)) {
        return true;
      }
      if (!status.compareAndSet(RUNNING, TIMED_OUT)) {
        return false;
      }
      synchronized (this) {
        if (worker != null) {
          worker.interrupt();
        }
      }
      return true;
    }

    void abandon() {
      if (status.compareAndSet(PENDING, ABANDONED)) {
        ScheduledFuture<?> pendingTimer = timer;
        if (pendingTimer != null) {
          pendingTimer.cancel(false);
        }
      }
    }

    void armTimer(ScheduledFuture<?> future) {
      timer = future;
      int current = status.get();
      if (current == DONE || current == ABANDONED) {
        future.cancel(false);
      }
    }

    Capture capture() {
      return capture;
    }

    long generation() {
      return generation;
    }

    long submittedNanos() {
      return submittedNanos;
    }
  }
}
