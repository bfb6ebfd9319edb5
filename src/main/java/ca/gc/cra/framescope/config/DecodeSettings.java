package ca.gc.cra.framescope.config;

import ca.gc.cra.framescope.validation.Numbers;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Tuning parameters for the background decode pool.
 *
 * @param workers decode worker threads
 * @param queueCapacity bounded hand-off queue size; submissions beyond it are dropped
 * @param taskTimeout per-task budget after which a decode task is cancelled
 * @param drainTimeout bounded wait for in-flight tasks during reset or teardown
 * @param recentRecordLimit number of recent decode results retained for the summary
 * @since 0.1.0
 */
public record DecodeSettings(
    int workers,
    int queueCapacity,
    Duration taskTimeout,
    Duration drainTimeout,
    int recentRecordLimit) {

  /** Configuration key prefix used in YAML files. */
  public static final String SECTION = "decode";

  private static final int DEFAULT_WORKERS =
      Math.max(1, Runtime.getRuntime().availableProcessors() / 4);
  private static final int DEFAULT_QUEUE_CAPACITY = 1024;
  private static final Duration DEFAULT_TASK_TIMEOUT = Duration.ofSeconds(2);
  private static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(1);
  private static final int DEFAULT_RECENT_LIMIT = 128;

  /**
   * Normalizes settings by clamping counts and defaulting missing or non-positive durations.
   */
  public DecodeSettings {
    workers = Math.max(1, workers);
    queueCapacity = Math.max(workers, queueCapacity);
    taskTimeout = positiveOr(taskTimeout, DEFAULT_TASK_TIMEOUT);
    drainTimeout = positiveOr(drainTimeout, DEFAULT_DRAIN_TIMEOUT);
    recentRecordLimit = Math.max(0, recentRecordLimit);
  }

  /**
   * Returns the default decode tuning.
   *
   * @return defaults scaled to the available processors
   */
  public static DecodeSettings defaults() {
    return new DecodeSettings(
        DEFAULT_WORKERS,
        DEFAULT_QUEUE_CAPACITY,
        DEFAULT_TASK_TIMEOUT,
        DEFAULT_DRAIN_TIMEOUT,
        DEFAULT_RECENT_LIMIT);
  }

  /**
   * Builds settings from flat key/value pairs ({@code workers}, {@code queueCapacity},
   * {@code taskTimeoutMillis}, {@code drainTimeoutMillis}, {@code recentRecordLimit}), optionally qualified with
   * {@code decode.}.
   *
   * @param values flattened configuration; must not be {@code null}
   * @return normalized settings
   * @throws IllegalArgumentException when a value is not an integer or is out of range
   */
  public static DecodeSettings fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    DecodeSettings d = defaults();
    int workers = (int) parseLong(values, "workers", d.workers(), 1, 64);
    int capacity = (int) parseLong(values, "queueCapacity", d.queueCapacity(), 1, 1_000_000);
    long taskMillis = parseLong(values, "taskTimeoutMillis", d.taskTimeout().toMillis(), 1, 600_000);
    long drainMillis = parseLong(values, "drainTimeoutMillis", d.drainTimeout().toMillis(), 1, 600_000);
    int recent = (int) parseLong(values, "recentRecordLimit", d.recentRecordLimit(), 0, 100_000);
    return new DecodeSettings(
        workers, capacity, Duration.ofMillis(taskMillis), Duration.ofMillis(drainMillis), recent);
  }

  private static long parseLong(Map<String, String> values, String key, long defaultValue, long min, long max) {
    String raw = ObservabilityConfig.lookup(values, SECTION, key);
    if (raw == null) {
      return defaultValue;
    }
    try {
      return Numbers.requireRange(key, Long.parseLong(raw), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + raw + "')", ex);
    }
  }

  private static Duration positiveOr(Duration value, Duration fallback) {
    if (value == null || value.isZero() || value.isNegative()) {
      return fallback;
    }
    return value;
  }
}
