package ca.gc.cra.framescope.application.port;

/**
 * <strong>What:</strong> Port for the observer's own operational metrics.
 * <p><strong>Why:</strong> Lets the observer report scheduling, rejection, and timeout counts without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Application port implemented by {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent calls from the notification thread and
 * decode workers.</p>
 * <p><strong>Performance:</strong> Calls must be non-blocking and amortized O(1); they sit on the frame
 * notification path.</p>
 *
 * @implNote Metric keys use dotted names such as {@code observer.decode.scheduled}; keys must not be {@code null}.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (nanoseconds, bytes, depth); semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
