package ca.gc.cra.framescope.application.observer;

/** Metric keys published by {@link PipelineObserver} through the metrics port. */
public final class ObserverMetrics {
  public static final String FRAMES_SEEN = "observer.frames.seen";
  public static final String NOTIFY_FAILED = "observer.frames.notifyFailed";
  public static final String DECODE_SCHEDULED = "observer.decode.scheduled";
  public static final String DECODE_REJECTED = "observer.decode.rejected";
  public static final String DECODE_COMPLETED = "observer.decode.completed";
  public static final String DECODE_UNDECODABLE = "observer.decode.undecodable";
  public static final String DECODE_SERIALIZE_FAILED = "observer.decode.serializeFailed";
  public static final String DECODE_TIMEOUT = "observer.decode.timeout";
  public static final String DECODE_LATENCY_NANOS = "observer.decode.latencyNanos";
  public static final String DECODE_UNCAUGHT = "observer.decode.uncaught";
  public static final String RESET = "observer.reset";
  public static final String RESET_ABANDONED = "observer.reset.abandoned";

  private ObserverMetrics() {}
}
