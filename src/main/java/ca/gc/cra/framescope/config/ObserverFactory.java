package ca.gc.cra.framescope.config;

import ca.gc.cra.framescope.application.observer.PipelineObserver;
import ca.gc.cra.framescope.application.port.ClockPort;
import ca.gc.cra.framescope.application.port.FrameSerializer;
import ca.gc.cra.framescope.application.port.MetricsPort;
import ca.gc.cra.framescope.infrastructure.decode.ProtobufFrameSerializer;
import ca.gc.cra.framescope.infrastructure.decode.ProtobufPayloadDecoder;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Composition root that turns configuration into a wired {@link PipelineObserver}.
 * <p><strong>Why:</strong> Hosts should not need to know which decoder or serializer backs the observer.</p>
 * <p><strong>Thread-safety:</strong> Immutable; each {@link #create} call builds an independent observer.</p>
 *
 * @since 0.1.0
 */
public final class ObserverFactory {
  private final ObservabilityConfig config;
  private final DecodeSettings settings;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a factory.
   *
   * @param config capture switches
   * @param settings decode pool settings
   * @param metrics metrics sink shared by created observers
   * @param clock timestamp source shared by created observers
   */
  public ObserverFactory(
      ObservabilityConfig config, DecodeSettings settings, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Builds a factory from a flattened configuration map.
   *
   * @param values merged configuration
   * @param metrics metrics sink
   * @return factory
   * @throws IllegalArgumentException when a value is invalid
   */
  public static ObserverFactory fromMap(Map<String, String> values, MetricsPort metrics) {
    return new ObserverFactory(
        ObservabilityConfig.fromMap(values), DecodeSettings.fromMap(values), metrics, ClockPort.SYSTEM);
  }

  /**
   * Creates an observer using the protobuf envelope serializer.
   *
   * @param name observer name
   * @return idle observer
   */
  public PipelineObserver create(String name) {
    return create(name, new ProtobufFrameSerializer());
  }

  /**
   * Creates an observer using a host-supplied serializer.
   *
   * @param name observer name
   * @param serializer produces the wire form of frames
   * @return idle observer
   */
  public PipelineObserver create(String name, FrameSerializer serializer) {
    return new PipelineObserver(
        name,
        config,
        settings,
        serializer,
        new ProtobufPayloadDecoder(config.truncateTextAt()),
        metrics,
        clock);
  }

  public ObservabilityConfig config() {
    return config;
  }

  public DecodeSettings settings() {
    return settings;
  }
}
