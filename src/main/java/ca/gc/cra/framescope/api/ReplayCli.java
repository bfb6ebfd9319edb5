package ca.gc.cra.framescope.api;

import ca.gc.cra.framescope.application.observer.PipelineObserver;
import ca.gc.cra.framescope.application.port.MetricsPort;
import ca.gc.cra.framescope.config.ObservabilityConfigLoader;
import ca.gc.cra.framescope.config.ObserverFactory;
import ca.gc.cra.framescope.domain.stats.StatsSnapshot;
import ca.gc.cra.framescope.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.framescope.infrastructure.replay.JsonlFrameLogReader;
import ca.gc.cra.framescope.infrastructure.replay.RecordedFrame;
import ca.gc.cra.framescope.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays a recorded frame log through a {@link PipelineObserver} and prints the session summary.
 * <p>Frames keep their recorded timestamps, so latency figures match the original session. Frames without a
 * timestamp are stamped with the system clock as they are replayed.</p>
 */
public final class ReplayCli {
  private static final Logger log = LoggerFactory.getLogger(ReplayCli.class);
  private static final String SUMMARY_USAGE =
      "usage: replay in=PATH [config=PATH] [name=NAME] [enableAudioCapture=true|false] "
          + "[enableBinaryLogging=true|false] [truncateTextAt=N] [workers=N] [--trace] [--verbose] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      FrameScope replay

      Usage:
        replay in=./frames.jsonl [options]

      Required:
        in=PATH                    JSON Lines frame log (one frame object per line)

      Optional:
        config=PATH                YAML file with observability and decode sections
        name=NAME                  Observer name used in logs (default replay)
        enabled=true|false         Master switch (default true)
        enableBinaryLogging=BOOL   Serialize and decode captured frames (default true)
        enableAudioCapture=BOOL    Capture audio frames (default false)
        enableTextCapture=BOOL     Capture text and transcription frames (default true)
        enableTimingMetrics=BOOL   Record inter-frame latency (default true)
        truncateTextAt=N           Characters of text kept per field (default 80)
        workers=N                  Decode worker threads
        queueCapacity=N            Pending decode tasks before frames are dropped
        taskTimeoutMillis=N        Per-frame decode timeout
        drainTimeoutMillis=N       Time allowed for pending work at shutdown
        metricsExporter=otlp|none  Configure metrics exporter (default otlp)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --trace                    Log decoded payloads
        --verbose                  Enable DEBUG logging
        --help                     Show this message

      Precedence: CLI > YAML > defaults.
      """;

  private ReplayCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    return run(args, values -> new OpenTelemetryMetricsAdapter());
  }

  static ExitCode run(String[] args, Function<Map<String, String>, MetricsPort> metricsFactory) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for replay CLI");
    }
    if (input.trace()) {
      LoggingConfigurator.enablePayloadTracing();
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String in = kv.remove("in");
    if (in == null || in.isBlank()) {
      log.error("Missing required argument: in");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    Path inputPath = Path.of(in);
    if (!Files.isRegularFile(inputPath)) {
      log.error("Frame log does not exist or is not a file: {}", inputPath);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String name = Optional.ofNullable(kv.remove("name")).orElse("replay");

    Optional<Map<String, String>> yaml = Optional.empty();
    String configPath = kv.remove("config");
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yaml = ObservabilityConfigLoader.load(yamlPath);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> effective;
    ObserverFactory factory;
    MetricsPort metrics;
    try {
      effective = new LinkedHashMap<>(ObservabilityConfigLoader.merge(yaml, kv, log::warn));
      TelemetryConfigurator.configureMetrics(effective);
      metrics = metricsFactory.apply(effective);
      factory = ObserverFactory.fromMap(effective, metrics);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid replay configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }

    try {
      return replay(inputPath, factory.create(name));
    } finally {
      if (metrics instanceof AutoCloseable closeable) {
        closeQuietly(closeable);
      }
    }
  }

  private static ExitCode replay(Path inputPath, PipelineObserver observer) {
    long replayed = 0;
    try (observer; JsonlFrameLogReader reader = new JsonlFrameLogReader(inputPath)) {
      log.info("Replaying frame log {} through observer {}", inputPath, observer.name());
      Optional<RecordedFrame> next;
      while ((next = reader.next()).isPresent()) {
        RecordedFrame recorded = next.get();
        if (recorded.observedAtMicros().isPresent()) {
          observer.onFrame(recorded.frame(), recorded.direction(), recorded.observedAtMicros().getAsLong());
        } else {
          observer.onFrame(recorded.frame(), recorded.direction());
        }
        replayed++;
        if (Thread.currentThread().isInterrupted()) {
          log.warn("Replay interrupted after {} frames", replayed);
          return ExitCode.INTERRUPTED;
        }
      }
    } catch (IOException ex) {
      log.error("Replay of {} failed after {} frames: {}", inputPath, replayed, ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure replaying {}", inputPath, ex);
      return ExitCode.RUNTIME_FAILURE;
    }

    observer.printSummary();
    StatsSnapshot summary = observer.getSummary();
    CliPrinter.println(String.format(
        "Replayed %d frames (%d frame types, %d payload bytes decoded)",
        replayed,
        summary.frameCounts().size(),
        summary.payloadTotals().totalBytes()));
    return ExitCode.SUCCESS;
  }

  private static void closeQuietly(AutoCloseable closeable) {
    try {
      closeable.close();
    } catch (Exception ex) {
      log.debug("Failed to close metrics adapter", ex);
    }
  }
}
