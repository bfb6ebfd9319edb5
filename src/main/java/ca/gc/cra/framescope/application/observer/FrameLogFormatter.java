package ca.gc.cra.framescope.application.observer;

import ca.gc.cra.framescope.application.json.JsonSupport;
import ca.gc.cra.framescope.domain.frame.Frame;
import ca.gc.cra.framescope.domain.frame.FrameCategory;
import ca.gc.cra.framescope.domain.frame.FrameDirection;
import ca.gc.cra.framescope.domain.frame.FrameTypeKey;
import ca.gc.cra.framescope.domain.stats.LatencyStat;
import ca.gc.cra.framescope.domain.stats.PayloadTotals;
import ca.gc.cra.framescope.domain.stats.StatsSnapshot;
import ca.gc.cra.framescope.logging.Logs;
import ca.gc.cra.framescope.validation.Numbers;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Renders frame log lines and the session summary.
 * <p>A frame line looks like
 * {@code "   1.25s  >>  [STT      ] TranscriptionFrame              DG ->     User  50.0ms"}; when the frame
 * carries displayable content a second line follows, indented to the tag column.</p>
 */
final class FrameLogFormatter {
  static final int CONTENT_INDENT = 26;
  static final String UNKNOWN_PROCESSOR = "?";
  private static final String RULE = "=".repeat(60);

  /** Applied in order; earlier rules can change what later rules match. */
  private static final String[][] PROCESSOR_REWRITES = {
      {"Service#0", ""},
      {"Transport#0", ""},
      {"Processor#0", ""},
      {"Aggregator#0", ""},
      {"#0", ""},
      {"FastAPIWebsocketInput", "WS-In"},
      {"FastAPIWebsocketOutput", "WS-Out"},
      {"Pipeline#0::", ""},
      {"PipelineTask#0::", "Task:"},
      {"Deepgram", "DG"},
      {"OpenAIAgent", "Agent"},
      {"LLMUser", "User"},
      {"LLMAssistant", "Asst"},
  };

  private final int truncateTextAt;
  private final JsonSupport json;

  FrameLogFormatter(int truncateTextAt, JsonSupport json) {
    this.truncateTextAt = (int) Numbers.requireNonNegative("truncateTextAt", truncateTextAt);
    this.json = Objects.requireNonNull(json, "json");
  }

  /**
   * Builds the complete log message for one frame.
   *
   * @param sessionSeconds seconds since the first frame of the session
   * @param direction frame direction
   * @param tag short display tag
   * @param frame frame being logged
   * @param category category of the frame
   * @param latencyMs gap to the previous frame on the channel, empty when not shown
   * @return header line, followed by an indented content line when the frame has content
   */
  String frameLine(
      double sessionSeconds,
      FrameDirection direction,
      String tag,
      Frame frame,
      FrameCategory category,
      OptionalDouble latencyMs) {
    StringBuilder line = new StringBuilder(128);
    line.append(String.format(
        Locale.ROOT,
        "%7.2fs  %s  [%-9s] %-30s %12s -> %-12s",
        sessionSeconds,
        FrameClassifier.directionGlyph(direction),
        tag,
        frame.typeName(),
        shortenProcessorName(frame.source()),
        shortenProcessorName(frame.destination())));
    if (latencyMs.isPresent()) {
      line.append(String.format(Locale.ROOT, "  %6.1fms", latencyMs.getAsDouble()));
    }
    content(frame, category).ifPresent(text -> line.append('\n').append(" ".repeat(CONTENT_INDENT)).append(text));
    return line.toString();
  }

  /**
   * Extracts displayable content: quoted truncated text, an audio size and rate summary, or compact message JSON.
   *
   * @param frame frame to inspect
   * @param category category of the frame
   * @return content, or empty when the frame has nothing worth showing
   */
  Optional<String> content(Frame frame, FrameCategory category) {
    Optional<String> text = frame.text().filter(value -> !value.isEmpty());
    if (text.isPresent()) {
      return Optional.of('"' + Logs.truncate(text.get(), truncateTextAt) + '"');
    }
    if (category == FrameCategory.AUDIO && frame.audioLength() >= 0) {
      return Optional.of(String.format(
          Locale.ROOT,
          "[%.1fKB @ %dHz]",
          frame.audioLength() / 1024d,
          frame.intField(Frame.FIELD_SAMPLE_RATE, 0)));
    }
    Object message = frame.field(Frame.FIELD_MESSAGE).orElse(null);
    if (message instanceof Map<?, ?> || message instanceof Collection<?>) {
      try {
        return Optional.of(Logs.truncate(json.toJson(message), truncateTextAt));
      } catch (IllegalStateException ex) {
        return Optional.empty();
      }
    }
    return Optional.empty();
  }

  /**
   * Shortens a pipeline processor name for display.
   *
   * @param name processor name, possibly {@code null}
   * @return shortened name, {@code ?} when unknown
   */
  static String shortenProcessorName(String name) {
    if (name == null || name.isBlank()) {
      return UNKNOWN_PROCESSOR;
    }
    String shortened = name;
    for (String[] rewrite : PROCESSOR_REWRITES) {
      shortened = shortened.replace(rewrite[0], rewrite[1]);
    }
    return shortened;
  }

  /**
   * Renders the session summary: frame counts by count descending, latency by type name, payload totals.
   *
   * @param snapshot statistics to render
   * @return summary lines in output order
   */
  static List<String> summaryLines(StatsSnapshot snapshot) {
    List<String> lines = new ArrayList<>();
    lines.add(RULE);
    lines.add("Session Summary");
    lines.add(RULE);
    lines.add("Frame Counts:");
    snapshot.frameCounts().entrySet().stream()
        .sorted(Map.Entry.<FrameTypeKey, Long>comparingByValue(Comparator.reverseOrder())
            .thenComparing(Map.Entry.comparingByKey()))
        .forEach(e -> lines.add(String.format(Locale.ROOT, "  %-40s %6d", e.getKey(), e.getValue())));

    if (!snapshot.latencyStats().isEmpty()) {
      lines.add("Latency Stats:");
      for (Map.Entry<FrameTypeKey, LatencyStat> e : snapshot.latencyStats().entrySet()) {
        LatencyStat stat = e.getValue();
        lines.add(String.format(
            Locale.ROOT,
            "  %-40s avg: %6.1fms  min: %6.1fms  max: %6.1fms",
            e.getKey(),
            stat.avgMs(),
            stat.minMs(),
            stat.maxMs()));
      }
    }

    PayloadTotals totals = snapshot.payloadTotals();
    if (totals.totalMessages() > 0 || totals.serializationFailures() > 0 || totals.timeouts() > 0
        || totals.rejected() > 0) {
      lines.add("Payload Stats:");
      lines.add(String.format(Locale.ROOT, "  %-12s %6d msgs %10d bytes", "downstream",
          totals.downstreamCount(), totals.downstreamBytes()));
      lines.add(String.format(Locale.ROOT, "  %-12s %6d msgs %10d bytes", "upstream",
          totals.upstreamCount(), totals.upstreamBytes()));
      lines.add(String.format(Locale.ROOT, "  %-12s %6d msgs %10d bytes", "total",
          totals.totalMessages(), totals.totalBytes()));
      lines.add(String.format(
          Locale.ROOT,
          "  undecodable: %d  serializeFailed: %d  timeouts: %d  rejected: %d",
          totals.undecodable(),
          totals.serializationFailures(),
          totals.timeouts(),
          totals.rejected()));
    }
    return lines;
  }
}
