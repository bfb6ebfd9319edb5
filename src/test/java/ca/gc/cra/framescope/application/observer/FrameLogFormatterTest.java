package ca.gc.cra.framescope.application.observer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.framescope.application.json.JsonSupport;
import ca.gc.cra.framescope.domain.frame.Frame;
import ca.gc.cra.framescope.domain.frame.FrameCategory;
import ca.gc.cra.framescope.domain.frame.FrameDirection;
import ca.gc.cra.framescope.domain.frame.FrameTypeKey;
import ca.gc.cra.framescope.domain.stats.LatencyStat;
import ca.gc.cra.framescope.domain.stats.PayloadTotals;
import ca.gc.cra.framescope.domain.stats.StatsSnapshot;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import org.junit.jupiter.api.Test;

class FrameLogFormatterTest {
  private final FrameLogFormatter formatter = new FrameLogFormatter(10, new JsonSupport());

  @Test
  void headerLineIsAligned() {
    Frame frame = Frame.builder("TranscriptionFrame")
        .source("DeepgramSTTService#0")
        .destination("LLMUserAggregator#0")
        .build();

    String line = formatter.frameLine(
        1.5, FrameDirection.DOWNSTREAM, "STT", frame, FrameCategory.TRANSCRIPTION, OptionalDouble.of(50));

    String expected = "   1.50s  >>  [STT      ] "
        + String.format("%-30s", "TranscriptionFrame")
        + " " + String.format("%12s", "DGSTT")
        + " -> " + String.format("%-12s", "User")
        + "    50.0ms";
    assertEquals(expected, line);
  }

  @Test
  void contentLineIsIndentedUnderHeader() {
    Frame frame = Frame.builder("TextFrame").text("hello there world").build();

    String line = formatter.frameLine(
        0, FrameDirection.UPSTREAM, "TEXT", frame, FrameCategory.TEXT, OptionalDouble.empty());

    String[] parts = line.split("\n");
    assertEquals(2, parts.length);
    assertTrue(parts[0].contains("<<  [TEXT     ]"));
    assertFalse(parts[0].endsWith("ms"));
    assertEquals(" ".repeat(26) + "\"hello ther...\"", parts[1]);
  }

  @Test
  void audioContentIsSummarized() {
    Frame frame = Frame.builder("InputAudioRawFrame").audio(new byte[3_200], 16_000, 1).build();

    assertEquals(Optional.of("[3.1KB @ 16000Hz]"), formatter.content(frame, FrameCategory.AUDIO));
  }

  @Test
  void messageContentIsCompactJson() {
    Map<String, Object> message = new LinkedHashMap<>();
    message.put("a", 1);
    Frame small = Frame.builder("OutputTransportMessageFrame").field(Frame.FIELD_MESSAGE, message).build();
    assertEquals(Optional.of("{\"a\":1}"), formatter.content(small, FrameCategory.OTHER));

    message.put("label", "long enough to truncate");
    Frame large = Frame.builder("OutputTransportMessageFrame").field(Frame.FIELD_MESSAGE, message).build();
    assertEquals(Optional.of("{\"a\":1,\"la..."), formatter.content(large, FrameCategory.OTHER));
  }

  @Test
  void framesWithoutContentHaveNoContentLine() {
    Frame frame = Frame.builder("BotStartedSpeakingFrame").build();
    assertEquals(Optional.empty(), formatter.content(frame, FrameCategory.CONTROL));
    assertFalse(formatter.frameLine(
        0, FrameDirection.CONTROL, "BOT-START", frame, FrameCategory.CONTROL, OptionalDouble.empty())
        .contains("\n"));
  }

  @Test
  void processorNamesAreShortened() {
    assertEquals("WS-In", FrameLogFormatter.shortenProcessorName("FastAPIWebsocketInputTransport#0"));
    assertEquals("WS-Out", FrameLogFormatter.shortenProcessorName("FastAPIWebsocketOutputTransport#0"));
    assertEquals("Asst", FrameLogFormatter.shortenProcessorName("LLMAssistantAggregator#0"));
    assertEquals("Agent", FrameLogFormatter.shortenProcessorName("OpenAIAgentProcessor#0"));
    assertEquals("Source", FrameLogFormatter.shortenProcessorName("Pipeline#0::Source"));
    assertEquals("?", FrameLogFormatter.shortenProcessorName(null));
    assertEquals("?", FrameLogFormatter.shortenProcessorName(" "));
  }

  @Test
  void summaryOrdersCountsDescendingAndLatencyByName() {
    FrameTypeKey stt = FrameTypeKey.of("TranscriptionFrame");
    FrameTypeKey audio = FrameTypeKey.of("InputAudioRawFrame");
    FrameTypeKey start = FrameTypeKey.of("StartFrame");
    StatsSnapshot snapshot = new StatsSnapshot(
        Map.of(stt, 2L, audio, 5L, start, 1L),
        Map.of(stt, LatencyStat.EMPTY.plus(50).plus(70), audio, LatencyStat.EMPTY.plus(20)),
        PayloadTotals.EMPTY,
        List.of());

    List<String> lines = FrameLogFormatter.summaryLines(snapshot);

    assertEquals("Session Summary", lines.get(1));
    int audioLine = indexOfPrefix(lines, "  InputAudioRawFrame");
    int sttLine = indexOfPrefix(lines, "  TranscriptionFrame");
    int startLine = indexOfPrefix(lines, "  StartFrame");
    assertTrue(audioLine < sttLine && sttLine < startLine, lines.toString());

    int latencyHeader = lines.indexOf("Latency Stats:");
    assertTrue(lines.get(latencyHeader + 1).startsWith("  InputAudioRawFrame"));
    assertTrue(lines.get(latencyHeader + 2).contains("avg:   60.0ms  min:   50.0ms  max:   70.0ms"));
    assertFalse(lines.contains("Payload Stats:"));
  }

  private static int indexOfPrefix(List<String> lines, String prefix) {
    for (int i = 0; i < lines.size(); i++) {
      if (lines.get(i).startsWith(prefix)) {
        return i;
      }
    }
    return -1;
  }
}
