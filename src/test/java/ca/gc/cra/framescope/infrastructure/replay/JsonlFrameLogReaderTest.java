package ca.gc.cra.framescope.infrastructure.replay;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.framescope.domain.frame.Frame;
import ca.gc.cra.framescope.domain.frame.FrameDirection;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Map;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonlFrameLogReaderTest {

  @TempDir Path tempDir;

  @Test
  void readsFramesSkippingBlankAndCommentLines() throws IOException {
    String audio = Base64.getEncoder().encodeToString(new byte[] {1, 2, 3});
    Path log = write("""
        # recorded session
        {"id":7,"type":"TranscriptionFrame","direction":"downstream","timestampMicros":1500,\
        "source":"DeepgramSTTService#0","fields":{"text":"hello","user_id":"u1"}}

        {"type":"InputAudioRawFrame","direction":"up","fields":{"audio":"%s","sample_rate":16000}}
        """.formatted(audio));

    try (JsonlFrameLogReader reader = new JsonlFrameLogReader(log)) {
      RecordedFrame first = reader.next().orElseThrow();
      assertEquals(7, first.frame().id());
      assertEquals("TranscriptionFrame", first.frame().typeName());
      assertEquals(FrameDirection.DOWNSTREAM, first.direction());
      assertEquals(OptionalLong.of(1500), first.observedAtMicros());
      assertEquals("DeepgramSTTService#0", first.frame().source());
      assertEquals("hello", first.frame().text().orElseThrow());
      assertEquals(2, first.lineNumber());

      RecordedFrame second = reader.next().orElseThrow();
      assertEquals(FrameDirection.UPSTREAM, second.direction());
      assertTrue(second.observedAtMicros().isEmpty());
      assertEquals(4, second.frame().id());
      assertArrayEquals(new byte[] {1, 2, 3}, second.frame().audio().orElseThrow());
      assertEquals(16_000, second.frame().intField(Frame.FIELD_SAMPLE_RATE, 0));

      assertTrue(reader.next().isEmpty());
    }
  }

  @Test
  void decodesPreSerializedPayload() throws IOException {
    String serialized = Base64.getEncoder().encodeToString(new byte[] {0x0A, 0x00});
    Path log = write("{\"type\":\"TextFrame\",\"serialized\":\"" + serialized + "\",\"fields\":{\"message\":{\"a\":1}}}\n");

    try (JsonlFrameLogReader reader = new JsonlFrameLogReader(log)) {
      RecordedFrame recorded = reader.next().orElseThrow();
      assertArrayEquals(new byte[] {0x0A, 0x00}, recorded.frame().serializedForm().orElseThrow());
      assertEquals(FrameDirection.CONTROL, recorded.direction());
      assertEquals(Map.of("a", 1), recorded.frame().field(Frame.FIELD_MESSAGE).orElseThrow());
    }
  }

  @Test
  void malformedLineReportsLocation() throws IOException {
    Path log = write("{\"type\":\"StartFrame\"}\n{\"type\":42}\n");

    try (JsonlFrameLogReader reader = new JsonlFrameLogReader(log)) {
      reader.next();
      IOException ex = assertThrows(IOException.class, reader::next);
      assertTrue(ex.getMessage().contains(log + ":2"), ex.getMessage());
    }
  }

  @Test
  void rejectsInvalidJsonBase64AndDirection() throws IOException {
    assertMalformed("{not json");
    assertMalformed("{\"type\":\"TextFrame\",\"serialized\":\"%%%\"}");
    assertMalformed("{\"type\":\"TextFrame\",\"direction\":\"sideways\"}");
    assertMalformed("{\"type\":\"TextFrame\",\"fields\":[1,2]}");
  }

  private void assertMalformed(String line) throws IOException {
    Path log = write(line + "\n");
    try (JsonlFrameLogReader reader = new JsonlFrameLogReader(log)) {
      assertThrows(IOException.class, reader::next, line);
    }
  }

  private Path write(String content) throws IOException {
    Path log = Files.createTempFile(tempDir, "frames", ".jsonl");
    Files.writeString(log, content);
    return log;
  }
}
