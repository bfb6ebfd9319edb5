package ca.gc.cra.framescope.infrastructure.replay;

import ca.gc.cra.framescope.application.json.JsonSupport;
import ca.gc.cra.framescope.domain.frame.Frame;
import ca.gc.cra.framescope.domain.frame.FrameDirection;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Reads recorded frames from a JSON Lines file, one frame object per line:
 * <pre>
 * {"id":7,"type":"TranscriptionFrame","direction":"downstream","timestampMicros":50000,
 *  "source":"DeepgramSTTService#0","destination":"LLMUserAggregator#0",
 *  "fields":{"text":"hello","user_id":"u1"},"serialized":"GgcIBxIFaGVsbG8="}
 * </pre>
 * <p>{@code fields.audio} and {@code serialized} are Base64. Blank lines and lines starting with {@code #} are
 * skipped. Not thread-safe.</p>
 */
public final class JsonlFrameLogReader implements Closeable {
  private final BufferedReader reader;
  private final JsonSupport json;
  private final Path path;
  private long lineNumber;

  /**
   * Opens a frame log.
   *
   * @param path JSONL file
   * @throws IOException when the file cannot be opened
   */
  public JsonlFrameLogReader(Path path) throws IOException {
    this(path, new JsonSupport());
  }

  JsonlFrameLogReader(Path path, JsonSupport json) throws IOException {
    this.path = Objects.requireNonNull(path, "path");
    this.json = Objects.requireNonNull(json, "json");
    this.reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
  }

  /**
   * Reads the next frame.
   *
   * @return next frame, or empty at end of file
   * @throws IOException when reading fails or a line is not a valid frame record
   */
  public Optional<RecordedFrame> next() throws IOException {
    String line;
    while ((line = reader.readLine()) != null) {
      lineNumber++;
      String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("#")) {
        continue;
      }
      try {
        return Optional.of(toFrame(json.parseObject(trimmed)));
      } catch (IllegalArgumentException ex) {
        throw new IOException("Malformed frame record at " + path + ":" + lineNumber + ": " + ex.getMessage(), ex);
      }
    }
    return Optional.empty();
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }

  private RecordedFrame toFrame(Map<String, Object> record) {
    Object type = record.get("type");
    if (!(type instanceof String typeName) || typeName.isBlank()) {
      throw new IllegalArgumentException("'type' must be a non-blank string");
    }
    Frame.Builder builder = Frame.builder(typeName)
        .id(longValue(record, "id").orElse(lineNumber))
        .source(stringValue(record, "source"))
        .destination(stringValue(record, "destination"));

    Object fields = record.get("fields");
    if (fields != null) {
      if (!(fields instanceof Map<?, ?> raw)) {
        throw new IllegalArgumentException("'fields' must be an object");
      }
      Map<String, Object> values = new LinkedHashMap<>();
      raw.forEach((key, value) -> values.put(String.valueOf(key), value));
      Object audio = values.get(Frame.FIELD_AUDIO);
      if (audio instanceof String encoded) {
        values.put(Frame.FIELD_AUDIO, decodeBase64(encoded, "fields.audio"));
      }
      builder.fields(values);
    }
    String serialized = stringValue(record, "serialized");
    if (serialized != null) {
      builder.serialized(decodeBase64(serialized, "serialized"));
    }
    FrameDirection direction = FrameDirection.fromString(stringValue(record, "direction"));
    return new RecordedFrame(builder.build(), direction, longValue(record, "timestampMicros"), lineNumber);
  }

  private static byte[] decodeBase64(String encoded, String field) {
    try {
      return Base64.getDecoder().decode(encoded);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("'" + field + "' must be Base64", ex);
    }
  }

  private static String stringValue(Map<String, Object> record, String key) {
    Object value = record.get(key);
    if (value == null) {
      return null;
    }
    if (!(value instanceof String text)) {
      throw new IllegalArgumentException("'" + key + "' must be a string");
    }
    return text;
  }

  private static OptionalLong longValue(Map<String, Object> record, String key) {
    Object value = record.get(key);
    if (value == null) {
      return OptionalLong.empty();
    }
    if (!(value instanceof Number number)) {
      throw new IllegalArgumentException("'" + key + "' must be a number");
    }
    return OptionalLong.of(number.longValue());
  }
}
