package ca.gc.cra.framescope.domain.frame;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Read-only view of one unit of data flowing through the host pipeline.
 * <p><strong>Why:</strong> Gives the observer a stable, immutable shape for frames it does not own.</p>
 * <p><strong>Role:</strong> Domain value object handed over by the host pipeline on every notification.</p>
 * <p><strong>Thread-safety:</strong> Immutable; byte arrays are copied on the way in and out so the frame can be
 * shared with background decode workers.</p>
 * <p><strong>Performance:</strong> Construction copies the field map once; accessors for well-known fields are
 * constant-time lookups.</p>
 *
 * @param id pipeline-assigned frame identifier
 * @param typeName type tag of the frame (for example {@code TranscriptionFrame})
 * @param fields named field values: text, numbers, {@code byte[]} blobs, nested maps or lists
 * @param serialized optional pre-serialized protobuf form; {@code null} when absent
 * @param source logical source processor name; {@code null} when unknown
 * @param destination logical destination processor name; {@code null} when unknown
 * @since 0.1.0
 */
public record Frame(
    long id,
    String typeName,
    Map<String, Object> fields,
    byte[] serialized,
    String source,
    String destination) {

  /** Field holding text content. */
  public static final String FIELD_TEXT = "text";
  /** Field holding raw audio bytes. */
  public static final String FIELD_AUDIO = "audio";
  /** Field holding the audio sample rate in Hz. */
  public static final String FIELD_SAMPLE_RATE = "sample_rate";
  /** Field holding the audio channel count. */
  public static final String FIELD_NUM_CHANNELS = "num_channels";
  /** Field holding the speaker identifier of a transcription. */
  public static final String FIELD_USER_ID = "user_id";
  /** Field holding the transcription timestamp string. */
  public static final String FIELD_TIMESTAMP = "timestamp";
  /** Field holding a transport message (map or JSON string). */
  public static final String FIELD_MESSAGE = "message";

  /**
   * Validates identity and takes immutable copies of fields and serialized bytes.
   *
   * @throws IllegalArgumentException if {@code typeName} is blank
   */
  public Frame {
    Objects.requireNonNull(typeName, "typeName");
    if (typeName.isBlank()) {
      throw new IllegalArgumentException("typeName must not be blank");
    }
    fields = fields == null || fields.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    serialized = serialized != null ? serialized.clone() : null;
  }

  /**
   * Starts a builder for a frame of the given type.
   *
   * @param typeName frame type tag
   * @return new builder
   */
  public static Builder builder(String typeName) {
    return new Builder(typeName);
  }

  @Override
  public byte[] serialized() {
    return serialized != null ? serialized.clone() : null;
  }

  /**
   * Returns the pre-serialized form when the host attached one.
   *
   * @return copy of the serialized bytes, or empty
   */
  public Optional<byte[]> serializedForm() {
    return Optional.ofNullable(serialized());
  }

  /**
   * Returns the raw value of a named field.
   *
   * @param name field name
   * @return field value, or empty when absent or {@code null}
   */
  public Optional<Object> field(String name) {
    return Optional.ofNullable(fields.get(name));
  }

  /**
   * Returns the text field when present and non-empty.
   *
   * @return text content
   */
  public Optional<String> text() {
    Object value = fields.get(FIELD_TEXT);
    if (value instanceof CharSequence chars && chars.length() > 0) {
      return Optional.of(chars.toString());
    }
    return Optional.empty();
  }

  /**
   * Returns the audio payload when present.
   *
   * @return copy of the audio bytes
   */
  public Optional<byte[]> audio() {
    Object value = fields.get(FIELD_AUDIO);
    if (value instanceof byte[] bytes) {
      return Optional.of(bytes.clone());
    }
    return Optional.empty();
  }

  /**
   * Returns the length of the audio payload without copying it.
   *
   * @return audio byte count, or {@code -1} when the frame carries no audio
   */
  public int audioLength() {
    Object value = fields.get(FIELD_AUDIO);
    return value instanceof byte[] bytes ? bytes.length : -1;
  }

  /**
   * Returns an integer-valued field.
   *
   * @param name field name
   * @param defaultValue value returned when the field is absent or not numeric
   * @return field value as an int
   */
  public int intField(String name, int defaultValue) {
    Object value = fields.get(name);
    if (value instanceof Number number) {
      return number.intValue();
    }
    if (value instanceof CharSequence chars) {
      try {
        return Integer.parseInt(chars.toString().trim());
      } catch (NumberFormatException ex) {
        return defaultValue;
      }
    }
    return defaultValue;
  }

  /**
   * Returns a string-valued field.
   *
   * @param name field name
   * @return field value when it is text
   */
  public Optional<String> stringField(String name) {
    Object value = fields.get(name);
    if (value instanceof CharSequence chars) {
      return Optional.of(chars.toString());
    }
    return Optional.empty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Frame that)) {
      return false;
    }
    return id == that.id
        && typeName.equals(that.typeName)
        && fields.equals(that.fields)
        && Arrays.equals(serialized, that.serialized)
        && Objects.equals(source, that.source)
        && Objects.equals(destination, that.destination);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(id, typeName, fields, source, destination);
    result = 31 * result + Arrays.hashCode(serialized);
    return result;
  }

  @Override
  public String toString() {
    return "Frame{"
        + "id=" + id
        + ", typeName=" + typeName
        + ", fields=" + fields.keySet()
        + ", serializedBytes=" + (serialized == null ? "none" : serialized.length)
        + ", source=" + source
        + ", destination=" + destination
        + '}';
  }

  /** Fluent builder used by hosts and tests to assemble frames. */
  public static final class Builder {
    private final String typeName;
    private final Map<String, Object> fields = new LinkedHashMap<>();
    private long id;
    private byte[] serialized;
    private String source;
    private String destination;

    private Builder(String typeName) {
      this.typeName = typeName;
    }

    public Builder id(long id) {
      this.id = id;
      return this;
    }

    public Builder field(String name, Object value) {
      fields.put(Objects.requireNonNull(name, "name"), value);
      return this;
    }

    public Builder fields(Map<String, ?> values) {
      if (values != null) {
        fields.putAll(values);
      }
      return this;
    }

    public Builder text(String text) {
      return field(FIELD_TEXT, text);
    }

    public Builder audio(byte[] audio, int sampleRate, int channels) {
      field(FIELD_AUDIO, audio);
      field(FIELD_SAMPLE_RATE, sampleRate);
      return field(FIELD_NUM_CHANNELS, channels);
    }

    public Builder serialized(byte[] serialized) {
      this.serialized = serialized;
      return this;
    }

    public Builder source(String source) {
      this.source = source;
      return this;
    }

    public Builder destination(String destination) {
      this.destination = destination;
      return this;
    }

    public Frame build() {
      return new Frame(id, typeName, fields, serialized, source, destination);
    }
  }
}
