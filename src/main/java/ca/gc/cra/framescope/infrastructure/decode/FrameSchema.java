package ca.gc.cra.framescope.infrastructure.decode;

import ca.gc.cra.framescope.domain.frame.Frame;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Protobuf schemas of the pipeline's serialized frame envelope.
 * <p>The envelope is a message with one populated member: {@code text = 1}, {@code audio = 2},
 * {@code transcription = 3}, {@code message = 4}. Each constant lists the frame type tags that serialize to its
 * member and the member's fields in declaration order.</p>
 *
 * @since 0.1.0
 */
enum FrameSchema {
  TEXT(
      1,
      Set.of("TextFrame", "LLMTextFrame", "TTSTextFrame"),
      List.of(
          new FieldSpec(1, "id", Kind.UINT),
          new FieldSpec(2, "name", Kind.STRING),
          new FieldSpec(3, Frame.FIELD_TEXT, Kind.TEXT))),
  AUDIO(
      2,
      Set.of("AudioRawFrame", "InputAudioRawFrame", "OutputAudioRawFrame", "TTSAudioRawFrame"),
      List.of(
          new FieldSpec(1, "id", Kind.UINT),
          new FieldSpec(2, "name", Kind.STRING),
          new FieldSpec(3, Frame.FIELD_AUDIO, Kind.AUDIO),
          new FieldSpec(4, Frame.FIELD_SAMPLE_RATE, Kind.SAMPLE_RATE),
          new FieldSpec(5, Frame.FIELD_NUM_CHANNELS, Kind.CHANNELS),
          new FieldSpec(6, "pts", Kind.UINT))),
  TRANSCRIPTION(
      3,
      Set.of("TranscriptionFrame", "InterimTranscriptionFrame"),
      List.of(
          new FieldSpec(1, "id", Kind.UINT),
          new FieldSpec(2, "name", Kind.STRING),
          new FieldSpec(3, Frame.FIELD_TEXT, Kind.TEXT),
          new FieldSpec(4, Frame.FIELD_USER_ID, Kind.STRING),
          new FieldSpec(5, Frame.FIELD_TIMESTAMP, Kind.STRING))),
  MESSAGE(
      4,
      Set.of("OutputTransportMessageFrame", "TransportMessageFrame", "TransportMessageUrgentFrame"),
      List.of(new FieldSpec(1, "data", Kind.JSON)));

  private static final Map<String, FrameSchema> BY_TYPE_TAG = new HashMap<>();

  static {
    for (FrameSchema schema : values()) {
      for (String tag : schema.typeTags) {
        BY_TYPE_TAG.put(tag, schema);
      }
    }
  }

  private final int envelopeField;
  private final Set<String> typeTags;
  private final List<FieldSpec> fields;

  FrameSchema(int envelopeField, Set<String> typeTags, List<FieldSpec> fields) {
    this.envelopeField = envelopeField;
    this.typeTags = typeTags;
    this.fields = fields;
  }

  /**
   * Looks up the schema a frame type serializes to.
   *
   * @param typeTag frame type tag
   * @return schema, or empty when the type has no wire form
   */
  static Optional<FrameSchema> forTypeTag(String typeTag) {
    return typeTag == null ? Optional.empty() : Optional.ofNullable(BY_TYPE_TAG.get(typeTag));
  }

  static boolean isEnvelopeMember(int fieldNumber) {
    for (FrameSchema schema : values()) {
      if (schema.envelopeField == fieldNumber) {
        return true;
      }
    }
    return false;
  }

  int envelopeField() {
    return envelopeField;
  }

  List<FieldSpec> fields() {
    return fields;
  }

  Optional<FieldSpec> field(int number) {
    for (FieldSpec spec : fields) {
      if (spec.number() == number) {
        return Optional.of(spec);
      }
    }
    return Optional.empty();
  }

  enum Kind {
    UINT,
    STRING,
    TEXT,
    AUDIO,
    SAMPLE_RATE,
    CHANNELS,
    JSON;

    int wireType() {
      return switch (this) {
        case UINT, SAMPLE_RATE, CHANNELS -> ProtoWireReader.WIRE_VARINT;
        case STRING, TEXT, AUDIO, JSON -> ProtoWireReader.WIRE_LENGTH_DELIMITED;
      };
    }
  }

  record FieldSpec(int number, String name, Kind kind) {}
}
