package ca.gc.cra.framescope.infrastructure.decode;

import ca.gc.cra.framescope.application.json.JsonSupport;
import ca.gc.cra.framescope.application.port.FrameSerializer;
import ca.gc.cra.framescope.domain.frame.Frame;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Serializes frames into the pipeline's protobuf frame envelope.
 * <p>Frame types without a wire form serialize to an empty array. Used as the default serializer when the host
 * does not supply its own, and by the replay CLI.</p>
 *
 * @since 0.1.0
 */
public final class ProtobufFrameSerializer implements FrameSerializer {
  private final JsonSupport json;

  public ProtobufFrameSerializer() {
    this(new JsonSupport());
  }

  ProtobufFrameSerializer(JsonSupport json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  @Override
  public byte[] serialize(Frame frame) throws IOException {
    Objects.requireNonNull(frame, "frame");
    Optional<FrameSchema> schema = FrameSchema.forTypeTag(frame.typeName());
    if (schema.isEmpty()) {
      return new byte[0];
    }
    byte[] member = switch (schema.get()) {
      case TEXT -> new ProtoWireWriter()
          .writeUInt(1, frame.id())
          .writeString(2, frame.typeName())
          .writeString(3, frame.text().orElse(""))
          .toByteArray();
      case AUDIO -> new ProtoWireWriter()
          .writeUInt(1, frame.id())
          .writeString(2, frame.typeName())
          .writeBytes(3, frame.audio().orElse(new byte[0]))
          .writeUInt(4, nonNegative(frame.intField(Frame.FIELD_SAMPLE_RATE, 0), Frame.FIELD_SAMPLE_RATE))
          .writeUInt(5, nonNegative(frame.intField(Frame.FIELD_NUM_CHANNELS, 0), Frame.FIELD_NUM_CHANNELS))
          .toByteArray();
      case TRANSCRIPTION -> new ProtoWireWriter()
          .writeUInt(1, frame.id())
          .writeString(2, frame.typeName())
          .writeString(3, frame.text().orElse(""))
          .writeString(4, frame.stringField(Frame.FIELD_USER_ID).orElse(""))
          .writeString(5, frame.stringField(Frame.FIELD_TIMESTAMP).orElse(""))
          .toByteArray();
      case MESSAGE -> new ProtoWireWriter()
          .writeString(1, messageJson(frame))
          .toByteArray();
    };
    return new ProtoWireWriter().writeMessage(schema.get().envelopeField(), member).toByteArray();
  }

  private String messageJson(Frame frame) throws IOException {
    Object message = frame.field(Frame.FIELD_MESSAGE).orElse(null);
    if (message == null) {
      return "";
    }
    if (message instanceof CharSequence chars) {
      return chars.toString();
    }
    try {
      return json.toJson(message);
    } catch (IllegalStateException ex) {
      throw new IOException("Failed to serialize message for frame " + frame.id(), ex);
    }
  }

  private static long nonNegative(int value, String field) throws IOException {
    if (value < 0) {
      throw new IOException(field + " must not be negative (was " + value + ")");
    }
    return value;
  }
}
