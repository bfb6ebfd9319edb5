package ca.gc.cra.framescope.infrastructure.decode;

import ca.gc.cra.framescope.application.json.JsonSupport;
import ca.gc.cra.framescope.application.port.PayloadDecoder;
import ca.gc.cra.framescope.domain.decode.AudioSummary;
import ca.gc.cra.framescope.domain.decode.ProtobufMessageLog;
import ca.gc.cra.framescope.logging.Logs;
import ca.gc.cra.framescope.validation.Numbers;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Decodes serialized frame envelopes into readable field summaries.
 * <p><strong>Why:</strong> Operators want to see what actually went over the wire; decoding is diagnostic and must
 * never fail the caller.</p>
 * <p><strong>Role:</strong> Infrastructure adapter implementing {@link PayloadDecoder}; dispatches on the frame type
 * tag through {@link FrameSchema}, with unknown tags falling into the undecodable branch.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Validate the envelope member against the schema expected for the tag.</li>
 *   <li>Truncate text by code points and summarize audio as {@link AudioSummary}.</li>
 *   <li>Parse transport-message JSON; keep unparsable JSON as truncated text.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable settings; safe for concurrent decode workers.</p>
 * <p><strong>Performance:</strong> Single pass over the payload; audio bytes are skipped, never copied.</p>
 *
 * @since 0.1.0
 */
public final class ProtobufPayloadDecoder implements PayloadDecoder {
  private static final Logger log = LoggerFactory.getLogger(ProtobufPayloadDecoder.class);
  private static final String UNKNOWN_TYPE = "unknown";

  private final int truncateTextAt;
  private final JsonSupport json;

  /**
   * Creates a decoder.
   *
   * @param truncateTextAt maximum characters of text retained per field; must be {@code >= 0}
   * @throws IllegalArgumentException if {@code truncateTextAt} is negative
   */
  public ProtobufPayloadDecoder(int truncateTextAt) {
    this(truncateTextAt, new JsonSupport());
  }

  ProtobufPayloadDecoder(int truncateTextAt, JsonSupport json) {
    this.truncateTextAt = (int) Numbers.requireNonNegative("truncateTextAt", truncateTextAt);
    this.json = Objects.requireNonNull(json, "json");
  }

  @Override
  public ProtobufMessageLog decode(String typeTag, byte[] rawBytes) {
    byte[] bytes = rawBytes == null ? new byte[0] : rawBytes;
    String typeName = typeTag == null || typeTag.isBlank() ? UNKNOWN_TYPE : typeTag;
    Optional<FrameSchema> schema = FrameSchema.forTypeTag(typeTag);
    if (schema.isEmpty() || bytes.length == 0) {
      return ProtobufMessageLog.undecodable(typeName, bytes.length);
    }
    try {
      byte[] member = readEnvelopeMember(schema.get(), bytes);
      Map<String, Object> fields = readMember(schema.get(), member);
      return ProtobufMessageLog.decoded(typeName, fields, bytes.length);
    } catch (MalformedPayloadException ex) {
      log.trace("Payload for {} is malformed ({} bytes): {}", typeName, bytes.length, ex.getMessage());
      return ProtobufMessageLog.undecodable(typeName, bytes.length);
    } catch (RuntimeException ex) {
      log.debug("Unexpected failure decoding {} payload ({} bytes)", typeName, bytes.length, ex);
      return ProtobufMessageLog.undecodable(typeName, bytes.length);
    }
  }

  private static byte[] readEnvelopeMember(FrameSchema schema, byte[] bytes) throws MalformedPayloadException {
    ProtoWireReader reader = new ProtoWireReader(bytes);
    byte[] member = null;
    while (reader.hasRemaining()) {
      int key = reader.readKey();
      int number = ProtoWireReader.fieldNumber(key);
      int wireType = ProtoWireReader.wireType(key);
      if (number == schema.envelopeField() && wireType == ProtoWireReader.WIRE_LENGTH_DELIMITED) {
        member = reader.readLengthDelimited();
      } else if (FrameSchema.isEnvelopeMember(number)) {
        throw new MalformedPayloadException(
            "envelope carries member " + number + " but " + schema + " expects " + schema.envelopeField());
      } else {
        reader.skip(wireType);
      }
    }
    if (member == null) {
      throw new MalformedPayloadException("envelope member " + schema.envelopeField() + " missing");
    }
    return member;
  }

  private Map<String, Object> readMember(FrameSchema schema, byte[] member) throws MalformedPayloadException {
    ProtoWireReader reader = new ProtoWireReader(member);
    Map<String, Object> values = new HashMap<>();
    int audioBytes = 0;
    int sampleRate = 0;
    int channels = 0;
    while (reader.hasRemaining()) {
      int key = reader.readKey();
      int wireType = ProtoWireReader.wireType(key);
      Optional<FrameSchema.FieldSpec> spec = schema.field(ProtoWireReader.fieldNumber(key));
      if (spec.isEmpty() || spec.get().kind().wireType() != wireType) {
        reader.skip(wireType);
        continue;
      }
      FrameSchema.FieldSpec field = spec.get();
      switch (field.kind()) {
        case UINT -> values.put(field.name(), reader.readVarint());
        case STRING -> values.put(field.name(), reader.readString());
        case TEXT -> values.put(field.name(), Logs.truncate(reader.readString(), truncateTextAt));
        case AUDIO -> audioBytes = reader.skipLengthDelimited();
        case SAMPLE_RATE -> sampleRate = toUnsignedInt(reader.readVarint());
        case CHANNELS -> channels = toUnsignedInt(reader.readVarint());
        case JSON -> values.put(field.name(), parseJson(reader.readString()));
        default -> reader.skip(wireType);
      }
    }

    Map<String, Object> ordered = new LinkedHashMap<>();
    for (FrameSchema.FieldSpec field : schema.fields()) {
      switch (field.kind()) {
        case AUDIO -> ordered.put(field.name(), new AudioSummary(audioBytes, sampleRate, channels));
        case SAMPLE_RATE, CHANNELS -> {
          // folded into the audio summary
        }
        default -> {
          if (values.containsKey(field.name())) {
            ordered.put(field.name(), values.get(field.name()));
          }
        }
      }
    }
    return ordered;
  }

  private Object parseJson(String raw) {
    try {
      Object parsed = json.parse(raw);
      return parsed == null ? "null" : parsed;
    } catch (IllegalArgumentException ex) {
      return Logs.truncate(raw, truncateTextAt);
    }
  }

  private static int toUnsignedInt(long value) throws MalformedPayloadException {
    if (value < 0 || value > Integer.MAX_VALUE) {
      throw new MalformedPayloadException("uint32 field out of range: " + value);
    }
    return (int) value;
  }
}
