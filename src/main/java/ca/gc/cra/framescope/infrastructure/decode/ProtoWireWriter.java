package ca.gc.cra.framescope.infrastructure.decode;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Protobuf wire-format writer following proto3 conventions: zero numbers and empty strings or bytes are omitted.
 *
 * @since 0.1.0
 */
final class ProtoWireWriter {
  private final ByteArrayOutputStream out = new ByteArrayOutputStream();

  ProtoWireWriter writeUInt(int fieldNumber, long value) {
    if (value == 0) {
      return this;
    }
    writeKey(fieldNumber, ProtoWireReader.WIRE_VARINT);
    writeVarint(value);
    return this;
  }

  ProtoWireWriter writeString(int fieldNumber, String value) {
    if (value == null || value.isEmpty()) {
      return this;
    }
    return writeBytes(fieldNumber, value.getBytes(StandardCharsets.UTF_8));
  }

  ProtoWireWriter writeBytes(int fieldNumber, byte[] value) {
    if (value == null || value.length == 0) {
      return this;
    }
    return writeMessage(fieldNumber, value);
  }

  /** Writes a length-delimited field even when empty, as required for a set oneof member. */
  ProtoWireWriter writeMessage(int fieldNumber, byte[] encoded) {
    writeKey(fieldNumber, ProtoWireReader.WIRE_LENGTH_DELIMITED);
    writeVarint(encoded.length);
    out.writeBytes(encoded);
    return this;
  }

  byte[] toByteArray() {
    return out.toByteArray();
  }

  private void writeKey(int fieldNumber, int wireType) {
    writeVarint(((long) fieldNumber << 3) | wireType);
  }

  private void writeVarint(long value) {
    long remaining = value;
    while ((remaining & ~0x7FL) != 0) {
      out.write((int) ((remaining & 0x7F) | 0x80));
      remaining >>>= 7;
    }
    out.write((int) remaining);
  }
}
