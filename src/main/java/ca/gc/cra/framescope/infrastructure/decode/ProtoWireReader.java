package ca.gc.cra.framescope.infrastructure.decode;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Bounds-checked reader for the protobuf binary wire format.
 * <p>Every length prefix is validated against the remaining input, so decode work is linear in the payload size
 * and never reads past the buffer.</p>
 *
 * @since 0.1.0
 */
final class ProtoWireReader {
  static final int WIRE_VARINT = 0;
  static final int WIRE_FIXED64 = 1;
  static final int WIRE_LENGTH_DELIMITED = 2;
  static final int WIRE_FIXED32 = 5;

  private static final int MAX_VARINT_BYTES = 10;

  private final ByteBuffer buffer;

  ProtoWireReader(byte[] data) {
    this(ByteBuffer.wrap(data));
  }

  private ProtoWireReader(ByteBuffer buffer) {
    this.buffer = buffer;
  }

  boolean hasRemaining() {
    return buffer.hasRemaining();
  }

  /**
   * Reads the next field key.
   *
   * @return key combining field number and wire type ({@code number << 3 | wireType})
   * @throws MalformedPayloadException on a zero field number or an unsupported wire type
   */
  int readKey() throws MalformedPayloadException {
    long key = readVarint();
    if (key > Integer.MAX_VALUE) {
      throw new MalformedPayloadException("field key out of range");
    }
    int fieldNumber = (int) (key >>> 3);
    int wireType = (int) (key & 0x7);
    if (fieldNumber == 0) {
      throw new MalformedPayloadException("field number 0 is invalid");
    }
    if (wireType != WIRE_VARINT
        && wireType != WIRE_FIXED64
        && wireType != WIRE_LENGTH_DELIMITED
        && wireType != WIRE_FIXED32) {
      throw new MalformedPayloadException("unsupported wire type " + wireType);
    }
    return (int) key;
  }

  static int fieldNumber(int key) {
    return key >>> 3;
  }

  static int wireType(int key) {
    return key & 0x7;
  }

  long readVarint() throws MalformedPayloadException {
    long result = 0;
    for (int i = 0; i < MAX_VARINT_BYTES; i++) {
      if (!buffer.hasRemaining()) {
        throw new MalformedPayloadException("truncated varint");
      }
      byte b = buffer.get();
      result |= (long) (b & 0x7F) << (7 * i);
      if ((b & 0x80) == 0) {
        return result;
      }
    }
    throw new MalformedPayloadException("varint longer than " + MAX_VARINT_BYTES + " bytes");
  }

  byte[] readLengthDelimited() throws MalformedPayloadException {
    int length = readLength();
    byte[] out = new byte[length];
    buffer.get(out);
    return out;
  }

  /**
   * Skips a length-delimited value without copying it.
   *
   * @return number of bytes skipped
   */
  int skipLengthDelimited() throws MalformedPayloadException {
    int length = readLength();
    buffer.position(buffer.position() + length);
    return length;
  }

  private int readLength() throws MalformedPayloadException {
    long length = readVarint();
    if (length < 0 || length > buffer.remaining()) {
      throw new MalformedPayloadException(
          "length " + length + " exceeds remaining " + buffer.remaining() + " bytes");
    }
    return (int) length;
  }

  String readString() throws MalformedPayloadException {
    byte[] raw = readLengthDelimited();
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    try {
      CharBuffer chars = decoder.decode(ByteBuffer.wrap(raw));
      return chars.toString();
    } catch (CharacterCodingException ex) {
      throw new MalformedPayloadException("string field is not valid UTF-8");
    }
  }

  void skip(int wireType) throws MalformedPayloadException {
    switch (wireType) {
      case WIRE_VARINT -> readVarint();
      case WIRE_FIXED64 -> advance(8);
      case WIRE_LENGTH_DELIMITED -> skipLengthDelimited();
      case WIRE_FIXED32 -> advance(4);
      default -> throw new MalformedPayloadException("cannot skip wire type " + wireType);
    }
  }

  private void advance(int count) throws MalformedPayloadException {
    if (buffer.remaining() < count) {
      throw new MalformedPayloadException("truncated fixed-width field");
    }
    buffer.position(buffer.position() + count);
  }
}
