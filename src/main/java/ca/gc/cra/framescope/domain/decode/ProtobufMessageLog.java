package ca.gc.cra.framescope.domain.decode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Human-readable result of decoding one serialized frame payload.
 * <p><strong>Why:</strong> Lets operators inspect opaque protobuf bytes without the decode outcome ever affecting
 * frame counts or payload-size accounting.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param typeName type tag the payload was decoded against
 * @param decodedFields ordered field name to value or summary; empty when not decodable
 * @param byteSize length of the raw payload in bytes, recorded even when decoding fails
 * @param decodable whether the payload matched the schema for {@code typeName}
 * @since 0.1.0
 */
public record ProtobufMessageLog(
    String typeName,
    Map<String, Object> decodedFields,
    int byteSize,
    boolean decodable) {

  /**
   * Enforces the undecodable contract and copies the field map.
   *
   * @throws IllegalArgumentException if {@code byteSize} is negative or an undecodable log carries fields
   */
  public ProtobufMessageLog {
    Objects.requireNonNull(typeName, "typeName");
    if (byteSize < 0) {
      throw new IllegalArgumentException("byteSize must be >= 0");
    }
    if (!decodable && decodedFields != null && !decodedFields.isEmpty()) {
      throw new IllegalArgumentException("undecodable payloads must not carry decoded fields");
    }
    decodedFields = decodedFields == null || decodedFields.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(decodedFields));
  }

  /**
   * Builds a successful decode result.
   *
   * @param typeName type tag
   * @param fields decoded fields in schema order
   * @param byteSize raw payload size
   * @return decodable log
   */
  public static ProtobufMessageLog decoded(String typeName, Map<String, Object> fields, int byteSize) {
    return new ProtobufMessageLog(typeName, fields, byteSize, true);
  }

  /**
   * Builds the result for an unsupported type or malformed payload.
   *
   * @param typeName type tag
   * @param byteSize raw payload size
   * @return undecodable log with no fields
   */
  public static ProtobufMessageLog undecodable(String typeName, int byteSize) {
    return new ProtobufMessageLog(typeName, Map.of(), byteSize, false);
  }

  @Override
  public String toString() {
    if (!decodable) {
      return typeName + " <undecodable, " + byteSize + " bytes>";
    }
    return typeName + decodedFields + " (" + byteSize + " bytes)";
  }
}
