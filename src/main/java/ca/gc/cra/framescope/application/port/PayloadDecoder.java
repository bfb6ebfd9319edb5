package ca.gc.cra.framescope.application.port;

import ca.gc.cra.framescope.domain.decode.ProtobufMessageLog;

/**
 * <strong>What:</strong> Best-effort decoder from serialized frame bytes to a readable summary.
 * <p><strong>Why:</strong> Operators inspect payloads in logs; decode results never drive control decisions.</p>
 * <p><strong>Role:</strong> Application port implemented by {@code ProtobufPayloadDecoder}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Return {@code decodable=false} for unknown tags or malformed bytes instead of throwing.</li>
 *   <li>Truncate text by characters and summarize audio; never return raw audio bytes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be stateless and safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public interface PayloadDecoder {
  /**
   * Decodes a payload against the schema registered for {@code typeTag}.
   *
   * @param typeTag frame type tag (for example {@code TranscriptionFrame})
   * @param rawBytes serialized payload; {@code null} is treated as empty
   * @return decode result; never {@code null}
   */
  ProtobufMessageLog decode(String typeTag, byte[] rawBytes);
}
