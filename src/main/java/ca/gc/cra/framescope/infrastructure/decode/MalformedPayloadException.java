package ca.gc.cra.framescope.infrastructure.decode;

import java.io.IOException;

/**
 * Signals bytes that do not follow the protobuf wire format expected for a frame type.
 *
 * @since 0.1.0
 */
final class MalformedPayloadException extends IOException {
  private static final long serialVersionUID = 1L;

  MalformedPayloadException(String message) {
    super(message);
  }
}
