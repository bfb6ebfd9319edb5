/**
 * Protobuf wire support for the pipeline's frame envelope: a bounds-checked reader and writer, the schema table,
 * the payload decoder and the default serializer.
 * <p><strong>Security:</strong> Treats every payload as untrusted. Lengths are checked against remaining bytes and
 * malformed input yields an undecodable result, never an exception.</p>
 */
package ca.gc.cra.framescope.infrastructure.decode;
