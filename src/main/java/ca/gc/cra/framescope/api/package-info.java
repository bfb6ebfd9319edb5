/**
 * Command-line entry points.
 * <p><strong>Role:</strong> Driving adapter; parses {@code key=value} arguments, configures logging and telemetry,
 * and runs a replay through a freshly built observer.</p>
 * <p><strong>Concurrency:</strong> Single-threaded setup; the observer owns its worker threads.</p>
 * <p><strong>Security:</strong> Rejects control characters in arguments and validates telemetry endpoints.</p>
 */
package ca.gc.cra.framescope.api;
