/**
 * Immutable domain model: frames, decode results and statistics snapshots.
 * <p><strong>Concurrency:</strong> All types are immutable and safe to share across threads.</p>
 */
package ca.gc.cra.framescope.domain;
