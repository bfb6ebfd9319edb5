/**
 * The observer core: classification, statistics, log rendering and background decode scheduling.
 * <p><strong>Role:</strong> Application layer; depends only on ports and the domain model.</p>
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.framescope.application.observer.PipelineObserver} is the only
 * entry point hosts call from pipeline threads. Statistics are guarded by a single lock in
 * {@link ca.gc.cra.framescope.application.observer.StatTracker}.</p>
 * <p><strong>Performance:</strong> The notification path does classification and two O(1) updates; formatting,
 * serialization and decoding happen on worker threads.</p>
 */
package ca.gc.cra.framescope.application.observer;
