/**
 * OpenTelemetry bridge for {@link ca.gc.cra.framescope.application.port.MetricsPort}.
 * <p><strong>Concurrency:</strong> Thread-safe; instruments are cached per metric key.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code observer.*} namespace. No payload contents are exported.</p>
 */
package ca.gc.cra.framescope.infrastructure.metrics;
