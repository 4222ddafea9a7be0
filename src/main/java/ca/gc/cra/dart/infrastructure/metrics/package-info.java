/**
 * OpenTelemetry bridge for the analyzer's {@link ca.gc.cra.dart.application.port.MetricsPort}.
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; parallel readers may record freely.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code analyze.*} namespace.</p>
 * <p><strong>Security:</strong> Only counts and sizes are exported, never log or trace content.</p>
 */
package ca.gc.cra.dart.infrastructure.metrics;
