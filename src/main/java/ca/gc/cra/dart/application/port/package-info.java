/**
 * <strong>Purpose:</strong> Ports between the analysis pipeline and its adapters.
 * <p><strong>Pipeline role:</strong> Extractors implement {@link ca.gc.cra.dart.application.port.EventSource};
 * metrics adapters implement {@link ca.gc.cra.dart.application.port.MetricsPort}.
 * <p><strong>Concurrency:</strong> Event sources are single-consumer; metrics ports are thread-safe.
 *
 * @since 0.1.0
 */
package ca.gc.cra.dart.application.port;
