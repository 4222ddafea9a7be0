/**
 * <strong>Purpose:</strong> File-backed event sources for client logs and QLOG traces, plus input discovery.
 * <p><strong>Pipeline role:</strong> Driven-side adapters implementing
 * {@link ca.gc.cra.dart.application.port.EventSource.Factory}.
 * <p><strong>Concurrency:</strong> Factories are shareable across reader threads; each source has one consumer.
 * <p><strong>Observability:</strong> Line and trace-event counters flow through the metrics port.
 *
 * @since 0.1.0
 */
package ca.gc.cra.dart.infrastructure.source;
