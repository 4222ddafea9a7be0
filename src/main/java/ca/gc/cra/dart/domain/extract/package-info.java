/**
 * Source-format knowledge: the client log line grammars and the trace event envelope.
 * <p>I/O lives in {@code ca.gc.cra.dart.infrastructure.source}; these types only turn text and parsed JSON into
 * {@link ca.gc.cra.dart.domain.event.StreamEvent}s.
 *
 * @since 0.1.0
 */
package ca.gc.cra.dart.domain.extract;
