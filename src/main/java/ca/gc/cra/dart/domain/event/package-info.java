/**
 * Typed events shared by the text-log and trace extractors and consumed by the stream aggregator.
 *
 * @since 0.1.0
 */
package ca.gc.cra.dart.domain.event;
