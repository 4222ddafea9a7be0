/**
 * Aggregate statistics over the finished per-stream state.
 *
 * @since 0.1.0
 */
package ca.gc.cra.dart.domain.metrics;
