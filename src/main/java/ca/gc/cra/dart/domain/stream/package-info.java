/**
 * <strong>Purpose:</strong> Per-stream state reconstructed from client logs and protocol traces.
 * <p><strong>Pipeline role:</strong> Domain layer; the aggregator is the only writer of stream records and seals them
 * into an {@link ca.gc.cra.dart.domain.stream.AnalysisState} once every input is consumed.
 * <p><strong>Concurrency:</strong> Single writer. Value types are immutable.
 * <p><strong>Time:</strong> All timestamps are {@link ca.gc.cra.dart.domain.stream.EventTime} milliseconds on a
 * run-local clock.
 *
 * @since 0.1.0
 */
package ca.gc.cra.dart.domain.stream;
