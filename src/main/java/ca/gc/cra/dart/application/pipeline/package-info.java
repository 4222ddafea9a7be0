/**
 * The analysis use case: discovery, extraction, aggregation, metrics, and publication of one run.
 * <p>Create a fresh {@link ca.gc.cra.dart.application.pipeline.AnalyzeUseCase} result per CLI invocation; the
 * aggregator behind each run is sealed once metrics are computed.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.dart.application.pipeline;
