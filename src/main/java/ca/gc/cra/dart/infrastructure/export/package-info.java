/**
 * JSON exports of the metrics and timeline data for the external reporting and charting tools.
 * <p><strong>Concurrency:</strong> Writers are stateless apart from a shared, thread-safe {@code JsonFactory}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.dart.infrastructure.export;
