/**
 * Plain-text rendering of analysis results.
 *
 * @since 0.1.0
 */
package ca.gc.cra.dart.domain.report;
