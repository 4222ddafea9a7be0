/**
 * Jackson streaming helpers shared by the trace extractor.
 *
 * @since 0.1.0
 */
package ca.gc.cra.dart.infrastructure.json;
