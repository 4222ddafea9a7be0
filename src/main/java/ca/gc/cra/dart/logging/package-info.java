/**
 * <strong>Purpose:</strong> Runtime verbosity control and log hygiene for the analyzer.
 * <p><strong>Concurrency:</strong> Stateless helpers; level changes are expected once at CLI startup.
 * <p><strong>Observability:</strong> Backed by SLF4J with Logback as the binding.
 *
 * @since 0.1.0
 */
package ca.gc.cra.dart.logging;
