/**
 * Command-line entry points for DART.
 * <p><strong>Role:</strong> Driving adapter; parses arguments, merges configuration, configures logging and
 * telemetry, and invokes the analysis use case.</p>
 * <p><strong>Concurrency:</strong> Commands run on the main thread; parallel readers are owned by the use case.</p>
 * <p><strong>Output:</strong> Usage, dry-run plans, and console reports go through
 * {@link ca.gc.cra.dart.api.CliPrinter}; diagnostics go through SLF4J.</p>
 */
package ca.gc.cra.dart.api;
