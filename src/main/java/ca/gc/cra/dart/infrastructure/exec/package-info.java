/**
 * Executor factories for the parallel file readers.
 * <p><strong>Concurrency:</strong> Readers only extract events; applying them to the aggregator stays serialized.</p>
 */
package ca.gc.cra.dart.infrastructure.exec;
