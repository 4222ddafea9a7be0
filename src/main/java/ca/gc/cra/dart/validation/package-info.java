/**
 * <strong>Purpose:</strong> Validation helpers used while merging CLI and YAML configuration.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No logging; failures surface via {@link IllegalArgumentException} and map to
 * the {@code INVALID_ARGS} exit code.
 *
 * @since 0.1.0
 */
package ca.gc.cra.dart.validation;
