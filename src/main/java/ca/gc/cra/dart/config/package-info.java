/**
 * Configuration for the analyzer: embedded defaults, YAML loading, CLI precedence, and the composition root.
 * <p><strong>Concurrency:</strong> Configuration values are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Paths and globs are validated through {@code ca.gc.cra.dart.validation}.</p>
 */
package ca.gc.cra.dart.config;
