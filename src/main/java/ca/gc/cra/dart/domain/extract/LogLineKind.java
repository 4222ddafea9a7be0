package ca.gc.cra.dart.domain.extract;

/**
 * Grammar recognized for a single client log line.
 *
 * @since 0.1.0
 */
public enum LogLineKind {
  /** {@code Set deadline on stream <id>: <ms> ms (hard|soft)}. */
  DEADLINE_SET,
  /** {@code Stream <id>: Dropped <n> bytes}. */
  DROP,
  /** {@code Stream <id> completed}. */
  COMPLETED,
  /** Anything else; mixed operational output is expected and skipped. */
  UNRECOGNIZED
}
