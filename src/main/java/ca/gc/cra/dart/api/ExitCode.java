package ca.gc.cra.dart.api;

/**
 * <strong>What:</strong> Process exit codes returned by DART command-line tools.
 * <p><strong>Why:</strong> Batch jobs chain the analyzer after test runs and branch on its status.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Report produced; individual input files may still have been skipped. */
  SUCCESS(0),
  /** Command-line arguments or merged configuration were invalid. */
  INVALID_ARGS(2),
  /** An input directory could not be listed or an output could not be written. */
  IO_ERROR(3),
  /** Configuration was rejected after the pipeline started. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** No input file matched; no report was produced. */
  NO_INPUT(6),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value handed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
