package ca.gc.cra.dart.application.pipeline;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Raised when discovery finds neither log nor trace files; no report is produced.
 *
 * @since 0.1.0
 */
public final class NothingToAnalyzeException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception for the scanned directories.
   *
   * @param logs scanned log directory
   * @param logGlob glob applied to {@code logs}
   * @param traces scanned trace directory, if any
   * @param traceGlob glob applied to {@code traces}
   */
  public NothingToAnalyzeException(Path logs, String logGlob, Optional<Path> traces, String traceGlob) {
    super("nothing to analyze: no files matching " + logGlob + " in " + logs
        + traces.map(dir -> " and no files matching " + traceGlob + " in " + dir).orElse(""));
  }
}
