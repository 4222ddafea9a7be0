package ca.gc.cra.dart.domain.report;

/**
 * Run facts printed in the report header that are not part of the stream state.
 *
 * @param logFiles log files applied
 * @param traceFiles trace files applied
 * @param failedFiles input files skipped because they could not be read or parsed
 * @param complianceTargetPercent compliance target in percent
 * @since 0.1.0
 */
public record ReportContext(int logFiles, int traceFiles, int failedFiles, double complianceTargetPercent) {

  /**
   * Validates the counts.
   */
  public ReportContext {
    if (logFiles < 0 || traceFiles < 0 || failedFiles < 0) {
      throw new IllegalArgumentException("file counts must be >= 0");
    }
    if (complianceTargetPercent < 0 || complianceTargetPercent > 100) {
      throw new IllegalArgumentException("complianceTargetPercent must be between 0 and 100");
    }
  }
}
