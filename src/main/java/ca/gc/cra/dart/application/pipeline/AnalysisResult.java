package ca.gc.cra.dart.application.pipeline;

import ca.gc.cra.dart.domain.metrics.AggregateMetrics;
import ca.gc.cra.dart.domain.stream.AnalysisState;
import java.util.List;
import java.util.Objects;

/**
 * Output of one analysis run.
 *
 * @param state finished aggregator state
 * @param metrics metrics computed over {@code state}
 * @param outcomes per-file outcomes in processing order
 * @since 0.1.0
 */
public record AnalysisResult(AnalysisState state, AggregateMetrics metrics, List<FileOutcome> outcomes) {
  public AnalysisResult {
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(metrics, "metrics");
    outcomes = List.copyOf(outcomes);
  }

  /**
   * Counts processed files of the given kind, failed ones included.
   *
   * @param kind evidence kind
   * @return file count
   */
  public int fileCount(SourceKind kind) {
    return (int) outcomes.stream().filter(outcome -> outcome.input().kind() == kind).count();
  }

  /**
   * Counts files that contributed no events because they failed.
   *
   * @return failed file count
   */
  public int failedFileCount() {
    return (int) outcomes.stream().filter(FileOutcome::isFailed).count();
  }
}
