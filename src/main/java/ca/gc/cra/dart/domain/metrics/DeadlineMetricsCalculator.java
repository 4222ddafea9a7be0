package ca.gc.cra.dart.domain.metrics;

import ca.gc.cra.dart.domain.stream.AnalysisState;
import ca.gc.cra.dart.domain.stream.DeadlineOutcome;
import ca.gc.cra.dart.domain.stream.StreamRecord;
import java.util.Objects;

/**
 * Computes {@link AggregateMetrics} from a finished {@link AnalysisState}.
 *
 * <p>Pure function. Each record is counted by its {@link StreamRecord#outcome()}; undecidable records count
 * toward neither met nor missed and contribute no margin or latency sample. Every rate and mean falls back to
 * {@code 0} on an empty denominator. The byte total saturates at {@link Long#MAX_VALUE}.</p>
 *
 * @since 0.1.0
 */
public final class DeadlineMetricsCalculator {

  /**
   * Computes the metrics.
   *
   * @param state finished aggregator state; must not be {@code null}
   * @return aggregate metrics
   */
  public AggregateMetrics compute(AnalysisState state) {
    Objects.requireNonNull(state, "state");
    long total = 0;
    long withDeadlines = 0;
    long hard = 0;
    long soft = 0;
    long met = 0;
    long missed = 0;
    long marginSum = 0;
    long latencySum = 0;
    long withDrops = 0;
    long bytesDropped = 0;
    long completed = 0;
    long blocked = 0;

    for (StreamRecord record : state.records().values()) {
      total++;
      bytesDropped = saturatedSum(bytesDropped, record.bytesDropped());
      blocked += record.blockedEvents();
      if (record.bytesDropped() > 0) {
        withDrops++;
      }
      if (record.completed()) {
        completed++;
      }
      DeadlineOutcome outcome = record.outcome();
      if (outcome == DeadlineOutcome.NO_DEADLINE) {
        continue;
      }
      withDeadlines++;
      if (record.hard().orElse(false)) {
        hard++;
      } else {
        soft++;
      }
      if (!outcome.decided()) {
        continue;
      }
      long duration = record.completionDurationMs().getAsLong();
      latencySum += duration;
      if (outcome == DeadlineOutcome.MET) {
        met++;
        marginSum += record.deadlineMs().getAsLong() - duration;
      } else {
        missed++;
      }
    }

    long decided = met + missed;
    return new AggregateMetrics(
        total,
        withDeadlines,
        hard,
        soft,
        met,
        missed,
        withDeadlines - decided,
        ratio(marginSum, met),
        ratio(latencySum, decided),
        ratio(met, withDeadlines),
        withDrops,
        bytesDropped,
        completed,
        ratio(completed, total),
        blocked,
        state.gaps().size(),
        state.deadlineTraces().size());
  }

  private static long saturatedSum(long total, long addend) {
    long sum = total + addend;
    return sum < 0 ? Long.MAX_VALUE : sum;
  }

  private static double ratio(long numerator, long denominator) {
    return denominator > 0 ? (double) numerator / denominator : 0.0;
  }
}
