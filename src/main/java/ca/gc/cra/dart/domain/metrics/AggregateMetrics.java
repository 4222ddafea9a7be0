package ca.gc.cra.dart.domain.metrics;

/**
 * <strong>What:</strong> Aggregate deadline, drop, and completion statistics for one analysis run.
 * <p><strong>Why:</strong> Single value handed to the report renderer, the JSON exports, and any downstream
 * charting.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param totalStreams number of stream records
 * @param streamsWithDeadlines records carrying a deadline
 * @param hardDeadlines deadline-bearing records marked hard
 * @param softDeadlines deadline-bearing records marked soft
 * @param deadlinesMet decidable records whose completion duration did not exceed the deadline
 * @param deadlinesMissed decidable records whose completion duration exceeded the deadline
 * @param deadlinesUndecidable deadline-bearing records that are neither met nor missed
 * @param avgDeadlineMarginMs mean of {@code deadline - duration} over met records; {@code 0} when none
 * @param avgCompletionLatencyMs mean decidable completion duration; {@code 0} when none
 * @param deadlineComplianceRate {@code deadlinesMet / streamsWithDeadlines}; {@code 0} when no deadlines
 * @param streamsWithDrops records with at least one dropped byte
 * @param totalBytesDropped sum of dropped bytes over all records
 * @param completedStreams records marked completed
 * @param completionRate {@code completedStreams / totalStreams}; {@code 0} when no streams
 * @param totalBlockedEvents sum of stream-data-blocked events over all records
 * @param gapEventCount number of gap observations
 * @param deadlineTraceEventCount number of retained deadline trace events
 * @since 0.1.0
 */
public record AggregateMetrics(
    long totalStreams,
    long streamsWithDeadlines,
    long hardDeadlines,
    long softDeadlines,
    long deadlinesMet,
    long deadlinesMissed,
    long deadlinesUndecidable,
    double avgDeadlineMarginMs,
    double avgCompletionLatencyMs,
    double deadlineComplianceRate,
    long streamsWithDrops,
    long totalBytesDropped,
    long completedStreams,
    double completionRate,
    long totalBlockedEvents,
    long gapEventCount,
    long deadlineTraceEventCount) {

  /**
   * Compliance expressed as a percentage.
   *
   * @return {@code deadlineComplianceRate * 100}
   */
  public double compliancePercent() {
    return deadlineComplianceRate * 100.0;
  }

  /**
   * Compares compliance against a percentage target.
   *
   * @param targetPercent target in percent, e.g. {@code 95.0}
   * @return {@code true} when at least one deadline exists and compliance reaches the target
   */
  public boolean complianceTargetMet(double targetPercent) {
    return streamsWithDeadlines > 0 && compliancePercent() >= targetPercent;
  }
}
