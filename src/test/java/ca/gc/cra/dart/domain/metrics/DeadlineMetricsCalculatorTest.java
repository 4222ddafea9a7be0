package ca.gc.cra.dart.domain.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dart.domain.stream.AnalysisState;
import ca.gc.cra.dart.domain.stream.EventTime;
import ca.gc.cra.dart.domain.stream.StreamStateAggregator;
import org.junit.jupiter.api.Test;

class DeadlineMetricsCalculatorTest {
  private final DeadlineMetricsCalculator calculator = new DeadlineMetricsCalculator();

  @Test
  void completionWithinDeadlineIsMetWithMargin() {
    StreamStateAggregator aggregator = new StreamStateAggregator();
    aggregator.deadlineSet(1, 100, true, EventTime.ofMillis(0));
    aggregator.completed(1, EventTime.ofMillis(80));

    AggregateMetrics metrics = calculator.compute(aggregator.finish());

    assertEquals(1L, metrics.deadlinesMet());
    assertEquals(0L, metrics.deadlinesMissed());
    assertEquals(20.0, metrics.avgDeadlineMarginMs(), 1e-9);
    assertEquals(80.0, metrics.avgCompletionLatencyMs(), 1e-9);
    assertEquals(1.0, metrics.deadlineComplianceRate(), 1e-9);
  }

  @Test
  void completionPastDeadlineIsMissed() {
    StreamStateAggregator aggregator = new StreamStateAggregator();
    aggregator.deadlineSet(1, 50, false, EventTime.ofMillis(0));
    aggregator.completed(1, EventTime.ofMillis(80));

    AggregateMetrics metrics = calculator.compute(aggregator.finish());

    assertEquals(0L, metrics.deadlinesMet());
    assertEquals(1L, metrics.deadlinesMissed());
    assertEquals(1L, metrics.softDeadlines());
    assertEquals(0.0, metrics.avgDeadlineMarginMs(), 1e-9);
    assertEquals(0.0, metrics.deadlineComplianceRate(), 1e-9);
  }

  @Test
  void completionExactlyAtDeadlineCountsAsMet() {
    StreamStateAggregator aggregator = new StreamStateAggregator();
    aggregator.deadlineSet(1, 1_000, true, EventTime.ofClock(0, 0, 1));
    aggregator.completed(1, EventTime.ofClock(0, 0, 2));

    AggregateMetrics metrics = calculator.compute(aggregator.finish());

    assertEquals(1L, metrics.deadlinesMet());
    assertEquals(0.0, metrics.avgDeadlineMarginMs(), 1e-9);
  }

  @Test
  void emptyStateYieldsZeroRatios() {
    AggregateMetrics metrics = calculator.compute(new StreamStateAggregator().finish());

    assertEquals(0L, metrics.totalStreams());
    assertEquals(0.0, metrics.deadlineComplianceRate(), 1e-9);
    assertEquals(0.0, metrics.completionRate(), 1e-9);
    assertEquals(0.0, metrics.avgCompletionLatencyMs(), 1e-9);
    assertFalse(Double.isNaN(metrics.avgDeadlineMarginMs()));
  }

  @Test
  void completionBeforeSetTimeIsUndecidable() {
    StreamStateAggregator aggregator = new StreamStateAggregator();
    aggregator.deadlineSet(4, 100, true, EventTime.ofClock(0, 0, 1));
    aggregator.drop(4, 20, EventTime.ofClock(0, 0, 3));
    aggregator.completed(4, EventTime.SENTINEL);

    AggregateMetrics metrics = calculator.compute(aggregator.finish());

    assertEquals(1L, metrics.totalStreams());
    assertEquals(1L, metrics.streamsWithDeadlines());
    assertEquals(1L, metrics.hardDeadlines());
    assertEquals(1L, metrics.streamsWithDrops());
    assertEquals(20L, metrics.totalBytesDropped());
    assertEquals(1.0, metrics.completionRate(), 1e-9);
    assertEquals(0L, metrics.deadlinesMet());
    assertEquals(0L, metrics.deadlinesMissed());
    assertEquals(1L, metrics.deadlinesUndecidable());
  }

  @Test
  void inferredSetTimeBeforeStampedCompletionIsUndecidable() {
    StreamStateAggregator aggregator = new StreamStateAggregator();
    aggregator.deadlineSet(1, 100, true, EventTime.SENTINEL);
    aggregator.completed(1, EventTime.ofClock(0, 0, 2));

    AggregateMetrics metrics = calculator.compute(aggregator.finish());

    assertEquals(0L, metrics.deadlinesMet());
    assertEquals(0L, metrics.deadlinesMissed());
    assertEquals(1L, metrics.deadlinesUndecidable());
    assertEquals(0.0, metrics.avgCompletionLatencyMs(), 1e-9);
  }

  @Test
  void twoInferredTimesDoNotProduceZeroDurationMet() {
    StreamStateAggregator aggregator = new StreamStateAggregator();
    aggregator.deadlineSet(1, 500, false, EventTime.SENTINEL);
    aggregator.completed(1, EventTime.SENTINEL);

    AggregateMetrics metrics = calculator.compute(aggregator.finish());

    assertEquals(0L, metrics.deadlinesMet());
    assertEquals(1L, metrics.deadlinesUndecidable());
    assertEquals(0.0, metrics.avgDeadlineMarginMs(), 1e-9);
    assertEquals(0.0, metrics.deadlineComplianceRate(), 1e-9);
  }

  @Test
  void bytesDroppedTotalSaturatesAcrossStreams() {
    StreamStateAggregator aggregator = new StreamStateAggregator();
    aggregator.drop(1, Long.MAX_VALUE - 10, EventTime.ofMillis(0));
    aggregator.drop(2, 100, EventTime.ofMillis(1));

    AggregateMetrics metrics = calculator.compute(aggregator.finish());

    assertEquals(Long.MAX_VALUE, metrics.totalBytesDropped());
    assertEquals(2L, metrics.streamsWithDrops());
  }

  @Test
  void incompleteStreamsCountTowardComplianceDenominator() {
    StreamStateAggregator aggregator = new StreamStateAggregator();
    aggregator.deadlineSet(1, 100, true, EventTime.ofMillis(0));
    aggregator.completed(1, EventTime.ofMillis(40));
    aggregator.deadlineSet(2, 100, true, EventTime.ofMillis(0));
    aggregator.completed(3, EventTime.ofMillis(10));
    aggregator.streamBlocked(3);

    AnalysisState state = aggregator.finish();
    AggregateMetrics metrics = calculator.compute(state);

    assertEquals(3L, metrics.totalStreams());
    assertEquals(2L, metrics.streamsWithDeadlines());
    assertEquals(0.5, metrics.deadlineComplianceRate(), 1e-9);
    assertEquals(50.0, metrics.compliancePercent(), 1e-9);
    assertEquals(2.0 / 3.0, metrics.completionRate(), 1e-9);
    assertEquals(1L, metrics.totalBlockedEvents());
    assertTrue(metrics.complianceTargetMet(50.0));
    assertFalse(metrics.complianceTargetMet(95.0));
  }
}
