package ca.gc.cra.dart.domain.report;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dart.domain.metrics.DeadlineMetricsCalculator;
import ca.gc.cra.dart.domain.stream.AnalysisState;
import ca.gc.cra.dart.domain.stream.EventTime;
import ca.gc.cra.dart.domain.stream.StreamStateAggregator;
import org.junit.jupiter.api.Test;

class DeadlineReportRendererTest {
  private final DeadlineReportRenderer renderer = new DeadlineReportRenderer();
  private final DeadlineMetricsCalculator calculator = new DeadlineMetricsCalculator();

  @Test
  void rendersSectionsAndPerStreamRows() {
    StreamStateAggregator aggregator = new StreamStateAggregator();
    aggregator.deadlineSet(1, 100, true, EventTime.ofMillis(0));
    aggregator.completed(1, EventTime.ofMillis(80));
    aggregator.deadlineSet(2, 50, false, EventTime.ofMillis(0));
    aggregator.completed(2, EventTime.ofMillis(80));
    aggregator.drop(2, 1_500, EventTime.ofMillis(60));
    AnalysisState state = aggregator.finish();

    String report = renderer.render(state, calculator.compute(state), new ReportContext(1, 0, 0, 95.0));

    assertTrue(report.startsWith("DEADLINE STREAM ANALYSIS REPORT\n"));
    assertTrue(report.contains("Inputs: 1 log file(s), 0 trace file(s), 0 failed"));
    assertTrue(report.contains("Total streams             : 2"));
    assertTrue(report.contains("Deadlines met             : 1"));
    assertTrue(report.contains("Deadlines missed          : 1"));
    assertTrue(report.contains("Compliance rate           : 50.0%"));
    assertTrue(report.contains("Average margin            : 20.0 ms"));
    assertTrue(report.contains("Compliance target (95.0%) : BELOW TARGET"));
    assertTrue(report.contains("Total bytes dropped       : 1,500"));
    assertTrue(report.contains("PER-STREAM DETAIL"));
    assertTrue(report.contains("MET"));
    assertTrue(report.contains("MISSED"));
    assertFalse(report.contains("time inferred"));
  }

  @Test
  void marksInferredTimesAndUndecidableStatus() {
    StreamStateAggregator aggregator = new StreamStateAggregator();
    aggregator.deadlineSet(4, 100, true, EventTime.ofClock(0, 0, 1));
    aggregator.completed(4, EventTime.SENTINEL);
    AnalysisState state = aggregator.finish();

    String report = renderer.render(state, calculator.compute(state), new ReportContext(1, 0, 0, 95.0));

    assertTrue(report.contains("00:00:00*"));
    assertTrue(report.contains("UNDECIDABLE"));
    assertTrue(report.contains("* time inferred"));
  }

  @Test
  void rowStatusAgreesWithMetricsForInferredSetTime() {
    StreamStateAggregator aggregator = new StreamStateAggregator();
    aggregator.deadlineSet(1, 100, true, EventTime.SENTINEL);
    aggregator.completed(1, EventTime.ofClock(0, 0, 2));
    AnalysisState state = aggregator.finish();

    String report = renderer.render(state, calculator.compute(state), new ReportContext(1, 0, 0, 95.0));

    assertTrue(report.contains("Deadlines missed          : 0"));
    assertTrue(report.contains("Undecidable               : 1"));
    assertTrue(report.contains("UNDECIDABLE"));
    assertFalse(report.contains("MISSED"));
  }

  @Test
  void emptyStateSaysNoStreams() {
    AnalysisState state = new StreamStateAggregator().finish();

    String report = renderer.render(state, calculator.compute(state), new ReportContext(0, 1, 1, 90.0));

    assertTrue(report.contains("Inputs: 0 log file(s), 1 trace file(s), 1 failed"));
    assertTrue(report.contains("(no streams observed)"));
  }

  @Test
  void contextRejectsOutOfRangeTarget() {
    assertThrows(IllegalArgumentException.class, () -> new ReportContext(0, 0, 0, 101.0));
    assertThrows(IllegalArgumentException.class, () -> new ReportContext(-1, 0, 0, 50.0));
  }
}
