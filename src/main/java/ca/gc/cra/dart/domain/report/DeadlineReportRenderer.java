package ca.gc.cra.dart.domain.report;

import ca.gc.cra.dart.domain.metrics.AggregateMetrics;
import ca.gc.cra.dart.domain.stream.AnalysisState;
import ca.gc.cra.dart.domain.stream.DeadlineOutcome;
import ca.gc.cra.dart.domain.stream.EventTime;
import ca.gc.cra.dart.domain.stream.StreamRecord;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> Formats the finished state and its metrics as a plain-text report.
 * <p><strong>Why:</strong> Operators diff reports between runs, so the layout and number formatting are fixed:
 * percentages and margins to one decimal, byte counts grouped by thousands, {@link Locale#ROOT} throughout.</p>
 * <p><strong>Role:</strong> Pure formatter; every number comes from {@link AggregateMetrics} or a
 * {@link StreamRecord} accessor.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class DeadlineReportRenderer {
  private static final String NL = "\n";
  private static final String MISSING = "-";
  private static final String ROW_FORMAT = "%8s  %9s  %4s  %-13s  %-13s  %9s  %-11s  %12s  %7s";

  /**
   * Renders the report.
   *
   * @param state finished aggregator state
   * @param metrics metrics computed from {@code state}
   * @param context run facts for the header
   * @return report text ending with a newline
   */
  public String render(AnalysisState state, AggregateMetrics metrics, ReportContext context) {
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(context, "context");
    StringBuilder out = new StringBuilder(2_048);

    heading(out, "DEADLINE STREAM ANALYSIS REPORT", '=');
    out.append(String.format(Locale.ROOT, "Inputs: %d log file(s), %d trace file(s), %d failed",
        context.logFiles(), context.traceFiles(), context.failedFiles())).append(NL).append(NL);

    heading(out, "SUMMARY", '-');
    line(out, "Total streams", count(metrics.totalStreams()));
    line(out, "Streams with deadlines", count(metrics.streamsWithDeadlines()));
    line(out, "  Hard deadlines", count(metrics.hardDeadlines()));
    line(out, "  Soft deadlines", count(metrics.softDeadlines()));
    out.append(NL);

    heading(out, "DEADLINE COMPLIANCE", '-');
    line(out, "Deadlines met", count(metrics.deadlinesMet()));
    line(out, "Deadlines missed", count(metrics.deadlinesMissed()));
    line(out, "Undecidable", count(metrics.deadlinesUndecidable()));
    line(out, "Compliance rate", percent(metrics.deadlineComplianceRate()));
    line(out, "Average margin", millis(metrics.avgDeadlineMarginMs()));
    line(out, "Average completion time", millis(metrics.avgCompletionLatencyMs()));
    line(out, String.format(Locale.ROOT, "Compliance target (%.1f%%)", context.complianceTargetPercent()),
        metrics.complianceTargetMet(context.complianceTargetPercent()) ? "MET" : "BELOW TARGET");
    out.append(NL);

    heading(out, "DATA DROPS", '-');
    line(out, "Streams with drops", count(metrics.streamsWithDrops()));
    line(out, "Total bytes dropped", count(metrics.totalBytesDropped()));
    line(out, "Gap events", count(metrics.gapEventCount()));
    out.append(NL);

    heading(out, "COMPLETION", '-');
    line(out, "Completed streams", count(metrics.completedStreams()));
    line(out, "Completion rate", percent(metrics.completionRate()));
    out.append(NL);

    heading(out, "TRACE EVENTS", '-');
    line(out, "Deadline trace events", count(metrics.deadlineTraceEventCount()));
    line(out, "Blocked events", count(metrics.totalBlockedEvents()));
    line(out, "Overwritten deadlines", count(state.overwrittenDeadlines()));
    out.append(NL);

    heading(out, "PER-STREAM DETAIL", '-');
    if (state.records().isEmpty()) {
      out.append("(no streams observed)").append(NL);
      return out.toString();
    }
    out.append(String.format(Locale.ROOT, ROW_FORMAT,
        "Stream", "Deadline", "Type", "Set", "Completed", "Duration", "Status", "Dropped", "Blocked")
        .stripTrailing()).append(NL);
    boolean inferred = false;
    for (StreamRecord record : state.records().values()) {
      inferred |= isInferred(record.setTime()) || isInferred(record.completionTime());
      out.append(row(record)).append(NL);
    }
    if (inferred) {
      out.append(NL).append("* time inferred: the log line carried no [HH:MM:SS] token").append(NL);
    }
    return out.toString();
  }

  private static String row(StreamRecord record) {
    OptionalLong deadline = record.deadlineMs();
    OptionalLong duration = record.completionDurationMs();
    String type = record.hard().map(hard -> hard ? "hard" : "soft").orElse(MISSING);
    return String.format(Locale.ROOT, ROW_FORMAT,
        Long.toString(record.streamId()),
        deadline.isPresent() ? deadline.getAsLong() + " ms" : MISSING,
        type,
        record.setTime().map(EventTime::toString).orElse(MISSING),
        record.completionTime().map(EventTime::toString).orElse(MISSING),
        duration.isPresent() ? duration.getAsLong() + " ms" : MISSING,
        status(record.outcome()),
        count(record.bytesDropped()),
        count(record.blockedEvents()))
        .stripTrailing();
  }

  private static String status(DeadlineOutcome outcome) {
    return outcome == DeadlineOutcome.NO_DEADLINE ? MISSING : outcome.name();
  }

  private static boolean isInferred(Optional<EventTime> time) {
    return time.map(EventTime::inferred).orElse(false);
  }

  private static void heading(StringBuilder out, String title, char underline) {
    out.append(title).append(NL).append(String.valueOf(underline).repeat(title.length())).append(NL);
  }

  private static void line(StringBuilder out, String label, String value) {
    out.append(String.format(Locale.ROOT, "%-26s: %s", label, value)).append(NL);
  }

  private static String count(long value) {
    return String.format(Locale.ROOT, "%,d", value);
  }

  private static String percent(double rate) {
    return String.format(Locale.ROOT, "%.1f%%", rate * 100.0);
  }

  private static String millis(double value) {
    return String.format(Locale.ROOT, "%.1f ms", value);
  }
}
