package ca.gc.cra.dart.infrastructure.export;

import ca.gc.cra.dart.domain.metrics.AggregateMetrics;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes {@link AggregateMetrics} as a pretty-printed JSON object with snake_case keys.
 *
 * <p>Consumed by the reporting layer that summarizes many runs; key names are part of that contract.</p>
 *
 * @since 0.1.0
 */
public final class MetricsJsonWriter {
  static final int SCHEMA_VERSION = 1;

  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Writes the metrics to a file, replacing any existing content.
   *
   * @param metrics metrics to export
   * @param target destination file
   * @throws IOException if the file cannot be written
   */
  public void write(AggregateMetrics metrics, Path target) throws IOException {
    Objects.requireNonNull(target, "target");
    try (OutputStream out = Files.newOutputStream(target)) {
      write(metrics, out);
    }
  }

  /**
   * Writes the metrics to a stream. The stream is flushed but not closed.
   *
   * @param metrics metrics to export
   * @param out destination stream
   * @throws IOException if writing fails
   */
  public void write(AggregateMetrics metrics, OutputStream out) throws IOException {
    Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(out, "out");
    try (JsonGenerator gen = jsonFactory.createGenerator(out, JsonEncoding.UTF8)
        .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
        .useDefaultPrettyPrinter()) {
      gen.writeStartObject();
      gen.writeNumberField("schema_version", SCHEMA_VERSION);
      gen.writeNumberField("total_streams", metrics.totalStreams());
      gen.writeNumberField("streams_with_deadlines", metrics.streamsWithDeadlines());
      gen.writeNumberField("hard_deadlines", metrics.hardDeadlines());
      gen.writeNumberField("soft_deadlines", metrics.softDeadlines());
      gen.writeNumberField("deadlines_met", metrics.deadlinesMet());
      gen.writeNumberField("deadlines_missed", metrics.deadlinesMissed());
      gen.writeNumberField("deadlines_undecidable", metrics.deadlinesUndecidable());
      gen.writeNumberField("avg_deadline_margin", metrics.avgDeadlineMarginMs());
      gen.writeNumberField("avg_completion_latency_ms", metrics.avgCompletionLatencyMs());
      gen.writeNumberField("deadline_compliance_rate", metrics.deadlineComplianceRate());
      gen.writeNumberField("streams_with_drops", metrics.streamsWithDrops());
      gen.writeNumberField("total_bytes_dropped", metrics.totalBytesDropped());
      gen.writeNumberField("completed_streams", metrics.completedStreams());
      gen.writeNumberField("completion_rate", metrics.completionRate());
      gen.writeNumberField("total_blocked_events", metrics.totalBlockedEvents());
      gen.writeNumberField("gap_event_count", metrics.gapEventCount());
      gen.writeNumberField("deadline_trace_event_count", metrics.deadlineTraceEventCount());
      gen.writeEndObject();
    }
    out.flush();
  }
}
