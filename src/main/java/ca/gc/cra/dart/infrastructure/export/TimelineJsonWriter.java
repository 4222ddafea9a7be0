package ca.gc.cra.dart.infrastructure.export;

import ca.gc.cra.dart.domain.stream.AnalysisState;
import ca.gc.cra.dart.domain.stream.DeadlineTraceEvent;
import ca.gc.cra.dart.domain.stream.EventTime;
import ca.gc.cra.dart.domain.stream.GapEvent;
import ca.gc.cra.dart.domain.stream.StreamRecord;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Exports the time series a timeline chart is drawn from.
 * <p><strong>Why:</strong> Chart rendering lives outside this tool; it reads per-stream spans, drops, and deadline
 * trace events from this document.</p>
 * <p><strong>Layout:</strong>
 * <ul>
 *   <li>{@code streams}: one entry per record with deadline, set/completion times, and totals.</li>
 *   <li>{@code gaps}: gap events in application order with the running byte total of their stream.</li>
 *   <li>{@code deadline_traces}: time and type of each retained trace event (payloads are omitted).</li>
 * </ul>
 * Times are milliseconds on the run-local clock; {@code inferred} marks sentinel times.</p>
 *
 * @since 0.1.0
 */
public final class TimelineJsonWriter {
  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Writes the timeline to a file, replacing any existing content.
   *
   * @param state finished analysis state
   * @param target destination file
   * @throws IOException if the file cannot be written
   */
  public void write(AnalysisState state, Path target) throws IOException {
    Objects.requireNonNull(target, "target");
    try (OutputStream out = Files.newOutputStream(target)) {
      write(state, out);
    }
  }

  /**
   * Writes the timeline to a stream. The stream is flushed but not closed.
   *
   * @param state finished analysis state
   * @param out destination stream
   * @throws IOException if writing fails
   */
  public void write(AnalysisState state, OutputStream out) throws IOException {
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(out, "out");
    try (JsonGenerator gen = jsonFactory.createGenerator(out, JsonEncoding.UTF8)
        .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
        .useDefaultPrettyPrinter()) {
      gen.writeStartObject();
      gen.writeArrayFieldStart("streams");
      for (StreamRecord record : state.records().values()) {
        writeStream(gen, record);
      }
      gen.writeEndArray();

      gen.writeArrayFieldStart("gaps");
      Map<Long, Long> running = new HashMap<>();
      for (GapEvent gap : state.gaps()) {
        long cumulative = running.merge(gap.streamId(), gap.bytesDropped(), Long::sum);
        gen.writeStartObject();
        gen.writeNumberField("stream_id", gap.streamId());
        writeTime(gen, "time", gap.time());
        gen.writeNumberField("bytes_dropped", gap.bytesDropped());
        gen.writeNumberField("cumulative_bytes_dropped", cumulative);
        gen.writeEndObject();
      }
      gen.writeEndArray();

      gen.writeArrayFieldStart("deadline_traces");
      for (DeadlineTraceEvent trace : state.deadlineTraces()) {
        gen.writeStartObject();
        writeTime(gen, "time", trace.time());
        gen.writeStringField("type", trace.type());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
    out.flush();
  }

  private static void writeStream(JsonGenerator gen, StreamRecord record) throws IOException {
    gen.writeStartObject();
    gen.writeNumberField("stream_id", record.streamId());
    if (record.deadlineMs().isPresent()) {
      gen.writeNumberField("deadline_ms", record.deadlineMs().getAsLong());
    } else {
      gen.writeNullField("deadline_ms");
    }
    Optional<Boolean> hard = record.hard();
    if (hard.isPresent()) {
      gen.writeBooleanField("is_hard", hard.get());
    } else {
      gen.writeNullField("is_hard");
    }
    writeOptionalTime(gen, "set_time", record.setTime());
    gen.writeBooleanField("completed", record.completed());
    writeOptionalTime(gen, "completion_time", record.completionTime());
    gen.writeNumberField("bytes_dropped", record.bytesDropped());
    gen.writeNumberField("blocked_events", record.blockedEvents());
    gen.writeEndObject();
  }

  private static void writeOptionalTime(JsonGenerator gen, String field, Optional<EventTime> time)
      throws IOException {
    if (time.isPresent()) {
      writeTime(gen, field, time.get());
    } else {
      gen.writeNullField(field);
    }
  }

  private static void writeTime(JsonGenerator gen, String field, EventTime time) throws IOException {
    gen.writeObjectFieldStart(field);
    gen.writeNumberField("ms", time.millis());
    gen.writeBooleanField("inferred", time.inferred());
    gen.writeEndObject();
  }
}
