package ca.gc.cra.dart.infrastructure.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dart.application.port.EventSource;
import ca.gc.cra.dart.application.port.MetricsPort;
import ca.gc.cra.dart.domain.event.StreamEvent;
import ca.gc.cra.dart.domain.extract.TraceEventClassifier;
import ca.gc.cra.dart.domain.extract.TraceEventEnvelope;
import ca.gc.cra.dart.infrastructure.json.JsonSupport;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class QlogTraceExtractorTest {

  @TempDir Path tempDir;

  private final QlogTraceExtractor extractor =
      new QlogTraceExtractor(new JsonSupport(), new TraceEventClassifier(), MetricsPort.NO_OP);

  @Test
  void extractsDeadlineAndBlockedEvents() throws Exception {
    Path trace = write("run.qlog", """
        {"qlog_version": "0.3", "traces": [{"events": [
          [0, "transport", "packet_sent", {"length": 1200}],
          [12.4, "transport", "deadline_expired", {"stream_id": 4}],
          [15, "transport", "stream_data_blocked", {"stream_id": 4}],
          [20, {"type": "stream_deadline_set", "stream_id": 8}],
          ["oops", "transport", "stream_data_blocked", {"stream_id": 1}],
          [30]
        ]}]}
        """);

    List<StreamEvent> events = drain(trace);

    assertEquals(3, events.size());
    StreamEvent.DeadlineTrace expired = assertInstanceOf(StreamEvent.DeadlineTrace.class, events.get(0));
    assertEquals("deadline_expired", expired.event().type());
    assertEquals(12L, expired.time().millis());
    StreamEvent.StreamBlocked blocked = assertInstanceOf(StreamEvent.StreamBlocked.class, events.get(1));
    assertEquals(4L, blocked.streamId());
    StreamEvent.DeadlineTrace declared = assertInstanceOf(StreamEvent.DeadlineTrace.class, events.get(2));
    assertEquals("stream_deadline_set", declared.event().type());
  }

  @Test
  void emptyEventArrayIsValid() throws Exception {
    Path trace = write("empty.qlog", "{\"traces\": [{\"events\": []}]}");

    assertTrue(drain(trace).isEmpty());
  }

  @Test
  void malformedJsonIsTraceFormatError() throws Exception {
    Path trace = write("broken.qlog", "{\"traces\": [");

    TraceFormatException ex = assertThrows(TraceFormatException.class, () -> extractor.open(trace));
    assertEquals(trace, ex.path());
  }

  @Test
  void missingTracesOrEventsIsTraceFormatError() throws Exception {
    assertThrows(TraceFormatException.class, () -> extractor.open(write("a.qlog", "[]")));
    assertThrows(TraceFormatException.class, () -> extractor.open(write("b.qlog", "{\"traces\": []}")));
    assertThrows(TraceFormatException.class,
        () -> extractor.open(write("c.qlog", "{\"traces\": [{\"title\": \"x\"}]}")));
  }

  @Test
  void envelopePrefersDeclaredTypeOverPositional() {
    TraceEventEnvelope envelope = QlogTraceExtractor.toEnvelope(
        List.of(5, "recovery", "packet_lost", Map.of("type", "deadline_missed"))).orElseThrow();

    assertEquals("deadline_missed", envelope.type());
    assertEquals(5L, envelope.time().millis());
    assertTrue(QlogTraceExtractor.toEnvelope(List.of(-1, "x", Map.of())).isEmpty());
    assertTrue(QlogTraceExtractor.toEnvelope(Map.of("time", 1)).isEmpty());
  }

  private Path write(String name, String content) throws Exception {
    return Files.writeString(tempDir.resolve(name), content, StandardCharsets.UTF_8);
  }

  private List<StreamEvent> drain(Path path) throws Exception {
    List<StreamEvent> events = new ArrayList<>();
    try (EventSource source = extractor.open(path)) {
      StreamEvent event;
      while ((event = source.next()) != null) {
        events.add(event);
      }
    }
    return events;
  }
}
