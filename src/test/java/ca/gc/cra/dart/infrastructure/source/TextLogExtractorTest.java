package ca.gc.cra.dart.infrastructure.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;

import ca.gc.cra.dart.application.port.EventSource;
import ca.gc.cra.dart.application.port.MetricsPort;
import ca.gc.cra.dart.domain.event.StreamEvent;
import ca.gc.cra.dart.domain.extract.LogLineTokenizer;
import ca.gc.cra.dart.domain.stream.EventTime;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TextLogExtractorTest {

  @TempDir Path tempDir;

  @Test
  void yieldsRecognizedLinesInFileOrder() throws Exception {
    Path log = tempDir.resolve("client.log");
    Files.write(log, List.of(
        "[00:00:01] Set deadline on stream 4: 100 ms (hard)",
        "connection established",
        "[00:00:03] Stream 4: Dropped 20 bytes due to deadline",
        "Stream 4 completed"), StandardCharsets.UTF_8);
    CountingMetrics metrics = new CountingMetrics();

    List<StreamEvent> events = drain(new TextLogExtractor(new LogLineTokenizer(), metrics), log);

    assertEquals(3, events.size());
    assertInstanceOf(StreamEvent.DeadlineSet.class, events.get(0));
    assertInstanceOf(StreamEvent.Drop.class, events.get(1));
    StreamEvent.Completed done = assertInstanceOf(StreamEvent.Completed.class, events.get(2));
    assertEquals(EventTime.SENTINEL, done.time());
    assertEquals(4L, metrics.counts.get("analyze.lines.read"));
    assertEquals(3L, metrics.counts.get("analyze.lines.matched"));
  }

  @Test
  void invalidUtf8IsReplacedRatherThanFailing() throws Exception {
    Path log = tempDir.resolve("binary.log");
    byte[] prefix = {(byte) 0xC3, (byte) 0x28, ' '};
    byte[] line = "Stream 2 completed\n".getBytes(StandardCharsets.US_ASCII);
    byte[] content = new byte[prefix.length + line.length];
    System.arraycopy(prefix, 0, content, 0, prefix.length);
    System.arraycopy(line, 0, content, prefix.length, line.length);
    Files.write(log, content);

    List<StreamEvent> events = drain(new TextLogExtractor(new LogLineTokenizer(), MetricsPort.NO_OP), log);

    assertEquals(1, events.size());
  }

  @Test
  void emptyFileYieldsNothing() throws Exception {
    Path log = Files.createFile(tempDir.resolve("empty.log"));

    try (EventSource source = new TextLogExtractor(new LogLineTokenizer(), MetricsPort.NO_OP).open(log)) {
      assertNull(source.next());
      assertEquals(log, source.path());
    }
  }

  private static List<StreamEvent> drain(EventSource.Factory factory, Path path) throws Exception {
    List<StreamEvent> events = new ArrayList<>();
    try (EventSource source = factory.open(path)) {
      StreamEvent event;
      while ((event = source.next()) != null) {
        events.add(event);
      }
    }
    return events;
  }

  private static final class CountingMetrics implements MetricsPort {
    private final Map<String, Long> counts = new HashMap<>();

    @Override
    public void increment(String key) {
      counts.merge(key, 1L, Long::sum);
    }

    @Override
    public void observe(String key, long value) {
      counts.merge(key, value, Long::sum);
    }
  }
}
