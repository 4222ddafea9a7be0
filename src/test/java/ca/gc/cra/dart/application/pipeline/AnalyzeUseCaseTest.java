package ca.gc.cra.dart.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dart.application.port.EventSource;
import ca.gc.cra.dart.application.port.MetricsPort;
import ca.gc.cra.dart.config.AnalyzeConfig;
import ca.gc.cra.dart.config.CompositionRoot;
import ca.gc.cra.dart.domain.metrics.AggregateMetrics;
import ca.gc.cra.dart.domain.metrics.DeadlineMetricsCalculator;
import ca.gc.cra.dart.domain.report.DeadlineReportRenderer;
import ca.gc.cra.dart.domain.stream.AnalysisState;
import ca.gc.cra.dart.domain.stream.EventTime;
import ca.gc.cra.dart.domain.stream.StreamRecord;
import ca.gc.cra.dart.infrastructure.export.MetricsJsonWriter;
import ca.gc.cra.dart.infrastructure.export.TimelineJsonWriter;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AnalyzeUseCaseTest {

  @TempDir Path tempDir;

  private Path logs;
  private Path traces;
  private AnalyzeUseCase useCase;

  @BeforeEach
  void setUp() throws IOException {
    logs = Files.createDirectory(tempDir.resolve("logs"));
    traces = Files.createDirectory(tempDir.resolve("qlog"));
    useCase = new CompositionRoot().analyzeUseCase();
  }

  @Test
  void singleLogFileScenario() throws Exception {
    Files.write(logs.resolve("client.log"), List.of(
        "[00:00:01] Set deadline on stream 4: 100 ms (hard)",
        "[00:00:03] Stream 4: Dropped 20 bytes due to deadline",
        "Stream 4 completed"), StandardCharsets.UTF_8);

    AnalysisResult result = useCase.analyze(config(logs, Optional.empty(), 1));

    StreamRecord record = result.state().record(4);
    assertEquals(100L, record.deadlineMs().getAsLong());
    assertTrue(record.hard().orElseThrow());
    assertEquals("00:00:01", record.setTime().orElseThrow().format());
    assertEquals(20L, record.bytesDropped());
    assertTrue(record.completed());
    assertEquals(EventTime.SENTINEL, record.completionTime().orElseThrow());

    AggregateMetrics metrics = result.metrics();
    assertEquals(1L, metrics.totalStreams());
    assertEquals(1L, metrics.streamsWithDeadlines());
    assertEquals(1L, metrics.hardDeadlines());
    assertEquals(1L, metrics.streamsWithDrops());
    assertEquals(20L, metrics.totalBytesDropped());
    assertEquals(1.0, metrics.completionRate(), 1e-9);
    assertEquals(0L, metrics.deadlinesMet());
  }

  @Test
  void correlatesLogsWithTraces() throws Exception {
    copyFixture("client.log", logs);
    copyFixture("run.qlog", traces);

    AnalysisResult result = useCase.analyze(config(logs, Optional.of(traces), 1));

    AggregateMetrics metrics = result.metrics();
    assertEquals(3L, metrics.totalStreams());
    assertEquals(2L, metrics.hardDeadlines());
    assertEquals(1L, metrics.softDeadlines());
    assertEquals(1L, metrics.deadlinesMet());
    assertEquals(1L, metrics.deadlinesMissed());
    assertEquals(1L, metrics.deadlinesUndecidable());
    assertEquals(1_000.0, metrics.avgDeadlineMarginMs(), 1e-9);
    assertEquals(1_500L, metrics.totalBytesDropped());
    assertEquals(2L, metrics.gapEventCount());
    assertEquals(2L, metrics.deadlineTraceEventCount());
    assertEquals(2L, result.state().record(4).blockedEvents());
    assertEquals(1, result.fileCount(SourceKind.LOG));
    assertEquals(1, result.fileCount(SourceKind.TRACE));
    assertEquals(0, result.failedFileCount());
  }

  @Test
  void emptyInputsAreNothingToAnalyze() {
    NothingToAnalyzeException ex = assertThrows(NothingToAnalyzeException.class,
        () -> useCase.analyze(config(logs, Optional.of(traces), 1)));

    assertTrue(ex.getMessage().startsWith("nothing to analyze"));
  }

  @Test
  void malformedTraceIsSkippedAndCounted() throws Exception {
    copyFixture("client.log", logs);
    Files.writeString(traces.resolve("a-broken.qlog"), "{\"traces\": [", StandardCharsets.UTF_8);
    copyFixture("run.qlog", traces);

    AnalysisResult result = useCase.analyze(config(logs, Optional.of(traces), 1));

    assertEquals(1, result.failedFileCount());
    FileOutcome failed = result.outcomes().get(1);
    assertTrue(failed.isFailed());
    assertEquals("a-broken.qlog", failed.input().name());
    assertEquals(2L, result.metrics().deadlineTraceEventCount());
  }

  @Test
  void unreadableLogFileFailsOnlyThatFile() throws Exception {
    Files.write(logs.resolve("a.log"), List.of(
        "[00:00:01] Set deadline on stream 1: 100 ms (hard)"), StandardCharsets.UTF_8);
    Files.write(logs.resolve("b.log"), List.of(
        "[00:00:01] Set deadline on stream 2: 100 ms (hard)",
        "[00:00:01] Stream 2: Dropped 30 bytes due to deadline"), StandardCharsets.UTF_8);
    CompositionRoot root = new CompositionRoot();
    EventSource.Factory logSources = root.logSources();
    EventSource.Factory failingOnA = path -> {
      if (path.getFileName().toString().equals("a.log")) {
        throw new IOException("disk read failed");
      }
      return logSources.open(path);
    };
    AnalyzeUseCase partial = new AnalyzeUseCase(failingOnA, root.traceSources(),
        new DeadlineMetricsCalculator(), new DeadlineReportRenderer(),
        new MetricsJsonWriter(), new TimelineJsonWriter(), MetricsPort.NO_OP);

    AnalysisResult result = partial.analyze(config(logs, Optional.empty(), 1));

    assertEquals(1, result.failedFileCount());
    FileOutcome failed = result.outcomes().get(0);
    assertTrue(failed.isFailed());
    assertEquals("a.log", failed.input().name());
    assertEquals(0L, failed.eventsApplied());
    assertEquals("disk read failed", failed.failure().orElseThrow());
    assertFalse(result.state().records().containsKey(1L));
    assertEquals(30L, result.state().record(2).bytesDropped());
    assertEquals(1L, result.metrics().totalStreams());
  }

  @Test
  void deadlineWithoutClockTokenIsUndecidable() throws Exception {
    Files.write(logs.resolve("client.log"), List.of(
        "Set deadline on stream 1: 100 ms (hard)",
        "[00:00:02] Stream 1 completed"), StandardCharsets.UTF_8);

    AggregateMetrics metrics = useCase.analyze(config(logs, Optional.empty(), 1)).metrics();

    assertEquals(0L, metrics.deadlinesMet());
    assertEquals(0L, metrics.deadlinesMissed());
    assertEquals(1L, metrics.deadlinesUndecidable());
    assertEquals(0.0, metrics.avgCompletionLatencyMs(), 1e-9);
  }

  @Test
  void parallelReadersMatchSequentialResult() throws Exception {
    for (int i = 0; i < 6; i++) {
      Files.write(logs.resolve("client-" + i + ".log"), List.of(
          "[00:00:01] Set deadline on stream " + i + ": 500 ms (hard)",
          "[00:00:01] Stream " + i + ": Dropped " + (i + 1) * 10 + " bytes",
          "[00:00:0" + (i % 3 + 1) + "] Stream " + i + " completed",
          "[00:00:05] Set deadline on stream 100: " + (i + 1) * 100 + " ms (soft)"),
          StandardCharsets.UTF_8);
    }

    AnalysisResult sequential = useCase.analyze(config(logs, Optional.empty(), 1));
    AnalysisResult parallel = useCase.analyze(config(logs, Optional.empty(), 4));

    assertEquals(sequential.metrics(), parallel.metrics());
    assertEquals(describe(sequential.state()), describe(parallel.state()));
    assertEquals(600L, parallel.state().record(100).deadlineMs().getAsLong());
    assertEquals(5L, parallel.state().overwrittenDeadlines());
  }

  @Test
  void publishWritesRequestedOutputs() throws Exception {
    copyFixture("client.log", logs);
    Path report = tempDir.resolve("out/report.txt");
    Path metricsOut = tempDir.resolve("out/metrics.json");
    Path timelineOut = tempDir.resolve("out/timeline.json");
    Files.createDirectories(report.getParent());
    AnalyzeConfig config = new AnalyzeConfig(logs, Optional.empty(), Optional.of(report),
        Optional.of(metricsOut), Optional.of(timelineOut), "*.log", "*.qlog", 1, 95.0, false, false);

    String text = useCase.publish(useCase.analyze(config), config);

    assertEquals(text, Files.readString(report, StandardCharsets.UTF_8));
    assertTrue(text.contains("Inputs: 1 log file(s), 0 trace file(s), 0 failed"));
    assertTrue(Files.readString(metricsOut, StandardCharsets.UTF_8).contains("\"total_streams\" : 3"));
    assertTrue(Files.readString(timelineOut, StandardCharsets.UTF_8).contains("\"gaps\""));
  }

  @Test
  void discoveryListsLogsBeforeTraces() throws Exception {
    copyFixture("run.qlog", traces);
    copyFixture("client.log", logs);
    Files.createFile(logs.resolve("aaa.log"));

    List<InputFile> inputs = useCase.discover(config(logs, Optional.of(traces), 1));

    assertEquals(List.of("aaa.log", "client.log", "run.qlog"),
        inputs.stream().map(InputFile::name).toList());
    assertEquals(SourceKind.TRACE, inputs.get(2).kind());
  }

  private static AnalyzeConfig config(Path logs, Optional<Path> traces, int readers) {
    return new AnalyzeConfig(logs, traces, Optional.empty(), Optional.empty(), Optional.empty(),
        AnalyzeConfig.DEFAULT_LOG_GLOB, AnalyzeConfig.DEFAULT_TRACE_GLOB, readers, 95.0, false, false);
  }

  private static String describe(AnalysisState state) {
    return state.records().values() + " " + state.gaps() + " " + state.deadlineTraces();
  }

  private void copyFixture(String name, Path directory) throws IOException {
    try (InputStream in = getClass().getResourceAsStream("/fixtures/" + name)) {
      if (in == null) {
        throw new IOException("missing test fixture " + name);
      }
      Files.copy(in, directory.resolve(name));
    }
  }
}
