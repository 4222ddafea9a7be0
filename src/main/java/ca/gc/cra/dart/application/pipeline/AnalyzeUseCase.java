package ca.gc.cra.dart.application.pipeline;

import ca.gc.cra.dart.application.port.EventSource;
import ca.gc.cra.dart.application.port.MetricsPort;
import ca.gc.cra.dart.config.AnalyzeConfig;
import ca.gc.cra.dart.domain.event.StreamEvent;
import ca.gc.cra.dart.domain.metrics.AggregateMetrics;
import ca.gc.cra.dart.domain.metrics.DeadlineMetricsCalculator;
import ca.gc.cra.dart.domain.report.DeadlineReportRenderer;
import ca.gc.cra.dart.domain.report.ReportContext;
import ca.gc.cra.dart.domain.stream.AnalysisState;
import ca.gc.cra.dart.domain.stream.StreamStateAggregator;
import ca.gc.cra.dart.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.dart.infrastructure.export.MetricsJsonWriter;
import ca.gc.cra.dart.infrastructure.export.TimelineJsonWriter;
import ca.gc.cra.dart.infrastructure.source.FileDiscovery;
import ca.gc.cra.dart.infrastructure.source.TraceFormatException;
import ca.gc.cra.dart.logging.Logs;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs one deadline-compliance analysis from input directories to report.
 * <p><strong>Why:</strong> Log and trace evidence for the same streams arrives in separate files; this use case
 * folds all of it into one aggregator before any metric is computed.</p>
 * <p><strong>Role:</strong> Application-layer use case driven by the {@code analyze} CLI.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Discover log files, then trace files, each sorted by file name.</li>
 *   <li>Extract each file completely before applying any of its events, so a file that fails midway contributes
 *   nothing.</li>
 *   <li>Finish the aggregator, compute metrics, and publish the report and optional JSON exports.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Each {@link #analyze(AnalyzeConfig)} call owns a fresh aggregator. With
 * {@code readers > 1} files are extracted on a worker pool while events are applied by the calling thread in
 * discovery order, preserving per-file event order.</p>
 * <p><strong>Observability:</strong> Sets MDC {@code analyze.file} while a file is processed; counts files,
 * failures, and applied events through {@link MetricsPort}.</p>
 *
 * @implNote Re-applying a file double counts drops and blocked events, so each discovered file is processed once.
 * @since 0.1.0
 */
public final class AnalyzeUseCase {
  private static final Logger log = LoggerFactory.getLogger(AnalyzeUseCase.class);
  static final String MDC_FILE = "analyze.file";
  private static final int MAX_CAUSE_BYTES = 512;

  private final EventSource.Factory logSources;
  private final EventSource.Factory traceSources;
  private final DeadlineMetricsCalculator calculator;
  private final DeadlineReportRenderer renderer;
  private final MetricsJsonWriter metricsWriter;
  private final TimelineJsonWriter timelineWriter;
  private final MetricsPort metrics;

  /**
   * Creates the use case.
   *
   * @param logSources factory opening text log files
   * @param traceSources factory opening trace documents
   * @param calculator metrics calculator
   * @param renderer report renderer
   * @param metricsWriter metrics JSON exporter
   * @param timelineWriter timeline JSON exporter
   * @param metrics operational metrics port
   */
  public AnalyzeUseCase(
      EventSource.Factory logSources,
      EventSource.Factory traceSources,
      DeadlineMetricsCalculator calculator,
      DeadlineReportRenderer renderer,
      MetricsJsonWriter metricsWriter,
      TimelineJsonWriter timelineWriter,
      MetricsPort metrics) {
    this.logSources = Objects.requireNonNull(logSources, "logSources");
    this.traceSources = Objects.requireNonNull(traceSources, "traceSources");
    this.calculator = Objects.requireNonNull(calculator, "calculator");
    this.renderer = Objects.requireNonNull(renderer, "renderer");
    this.metricsWriter = Objects.requireNonNull(metricsWriter, "metricsWriter");
    this.timelineWriter = Objects.requireNonNull(timelineWriter, "timelineWriter");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Lists the files a run over {@code config} would process, logs first.
   *
   * @param config analysis configuration
   * @return discovered inputs in processing order
   * @throws IOException if a directory cannot be listed
   */
  public List<InputFile> discover(AnalyzeConfig config) throws IOException {
    Objects.requireNonNull(config, "config");
    List<InputFile> inputs = new ArrayList<>();
    for (Path path : FileDiscovery.discover(config.logsDirectory(), config.logGlob())) {
      inputs.add(new InputFile(path, SourceKind.LOG));
    }
    if (config.tracesDirectory().isPresent()) {
      for (Path path : FileDiscovery.discover(config.tracesDirectory().get(), config.traceGlob())) {
        inputs.add(new InputFile(path, SourceKind.TRACE));
      }
    }
    return inputs;
  }

  /**
   * Extracts and aggregates every discovered file, then computes metrics.
   *
   * @param config analysis configuration
   * @return finished state, metrics, and per-file outcomes
   * @throws NothingToAnalyzeException if no input file was discovered
   * @throws IOException if an input directory cannot be listed
   * @throws InterruptedException if interrupted while waiting for parallel readers
   */
  public AnalysisResult analyze(AnalyzeConfig config)
      throws NothingToAnalyzeException, IOException, InterruptedException {
    List<InputFile> inputs = discover(config);
    if (inputs.isEmpty()) {
      throw new NothingToAnalyzeException(
          config.logsDirectory(), config.logGlob(), config.tracesDirectory(), config.traceGlob());
    }
    log.info("Analyzing {} input file(s) with {} reader(s)", inputs.size(), config.readers());

    StreamStateAggregator aggregator = new StreamStateAggregator();
    List<FileOutcome> outcomes = config.readers() > 1 && inputs.size() > 1
        ? extractInParallel(inputs, Math.min(config.readers(), inputs.size()), aggregator)
        : extractSequentially(inputs, aggregator);

    AnalysisState state = aggregator.finish();
    AggregateMetrics computed = calculator.compute(state);
    AnalysisResult result = new AnalysisResult(state, computed, outcomes);
    log.info("Analysis finished: {} stream(s), {} deadline(s) met of {}, {} failed file(s)",
        computed.totalStreams(), computed.deadlinesMet(), computed.streamsWithDeadlines(),
        result.failedFileCount());
    if (state.overwrittenDeadlines() > 0) {
      log.warn("{} deadline(s) were set more than once for the same stream; the last value was kept",
          state.overwrittenDeadlines());
    }
    return result;
  }

  /**
   * Renders the report and writes the configured outputs.
   *
   * @param result analysis result
   * @param config analysis configuration naming the outputs
   * @return rendered report text
   * @throws IOException if an output cannot be written
   */
  public String publish(AnalysisResult result, AnalyzeConfig config) throws IOException {
    Objects.requireNonNull(result, "result");
    Objects.requireNonNull(config, "config");
    ReportContext context = new ReportContext(
        result.fileCount(SourceKind.LOG),
        result.fileCount(SourceKind.TRACE),
        result.failedFileCount(),
        config.complianceTarget());
    String report = renderer.render(result.state(), result.metrics(), context);
    if (config.reportFile().isPresent()) {
      Path target = config.reportFile().get();
      Files.writeString(target, report, StandardCharsets.UTF_8);
      log.info("Report written to {}", target);
    }
    if (config.metricsOut().isPresent()) {
      metricsWriter.write(result.metrics(), config.metricsOut().get());
      log.info("Metrics written to {}", config.metricsOut().get());
    }
    if (config.timelineOut().isPresent()) {
      timelineWriter.write(result.state(), config.timelineOut().get());
      log.info("Timeline written to {}", config.timelineOut().get());
    }
    return report;
  }

  private List<FileOutcome> extractSequentially(List<InputFile> inputs, StreamStateAggregator aggregator) {
    List<FileOutcome> outcomes = new ArrayList<>(inputs.size());
    for (InputFile input : inputs) {
      outcomes.add(applyExtraction(extract(input), aggregator));
    }
    return outcomes;
  }

  private List<FileOutcome> extractInParallel(
      List<InputFile> inputs, int readers, StreamStateAggregator aggregator) throws InterruptedException {
    ExecutorService pool = ExecutorFactories.newReaderPool(readers, "dart-reader",
        (thread, ex) -> log.error("Uncaught failure on reader thread {}", thread.getName(), ex));
    try {
      List<Future<Extraction>> futures = new ArrayList<>(inputs.size());
      for (InputFile input : inputs) {
        futures.add(pool.submit(() -> extract(input)));
      }
      List<FileOutcome> outcomes = new ArrayList<>(inputs.size());
      for (Future<Extraction> future : futures) {
        outcomes.add(applyExtraction(await(future), aggregator));
      }
      return outcomes;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Analysis interrupted; cancelling readers");
      pool.shutdownNow();
      throw ex;
    } finally {
      pool.shutdown();
    }
  }

  private static Extraction await(Future<Extraction> future) throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new IllegalStateException("reader task failed", cause);
    }
  }

  private Extraction extract(InputFile input) {
    String previous = MDC.get(MDC_FILE);
    MDC.put(MDC_FILE, input.name());
    try {
      metrics.increment(input.kind().filesCounter());
      EventSource.Factory factory = input.kind() == SourceKind.LOG ? logSources : traceSources;
      List<StreamEvent> events = new ArrayList<>();
      try (EventSource source = factory.open(input.path())) {
        StreamEvent event;
        while ((event = source.next()) != null) {
          events.add(event);
        }
      }
      log.debug("Extracted {} event(s) from {}", events.size(), input.path());
      return Extraction.of(input, events);
    } catch (TraceFormatException ex) {
      log.warn("Skipping unparsable trace file {}: {}", input.path(),
          Logs.truncate(ex.getMessage(), MAX_CAUSE_BYTES));
      return Extraction.failed(input, ex);
    } catch (IOException ex) {
      return unreadable(input, ex);
    } catch (UncheckedIOException ex) {
      return unreadable(input, ex.getCause());
    } finally {
      restoreMdc(previous);
    }
  }

  private static Extraction unreadable(InputFile input, IOException cause) {
    log.error("Skipping unreadable {} file {}", input.kind().name().toLowerCase(Locale.ROOT), input.path(), cause);
    return Extraction.failed(input, cause);
  }

  private FileOutcome applyExtraction(Extraction extraction, StreamStateAggregator aggregator) {
    InputFile input = extraction.input();
    if (extraction.failure() != null) {
      metrics.increment("analyze.files.failed");
      String cause = extraction.failure().getMessage();
      return FileOutcome.failed(input, cause == null ? extraction.failure().getClass().getSimpleName() : cause);
    }
    String previous = MDC.get(MDC_FILE);
    MDC.put(MDC_FILE, input.name());
    try {
      for (StreamEvent event : extraction.events()) {
        aggregator.apply(event);
        metrics.increment("analyze.events.applied");
      }
      metrics.observe("analyze.file.events", extraction.events().size());
      log.debug("Applied {} event(s) from {}", extraction.events().size(), input.path());
      return FileOutcome.applied(input, extraction.events().size());
    } finally {
      restoreMdc(previous);
    }
  }

  private static void restoreMdc(String previous) {
    if (previous == null) {
      MDC.remove(MDC_FILE);
    } else {
      MDC.put(MDC_FILE, previous);
    }
  }

  private record Extraction(InputFile input, List<StreamEvent> events, IOException failure) {
    static Extraction of(InputFile input, List<StreamEvent> events) {
      return new Extraction(input, List.copyOf(events), null);
    }

    static Extraction failed(InputFile input, IOException failure) {
      return new Extraction(input, List.of(), failure);
    }
  }
}
