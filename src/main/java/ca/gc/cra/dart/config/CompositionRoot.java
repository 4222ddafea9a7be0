package ca.gc.cra.dart.config;

import ca.gc.cra.dart.application.pipeline.AnalyzeUseCase;
import ca.gc.cra.dart.application.port.EventSource;
import ca.gc.cra.dart.application.port.MetricsPort;
import ca.gc.cra.dart.domain.extract.LogLineTokenizer;
import ca.gc.cra.dart.domain.extract.TraceEventClassifier;
import ca.gc.cra.dart.domain.metrics.DeadlineMetricsCalculator;
import ca.gc.cra.dart.domain.report.DeadlineReportRenderer;
import ca.gc.cra.dart.infrastructure.export.MetricsJsonWriter;
import ca.gc.cra.dart.infrastructure.export.TimelineJsonWriter;
import ca.gc.cra.dart.infrastructure.json.JsonSupport;
import ca.gc.cra.dart.infrastructure.source.QlogTraceExtractor;
import ca.gc.cra.dart.infrastructure.source.TextLogExtractor;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the analyzer's adapters and domain services into an {@link AnalyzeUseCase}.
 * <p><strong>Why:</strong> Keeps construction in one place so the CLI and tests build identical graphs.</p>
 * <p><strong>Thread-safety:</strong> Holds only the metrics port; each factory call builds a new graph.</p>
 *
 * @since 0.1.0
 * @see AnalyzeUseCase
 */
public final class CompositionRoot {
  private final MetricsPort metrics;

  /**
   * Creates a composition root that discards operational metrics.
   */
  public CompositionRoot() {
    this(MetricsPort.NO_OP);
  }

  /**
   * Creates a composition root with an explicit metrics adapter.
   *
   * @param metrics metrics adapter shared by the extractors and the use case
   */
  public CompositionRoot(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Builds the analysis use case.
   *
   * @return new use case instance
   */
  public AnalyzeUseCase analyzeUseCase() {
    return new AnalyzeUseCase(
        logSources(),
        traceSources(),
        new DeadlineMetricsCalculator(),
        new DeadlineReportRenderer(),
        new MetricsJsonWriter(),
        new TimelineJsonWriter(),
        metrics);
  }

  /**
   * Factory for text log sources.
   *
   * @return log extractor
   */
  public EventSource.Factory logSources() {
    return new TextLogExtractor(new LogLineTokenizer(), metrics);
  }

  /**
   * Factory for trace document sources.
   *
   * @return trace extractor
   */
  public EventSource.Factory traceSources() {
    return new QlogTraceExtractor(new JsonSupport(), new TraceEventClassifier(), metrics);
  }

  /**
   * Supplies the metrics implementation wired into built graphs.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }
}
