package ca.gc.cra.dart.api;

import ca.gc.cra.dart.application.pipeline.AnalysisResult;
import ca.gc.cra.dart.application.pipeline.AnalyzeUseCase;
import ca.gc.cra.dart.application.pipeline.FileOutcome;
import ca.gc.cra.dart.application.pipeline.InputFile;
import ca.gc.cra.dart.application.pipeline.NothingToAnalyzeException;
import ca.gc.cra.dart.application.pipeline.SourceKind;
import ca.gc.cra.dart.config.AnalyzeConfig;
import ca.gc.cra.dart.config.CompositionRoot;
import ca.gc.cra.dart.config.ConfigMerger;
import ca.gc.cra.dart.config.DefaultsForMode;
import ca.gc.cra.dart.config.YamlConfigLoader;
import ca.gc.cra.dart.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.dart.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.dart.logging.LoggingConfigurator;
import ca.gc.cra.dart.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for analyzing client logs and trace documents for deadline compliance.
 *
 * @since 0.1.0
 */
public final class AnalyzeCli {
  private static final Logger log = LoggerFactory.getLogger(AnalyzeCli.class);
  private static final Set<String> SUPPORTED_FLAGS =
      Set.of("--help", "--verbose", "--dry-run", "--allow-overwrite");
  static final String NOTHING_TO_ANALYZE = "nothing to analyze";
  private static final String SUMMARY_USAGE =
      "usage: analyze logs=DIR [traces=DIR] [report=FILE] [metricsOut=FILE] [timelineOut=FILE] "
          + "[logGlob=GLOB] [traceGlob=GLOB] [readers=1-64] [complianceTarget=PERCENT] [config=YAML] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...] "
          + "[--dry-run] [--allow-overwrite] [--verbose]";
  private static final String HELP_TEXT = """
      DART analyze: deadline compliance from client logs and qlog traces

      Usage:
        analyze logs=./run/logs traces=./run/qlog [options]

      Required:
        logs=DIR                   Directory of client log files

      Optional:
        traces=DIR                 Directory of qlog trace documents
        report=FILE                Write the text report here instead of stdout
        metricsOut=FILE            Write aggregate metrics as JSON
        timelineOut=FILE           Write per-stream spans, drops, and deadline trace events as JSON
        logGlob=GLOB               Log file-name pattern (default *.log)
        traceGlob=GLOB             Trace file-name pattern (default *.qlog)
        readers=N                  Files extracted in parallel, 1-64 (default 1)
        complianceTarget=PERCENT   Compliance the report judges against (default 95.0)
        config=FILE                YAML with 'common' and 'analyze' sections; CLI values win
        metricsExporter=otlp|none  Operational metrics exporter (default none)
        otelEndpoint=URL           OTLP endpoint when metricsExporter=otlp
        otelResourceAttributes=K=V Comma-separated OpenTelemetry resource attributes
        --dry-run                  Validate inputs and list matching files without analyzing
        --allow-overwrite          Replace existing report/metrics/timeline files
        --verbose                  Enable DEBUG logging
        --help                     Show this message

      Exit codes:
        0 report produced, 2 invalid arguments, 3 I/O failure, 6 nothing to analyze

      Notes:
        Files are processed in file-name order, logs before traces.
        Unreadable logs and malformed traces are skipped and counted in the report header.
      """;

  private AnalyzeCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the analyze command and returns an exit code without terminating the JVM.
   *
   * @param args raw CLI arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for analyze CLI");
    }
    List<String> unsupported = input.unsupportedFlags(SUPPORTED_FLAGS);
    if (!unsupported.isEmpty()) {
      log.error("Unknown flag(s): {}", String.join(", ", unsupported));
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> kv;
    Optional<Path> configPath;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      configPath = ConfigCliUtils.extractConfigPath(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath.isPresent()) {
      Path yamlPath = configPath.get();
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, "analyze");
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    AnalyzeConfig config;
    TelemetrySettings telemetry;
    try {
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          "analyze", yamlConfig, kv, DefaultsForMode.asFlatMap("analyze"), log::warn);
      if (!input.verbose() && Boolean.parseBoolean(effective.get("verbose"))) {
        LoggingConfigurator.enableVerboseLogging();
        log.debug("Verbose logging enabled by configuration");
      }
      telemetry = TelemetryConfigurator.settings(effective);
      config = AnalyzeConfig.fromMap(effective)
          .withFlags(input.hasFlag("--dry-run"), input.hasFlag("--allow-overwrite"));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid analyze arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      validatePaths(config);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid analyze path configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (config.dryRun()) {
      return dryRun(config);
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter(telemetry)) {
      AnalyzeUseCase useCase = new CompositionRoot(metrics).analyzeUseCase();
      log.info("Configured analysis: logs={}, traces={}, readers={}, metricsExporter={}",
          config.logsDirectory(),
          config.tracesDirectory().map(Path::toString).orElse("<none>"),
          config.readers(),
          telemetry.exporter());
      AnalysisResult result = useCase.analyze(config);
      String report = useCase.publish(result, config);
      if (config.reportFile().isEmpty()) {
        CliPrinter.printDocument(report);
      }
      for (FileOutcome outcome : result.outcomes()) {
        outcome.failure().ifPresent(cause ->
            log.warn("Input skipped: {} ({})", outcome.input().path(), cause));
      }
      return ExitCode.SUCCESS;
    } catch (NothingToAnalyzeException ex) {
      log.error(ex.getMessage());
      CliPrinter.println(NOTHING_TO_ANALYZE);
      return ExitCode.NO_INPUT;
    } catch (IOException ex) {
      log.error("Analysis I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Analysis configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Analysis interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure during analysis", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void validatePaths(AnalyzeConfig config) {
    boolean createParents = !config.dryRun();
    Paths.requireReadableDir("logs", config.logsDirectory());
    config.tracesDirectory().ifPresent(dir -> Paths.requireReadableDir("traces", dir));
    config.reportFile().ifPresent(path ->
        Paths.validateOutputFile("report", path, config.allowOverwrite(), createParents));
    config.metricsOut().ifPresent(path ->
        Paths.validateOutputFile("metricsOut", path, config.allowOverwrite(), createParents));
    config.timelineOut().ifPresent(path ->
        Paths.validateOutputFile("timelineOut", path, config.allowOverwrite(), createParents));
  }

  private static ExitCode dryRun(AnalyzeConfig config) {
    List<InputFile> inputs;
    try {
      inputs = new CompositionRoot().analyzeUseCase().discover(config);
    } catch (IOException ex) {
      log.error("Unable to list input directories", ex);
      return ExitCode.IO_ERROR;
    }
    List<String> lines = new ArrayList<>();
    lines.add("Analyze dry-run: no files will be read.");
    lines.add(" Logs directory    : " + config.logsDirectory() + " (" + config.logGlob() + ")");
    lines.add(" Traces directory  : "
        + config.tracesDirectory().map(dir -> dir + " (" + config.traceGlob() + ")").orElse("<none>"));
    lines.add(" Log files         : " + count(inputs, SourceKind.LOG));
    lines.add(" Trace files       : " + count(inputs, SourceKind.TRACE));
    for (InputFile file : inputs) {
      lines.add("   " + file.kind() + "  " + file.path());
    }
    lines.add(" Report            : " + config.reportFile().map(Path::toString).orElse("<stdout>"));
    lines.add(" Metrics JSON      : " + config.metricsOut().map(Path::toString).orElse("<none>"));
    lines.add(" Timeline JSON     : " + config.timelineOut().map(Path::toString).orElse("<none>"));
    lines.add(" Readers           : " + config.readers());
    lines.add(" Compliance target : " + config.complianceTarget() + "%");
    lines.add(" Allow overwrite   : " + config.allowOverwrite());
    lines.add(inputs.isEmpty()
        ? " Warning: " + NOTHING_TO_ANALYZE + "; a real run would exit with code " + ExitCode.NO_INPUT.code()
        : " Re-run without --dry-run to analyze.");
    CliPrinter.printLines(lines.toArray(String[]::new));
    return ExitCode.SUCCESS;
  }

  private static long count(List<InputFile> inputs, SourceKind kind) {
    return inputs.stream().filter(file -> file.kind() == kind).count();
  }
}
