package ca.gc.cra.dart.config;

import ca.gc.cra.dart.validation.Numbers;
import ca.gc.cra.dart.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Effective configuration for one {@code analyze} run.
 * <p><strong>Why:</strong> Collapses CLI flags, YAML, and embedded defaults into one validated value that the
 * use case can trust.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param logsDirectory directory scanned for client log files
 * @param tracesDirectory optional directory scanned for trace documents
 * @param reportFile optional destination for the text report; stdout when empty
 * @param metricsOut optional destination for the metrics JSON export
 * @param timelineOut optional destination for the timeline JSON export
 * @param logGlob file-name glob selecting log files
 * @param traceGlob file-name glob selecting trace files
 * @param readers number of parallel file readers ({@value #MIN_READERS}-{@value #MAX_READERS})
 * @param complianceTarget compliance percentage the report judges against (0-100)
 * @param allowOverwrite whether existing output files may be replaced
 * @param dryRun whether to print the plan without reading any file
 * @since 0.1.0
 * @see ca.gc.cra.dart.application.pipeline.AnalyzeUseCase
 */
public record AnalyzeConfig(
    Path logsDirectory,
    Optional<Path> tracesDirectory,
    Optional<Path> reportFile,
    Optional<Path> metricsOut,
    Optional<Path> timelineOut,
    String logGlob,
    String traceGlob,
    int readers,
    double complianceTarget,
    boolean allowOverwrite,
    boolean dryRun) {

  public static final String DEFAULT_LOG_GLOB = "*.log";
  public static final String DEFAULT_TRACE_GLOB = "*.qlog";
  public static final int DEFAULT_READERS = 1;
  public static final int MIN_READERS = 1;
  public static final int MAX_READERS = 64;
  public static final double DEFAULT_COMPLIANCE_TARGET = 95.0;

  /**
   * Normalizes paths and enforces value ranges.
   *
   * @throws IllegalArgumentException if a value is out of range or two outputs share a path
   */
  public AnalyzeConfig {
    logsDirectory = normalizePath("logs", logsDirectory);
    tracesDirectory = normalizeOptional("traces", tracesDirectory);
    reportFile = normalizeOptional("report", reportFile);
    metricsOut = normalizeOptional("metricsOut", metricsOut);
    timelineOut = normalizeOptional("timelineOut", timelineOut);
    logGlob = Strings.requireGlob("logGlob", logGlob);
    traceGlob = Strings.requireGlob("traceGlob", traceGlob);
    Numbers.requireRange("readers", readers, MIN_READERS, MAX_READERS);
    Numbers.requireRange("complianceTarget", complianceTarget, 0.0, 100.0);
    requireDistinct(reportFile, metricsOut, "report", "metricsOut");
    requireDistinct(reportFile, timelineOut, "report", "timelineOut");
    requireDistinct(metricsOut, timelineOut, "metricsOut", "timelineOut");
  }

  /**
   * Creates a configuration from flattened key/value pairs.
   *
   * @param options effective configuration map; {@code logs} is required
   * @return validated configuration
   * @throws IllegalArgumentException when {@code logs} is missing or a value cannot be parsed
   */
  public static AnalyzeConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String logsRaw = options.get("logs");
    if (logsRaw == null || logsRaw.isBlank()) {
      throw new IllegalArgumentException("logs is required (directory of client log files)");
    }
    return new AnalyzeConfig(
        parsePath("logs", logsRaw),
        optionalPath("traces", options.get("traces")),
        optionalPath("report", options.get("report")),
        optionalPath("metricsOut", options.get("metricsOut")),
        optionalPath("timelineOut", options.get("timelineOut")),
        valueOrDefault(options.get("logGlob"), DEFAULT_LOG_GLOB),
        valueOrDefault(options.get("traceGlob"), DEFAULT_TRACE_GLOB),
        parseInt("readers", options.get("readers"), DEFAULT_READERS),
        parseDouble("complianceTarget", options.get("complianceTarget"), DEFAULT_COMPLIANCE_TARGET),
        parseBoolean(options.get("allowOverwrite"), false),
        parseBoolean(options.get("dryRun"), false));
  }

  /**
   * Returns a copy with the CLI flags applied on top.
   *
   * @param dryRunFlag {@code --dry-run} was given
   * @param allowOverwriteFlag {@code --allow-overwrite} was given
   * @return configuration with the flags OR-ed into the stored values
   */
  public AnalyzeConfig withFlags(boolean dryRunFlag, boolean allowOverwriteFlag) {
    if (!dryRunFlag && !allowOverwriteFlag) {
      return this;
    }
    return new AnalyzeConfig(
        logsDirectory,
        tracesDirectory,
        reportFile,
        metricsOut,
        timelineOut,
        logGlob,
        traceGlob,
        readers,
        complianceTarget,
        allowOverwrite || allowOverwriteFlag,
        dryRun || dryRunFlag);
  }

  private static String valueOrDefault(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value.trim();
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String trimmed = value.trim();
    if (trimmed.equalsIgnoreCase("true")) {
      return true;
    }
    if (trimmed.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException("expected true or false (was '" + value + "')");
  }

  private static int parseInt(String name, String value, int defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be an integer (was '" + value + "')", ex);
    }
  }

  private static double parseDouble(String name, String value, double defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be a number (was '" + value + "')", ex);
    }
  }

  private static Optional<Path> optionalPath(String name, String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(parsePath(name, value));
  }

  private static Path parsePath(String name, String value) {
    try {
      return Path.of(Strings.requireNonBlank(name, value)).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  private static Optional<Path> normalizeOptional(String name, Optional<Path> candidate) {
    if (candidate == null || candidate.isEmpty()) {
      return Optional.empty();
    }
    return candidate.map(path -> normalizePath(name, path));
  }

  private static Path normalizePath(String name, Path path) {
    Objects.requireNonNull(path, name + " must not be null");
    if (path.toString().indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    return path.toAbsolutePath().normalize();
  }

  private static void requireDistinct(Optional<Path> a, Optional<Path> b, String nameA, String nameB) {
    if (a.isPresent() && a.equals(b)) {
      throw new IllegalArgumentException(nameA + " and " + nameB + " must not point at the same file");
    }
  }
}
