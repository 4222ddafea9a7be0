package ca.gc.cra.dart.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each DART CLI mode.
 *
 * <p>The defaults are the lowest-precedence layer under YAML and CLI values; keys without a meaningful default
 * map to the empty string.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for {@code mode} merged over the common defaults.
   *
   * @param mode target CLI mode ({@code analyze})
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException for an unknown mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "analyze" -> buildAnalyzeDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildAnalyzeDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("logs", "");
    map.put("traces", "");
    map.put("report", "");
    map.put("metricsOut", "");
    map.put("timelineOut", "");
    map.put("logGlob", AnalyzeConfig.DEFAULT_LOG_GLOB);
    map.put("traceGlob", AnalyzeConfig.DEFAULT_TRACE_GLOB);
    map.put("readers", Integer.toString(AnalyzeConfig.DEFAULT_READERS));
    map.put("complianceTarget", Double.toString(AnalyzeConfig.DEFAULT_COMPLIANCE_TARGET));
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return map;
  }
}
