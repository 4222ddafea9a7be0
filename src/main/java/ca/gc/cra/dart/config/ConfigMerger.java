package ca.gc.cra.dart.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Layers analyzer settings: embedded defaults, then the YAML {@code analyze} section, then command-line flags.
 * The merged map is checked once before it is handed to {@link AnalyzeConfig}.
 */
public final class ConfigMerger {
  private static final Set<String> BOOLEAN_KEYS = Set.of("allowOverwrite", "dryRun", "verbose");

  private ConfigMerger() {}

  /**
   * Produces the settings for one run. A flag that also appears in YAML wins and is reported through
   * {@code warn}.
   *
   * @param mode subcommand whose rules apply, currently only {@code analyze}
   * @param yaml settings read from {@code --config}, if any
   * @param cli flag values; {@code null} means none
   * @param defaults values from {@link DefaultsForMode}
   * @param warn receives one message per shadowed YAML key; may be {@code null}
   * @return read-only view of the layered settings
   * @throws IllegalArgumentException when a layered value is out of range or malformed
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> fromYaml = yaml.orElse(Map.of());

    Map<String, String> layered = new LinkedHashMap<>();
    if (defaults != null) {
      layered.putAll(defaults);
    }
    layered.putAll(fromYaml);
    if (cli != null) {
      cli.forEach((key, value) -> {
        if (key == null || value == null) {
          return;
        }
        if (warn != null && fromYaml.containsKey(key)) {
          warn.accept("Command-line value replaces YAML setting '" + key + "'");
        }
        layered.put(key, value);
      });
    }

    validate(mode, layered);
    return Map.copyOf(layered);
  }

  private static void validate(String mode, Map<String, String> effective) {
    if ("analyze".equalsIgnoreCase(mode)) {
      if (trim(effective.get("logs")).isEmpty()) {
        throw new IllegalArgumentException("logs is required for analyze");
      }
      requireIntegerRange(effective, "readers", AnalyzeConfig.MIN_READERS, AnalyzeConfig.MAX_READERS);
      requirePercent(effective, "complianceTarget");
    }
    for (String key : BOOLEAN_KEYS) {
      String value = trim(effective.get(key)).toLowerCase(Locale.ROOT);
      if (!value.isEmpty() && !value.equals("true") && !value.equals("false")) {
        throw new IllegalArgumentException(key + " must be true or false (was '" + effective.get(key) + "')");
      }
    }
    String exporter = trim(effective.get("metricsExporter")).toLowerCase(Locale.ROOT);
    if (!exporter.isEmpty() && !exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
  }

  private static void requireIntegerRange(Map<String, String> effective, String key, int min, int max) {
    String value = trim(effective.get(key));
    if (value.isEmpty()) {
      return;
    }
    int parsed;
    try {
      parsed = Integer.parseInt(value);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + value + "')", ex);
    }
    if (parsed < min || parsed > max) {
      throw new IllegalArgumentException(key + " must be between " + min + " and " + max + " (was " + parsed + ")");
    }
  }

  private static void requirePercent(Map<String, String> effective, String key) {
    String value = trim(effective.get(key));
    if (value.isEmpty()) {
      return;
    }
    double parsed;
    try {
      parsed = Double.parseDouble(value);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a number (was '" + value + "')", ex);
    }
    if (!(parsed >= 0.0 && parsed <= 100.0)) {
      throw new IllegalArgumentException(key + " must be between 0 and 100 (was " + value + ")");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
