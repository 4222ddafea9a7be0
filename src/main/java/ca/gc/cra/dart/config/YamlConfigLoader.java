package ca.gc.cra.dart.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads DART configuration from YAML.
 *
 * <p>The document holds a {@code common} section and one section per CLI mode. Both are flattened into
 * dotted keys, the mode section winning over {@code common}:</p>
 * <pre>{@code
 * common:
 *   metricsExporter: none
 * analyze:
 *   logs: ./runs/42/logs
 *   traces: ./runs/42/qlog
 *   complianceTarget: 97.5
 * }</pre>
 */
public final class YamlConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlConfigLoader.class);
  private static final Set<String> KNOWN_SECTIONS = Set.of("common", "analyze");

  private YamlConfigLoader() {}

  /**
   * Loads {@code path} and returns the flattened settings for {@code mode}.
   *
   * @param path location of the YAML configuration
   * @param mode CLI mode ({@code analyze})
   * @return flattened settings, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or a section is not a mapping
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    String normalizedMode = mode.trim().toLowerCase(Locale.ROOT);
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path + ": " + ex.getMessage(), ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    Map<String, Object> root = asMap(document, "root");
    Map<String, Object> sections = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      String section = entry.getKey().trim().toLowerCase(Locale.ROOT);
      if (!KNOWN_SECTIONS.contains(section)) {
        log.warn("Ignoring unknown YAML section '{}' in {}", entry.getKey(), path);
        continue;
      }
      sections.put(section, entry.getValue());
    }

    Map<String, String> flattened = new LinkedHashMap<>();
    flattenSection(sections.get("common"), "common", flattened);
    flattenSection(sections.get(normalizedMode), normalizedMode, flattened);
    return Optional.of(Map.copyOf(flattened));
  }

  private static void flattenSection(Object section, String name, Map<String, String> target) {
    if (section == null) {
      return;
    }
    flatten(asMap(section, name), "", target);
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException(context + " section contains a blank or non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String composite = prefix.isEmpty() ? entry.getKey() : prefix + '.' + entry.getKey();
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML lists are not supported for key " + composite);
      } else {
        target.put(composite, value.toString());
      }
    }
  }
}
