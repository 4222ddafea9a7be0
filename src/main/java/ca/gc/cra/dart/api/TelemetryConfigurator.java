package ca.gc.cra.dart.api;

import ca.gc.cra.dart.infrastructure.metrics.TelemetrySettings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the telemetry keys of the effective configuration into {@link TelemetrySettings}.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Reads {@code metricsExporter}, {@code otelEndpoint}, and {@code otelResourceAttributes}.
   *
   * @param effective merged configuration
   * @return validated settings; export is disabled unless {@code metricsExporter=otlp}
   * @throws IllegalArgumentException if a value is invalid
   */
  static TelemetrySettings settings(Map<String, String> effective) {
    if (effective == null || effective.isEmpty()) {
      return TelemetrySettings.disabled();
    }
    String exporterValue = effective.getOrDefault("metricsExporter", "");
    TelemetrySettings.Exporter exporter = exporterValue.isBlank()
        ? TelemetrySettings.Exporter.NONE
        : TelemetrySettings.Exporter.parse(exporterValue);

    String endpoint = effective.getOrDefault("otelEndpoint", "").trim();
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
    }
    String resourceAttributes = effective.getOrDefault("otelResourceAttributes", "").trim();
    if (!resourceAttributes.isEmpty()) {
      requirePrintableAscii("otelResourceAttributes", resourceAttributes);
    }
    if (exporter == TelemetrySettings.Exporter.NONE && !endpoint.isEmpty()) {
      log.warn("otelEndpoint is ignored because metricsExporter=none");
    }
    log.debug("Telemetry exporter={}, endpoint={}", exporter, endpoint.isEmpty() ? "<default>" : endpoint);
    return new TelemetrySettings(exporter, endpoint, resourceAttributes);
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }

  private static void requirePrintableAscii(String name, String value) {
    if (value.length() > MAX_RESOURCE_ATTRIBUTES_LENGTH) {
      throw new IllegalArgumentException(name + " length must be <= " + MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(name + " must contain printable ASCII characters");
      }
    }
  }
}
