package ca.gc.cra.dart.infrastructure.metrics;

import java.util.Locale;
import java.util.Objects;

/**
 * Resolved OpenTelemetry export settings for one analyzer run.
 *
 * @param exporter exporter mode
 * @param endpoint OTLP endpoint used when {@code exporter} is {@link Exporter#OTLP}
 * @param resourceAttributes comma-separated {@code key=value} resource attributes; may be blank
 * @since 0.1.0
 */
public record TelemetrySettings(Exporter exporter, String endpoint, String resourceAttributes) {
  /** Endpoint used when OTLP export is enabled without an explicit endpoint. */
  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  public TelemetrySettings {
    Objects.requireNonNull(exporter, "exporter");
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
  }

  /**
   * Settings with metrics export switched off.
   *
   * @return disabled settings
   */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings(Exporter.NONE, null, null);
  }

  /** Supported metrics exporters. */
  public enum Exporter {
    OTLP,
    NONE;

    /**
     * Parses an exporter name.
     *
     * @param raw {@code otlp} or {@code none}, case-insensitive
     * @return matching exporter
     * @throws IllegalArgumentException if {@code raw} names neither exporter
     */
    public static Exporter parse(String raw) {
      String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
      return switch (normalized) {
        case "otlp" -> OTLP;
        case "none" -> NONE;
        default -> throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none' (was '" + raw + "')");
      };
    }
  }
}
