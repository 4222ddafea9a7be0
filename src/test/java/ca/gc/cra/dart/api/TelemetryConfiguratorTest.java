package ca.gc.cra.dart.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.dart.infrastructure.metrics.TelemetrySettings;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {

  @Test
  void defaultsToDisabled() {
    TelemetrySettings settings = TelemetryConfigurator.settings(Map.of("metricsExporter", ""));

    assertEquals(TelemetrySettings.Exporter.NONE, settings.exporter());
    assertEquals(TelemetrySettings.DEFAULT_ENDPOINT, settings.endpoint());
  }

  @Test
  void otlpCarriesEndpointAndAttributes() {
    TelemetrySettings settings = TelemetryConfigurator.settings(Map.of(
        "metricsExporter", "otlp",
        "otelEndpoint", "https://collector.example:4317",
        "otelResourceAttributes", "deployment.environment=test"));

    assertEquals(TelemetrySettings.Exporter.OTLP, settings.exporter());
    assertEquals("https://collector.example:4317", settings.endpoint());
    assertEquals("deployment.environment=test", settings.resourceAttributes());
  }

  @Test
  void rejectsBadEndpointAndAttributes() {
    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.settings(
        Map.of("metricsExporter", "otlp", "otelEndpoint", "ftp://collector:21")));
    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.settings(
        Map.of("metricsExporter", "otlp", "otelResourceAttributes", "team=café")));
  }
}
