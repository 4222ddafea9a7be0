package ca.gc.cra.dart.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapTest {

  @Test
  void exporterNoneFallsBackToNoop() {
    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize(TelemetrySettings.disabled());

    assertTrue(result.isNoop(), "Expected noop metrics bootstrap when exporter=none");
    result.close();
  }

  @Test
  void parsesResourceAttributesAndSkipsMalformedEntries() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes(
        "deployment.environment=test, team = cra ,broken, =x");

    assertEquals("test", attributes.get(AttributeKey.stringKey("deployment.environment")));
    assertEquals("cra", attributes.get(AttributeKey.stringKey("team")));
    assertEquals(2, attributes.size());
  }

  @Test
  void exporterParsingIsStrict() {
    assertEquals(TelemetrySettings.Exporter.OTLP, TelemetrySettings.Exporter.parse(" OTLP "));
    assertEquals(TelemetrySettings.Exporter.NONE, TelemetrySettings.Exporter.parse("none"));
    assertThrows(IllegalArgumentException.class, () -> TelemetrySettings.Exporter.parse("prometheus"));
  }
}
