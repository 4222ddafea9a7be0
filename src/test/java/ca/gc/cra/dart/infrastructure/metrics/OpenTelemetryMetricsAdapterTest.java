package ca.gc.cra.dart.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> KEY_ATTRIBUTE = AttributeKey.stringKey("dart.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementExportsCounterWithServiceResource() {
    adapter.increment("analyze.files.log");
    adapter.increment("analyze.files.log");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "analyze.files.log")
        .orElseThrow(() -> new AssertionError("Expected counter to be exported"));
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("analyze.files.log", point.getAttributes().get(KEY_ATTRIBUTE));
    assertEquals("dart", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertTrue(adapter.isExporting());
  }

  @Test
  void observeRecordsHistogramSamples() {
    adapter.observe("analyze.file.events", 3L);
    adapter.observe("analyze.file.events", 7L);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "analyze.file.events")
        .orElseThrow(() -> new AssertionError("Expected histogram to be exported"));
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(10.0, point.getSum());
  }

  @Test
  void sanitizesInvalidInstrumentNames() {
    assertEquals("m9lines", OpenTelemetryMetricsAdapter.sanitizeName("9Lines"));
    assertEquals("analyze.trace_skipped", OpenTelemetryMetricsAdapter.sanitizeName("analyze.trace skipped"));
    assertEquals("dart.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  @Test
  void exporterNoneIsNoop() {
    try (OpenTelemetryMetricsAdapter disabled = new OpenTelemetryMetricsAdapter(TelemetrySettings.disabled())) {
      disabled.increment("analyze.files.log");
      assertFalse(disabled.isExporting());
    }
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}
