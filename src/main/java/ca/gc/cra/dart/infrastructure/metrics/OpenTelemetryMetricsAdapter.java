package ca.gc.cra.dart.infrastructure.metrics;

import ca.gc.cra.dart.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards analyzer counters and histograms to OpenTelemetry.
 *
 * <p>Instruments are created lazily per key. When the bootstrap is a no-op the adapter drops every observation.
 * Closing the adapter flushes pending exports and shuts the meter provider down.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE =
      AttributeKey.stringKey("dart.metric.key");
  private static final String FALLBACK_METRIC_NAME = "dart.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, CounterInstrument> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, HistogramInstrument> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter for the given export settings.
   *
   * @param settings resolved telemetry settings
   */
  public OpenTelemetryMetricsAdapter(TelemetrySettings settings) {
    this(OpenTelemetryBootstrap.initialize(settings));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
  }

  /**
   * Reports whether observations are actually exported.
   *
   * @return {@code false} when running in no-op mode
   */
  public boolean isExporting() {
    return !bootstrap.isNoop();
  }

  @Override
  public void increment(String key) {
    String effectiveKey = Objects.requireNonNull(key, "key");
    if (meter == null) {
      return;
    }
    CounterInstrument instrument = counters.computeIfAbsent(effectiveKey, this::createCounter);
    instrument.counter().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    String effectiveKey = Objects.requireNonNull(key, "key");
    if (meter == null) {
      return;
    }
    HistogramInstrument instrument = histograms.computeIfAbsent(effectiveKey, this::createHistogram);
    instrument.histogram().record(value, instrument.attributes());
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.forceFlush();
    bootstrap.close();
  }

  private CounterInstrument createCounter(String key) {
    String name = sanitizeName(key);
    LongCounter counter = meter
        .counterBuilder(name)
        .setUnit("1")
        .setDescription("DART counter for " + key)
        .build();
    if (!name.equals(key)) {
      log.debug("Sanitized counter name '{}' -> '{}'", key, name);
    }
    return new CounterInstrument(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private HistogramInstrument createHistogram(String key) {
    String name = sanitizeName(key);
    LongHistogram histogram = meter
        .histogramBuilder(name)
        .ofLongs()
        .setDescription("DART observation for " + key)
        .build();
    if (!name.equals(key)) {
      log.debug("Sanitized histogram name '{}' -> '{}'", key, name);
    }
    return new HistogramInstrument(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return result.toString();
  }

  private record CounterInstrument(LongCounter counter, Attributes attributes) {}

  private record HistogramInstrument(LongHistogram histogram, Attributes attributes) {}
}
