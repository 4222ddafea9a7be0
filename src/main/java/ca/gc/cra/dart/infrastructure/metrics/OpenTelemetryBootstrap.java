package ca.gc.cra.dart.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.io.IOException;
import java.io.InputStream;
import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for an analyzer run.
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.dart";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
  private static final AttributeKey<String> SERVICE_INSTANCE_ID = AttributeKey.stringKey("service.instance.id");
  private static final String POM_PROPERTIES = "/META-INF/maven/ca.gc.cra/dart/pom.properties";
  private static final long SHUTDOWN_WAIT_SECONDS = 5;

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  static BootstrapResult initialize(TelemetrySettings settings) {
    Objects.requireNonNull(settings, "settings");
    if (settings.exporter() == TelemetrySettings.Exporter.NONE) {
      log.debug("OpenTelemetry metrics exporter disabled (metricsExporter=none)");
      return BootstrapResult.noop();
    }
    try {
      String version = detectServiceVersion();
      Resource resource = buildResource(version, parseResourceAttributes(settings.resourceAttributes()));
      OtlpGrpcMetricExporter exporter =
          OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build();
      MetricReader reader = PeriodicMetricReader.builder(exporter).setInterval(EXPORT_INTERVAL).build();
      BootstrapResult result = build(reader, resource, version);
      log.info("OpenTelemetry metrics initialized with exporter {} targeting {}",
          settings.exporter(), settings.endpoint());
      return result;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; continuing without export", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    Objects.requireNonNull(reader, "reader");
    String version = detectServiceVersion();
    return build(reader, buildResource(version, Attributes.empty()), version);
  }

  private static BootstrapResult build(MetricReader reader, Resource resource, String version) {
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
        .setInstrumentationVersion(version)
        .build();
    return BootstrapResult.active(provider, meter);
  }

  private static Resource buildResource(String version, Attributes additional) {
    AttributesBuilder attributes = Attributes.builder()
        .put(SERVICE_NAME, "dart")
        .put(SERVICE_NAMESPACE, "ca.gc.cra")
        .put(SERVICE_VERSION, version)
        .put(SERVICE_INSTANCE_ID, hostIdentity());
    return Resource.getDefault()
        .merge(Resource.create(attributes.build()))
        .merge(Resource.create(additional));
  }

  /** Parses {@code key=value,key=value}; entries without both halves are logged and skipped. */
  static Attributes parseResourceAttributes(String raw) {
    AttributesBuilder builder = Attributes.builder();
    if (raw == null) {
      return builder.build();
    }
    for (String entry : raw.split(",")) {
      if (entry.isBlank()) {
        continue;
      }
      String[] pair = entry.split("=", 2);
      String key = pair[0].trim();
      String value = pair.length == 2 ? pair[1].trim() : "";
      if (key.isEmpty() || value.isEmpty()) {
        log.warn("Skipping resource attribute '{}': expected key=value", entry.trim());
        continue;
      }
      builder.put(AttributeKey.stringKey(key), value);
    }
    return builder.build();
  }

  private static String hostIdentity() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Host name unavailable; using JVM runtime name", ex);
      return ManagementFactory.getRuntimeMXBean().getName();
    }
  }

  private static String detectServiceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String manifestVersion = pkg == null ? null : pkg.getImplementationVersion();
    if (manifestVersion != null && !manifestVersion.isBlank()) {
      return manifestVersion;
    }
    Properties props = new Properties();
    try (InputStream in = OpenTelemetryBootstrap.class.getResourceAsStream(POM_PROPERTIES)) {
      if (in != null) {
        props.load(in);
      }
    } catch (IOException ex) {
      log.debug("Unable to read {}", POM_PROPERTIES, ex);
    }
    return props.getProperty("version", "0.0.0-dev");
  }

  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(null, null);
    }

    static BootstrapResult active(SdkMeterProvider provider, Meter meter) {
      return new BootstrapResult(Objects.requireNonNull(meter, "meter"), provider);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return meter == null;
    }

    void forceFlush() {
      if (provider != null) {
        await(provider.forceFlush(), "flush");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      try {
        await(provider.shutdown(), "shutdown");
      } catch (RuntimeException ex) {
        log.warn("OpenTelemetry meter provider shutdown failed", ex);
      }
    }

    private static void await(CompletableResultCode pending, String operation) {
      if (!pending.join(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS).isSuccess()) {
        log.warn("OpenTelemetry metrics {} did not complete within {}s", operation, SHUTDOWN_WAIT_SECONDS);
      }
    }
  }
}
