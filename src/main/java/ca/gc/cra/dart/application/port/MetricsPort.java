package ca.gc.cra.dart.application.port;

/**
 * <strong>What:</strong> Port abstracting operational metrics emission for analysis runs.
 * <p><strong>Why:</strong> Lets the pipeline count files, lines, and events without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} serves tests and disabled export.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept updates from reader worker threads.</p>
 *
 * @implNote Metric keys use dotted names such as {@code analyze.lines.matched}; {@code null} keys are rejected.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key metric identifier; must not be {@code null}
   * @param value observed value; semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
