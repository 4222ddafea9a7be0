package ca.gc.cra.dart.infrastructure.source;

import ca.gc.cra.dart.application.port.EventSource;
import ca.gc.cra.dart.application.port.MetricsPort;
import ca.gc.cra.dart.domain.event.StreamEvent;
import ca.gc.cra.dart.domain.extract.TraceEventClassifier;
import ca.gc.cra.dart.domain.extract.TraceEventEnvelope;
import ca.gc.cra.dart.domain.stream.EventTime;
import ca.gc.cra.dart.infrastructure.json.JsonSupport;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Extracts deadline and stream-blocked events from a QLOG trace document.
 * <p><strong>Why:</strong> Protocol traces show deadline machinery and flow-control stalls that client logs do not.</p>
 * <p><strong>Role:</strong> {@link EventSource.Factory} for trace files. The whole document is parsed in
 * {@link #open(Path)}, so a malformed file fails before it yields a single event.</p>
 * <p><strong>Format:</strong> {@code {"traces": [{"events": [[time, ..., data], ...]}]}}; only the first trace is
 * read. Each tuple becomes a {@link TraceEventEnvelope}; tuples that are too short, have a non-object last element,
 * or an unusable time are skipped and counted as {@code analyze.trace.events.skipped}.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe factory; returned sources are single-consumer.</p>
 *
 * @since 0.1.0
 */
public final class QlogTraceExtractor implements EventSource.Factory {
  private static final Logger log = LoggerFactory.getLogger(QlogTraceExtractor.class);

  private final JsonSupport json;
  private final TraceEventClassifier classifier;
  private final MetricsPort metrics;

  /**
   * Creates an extractor.
   *
   * @param json JSON parser helper; must not be {@code null}
   * @param classifier envelope classifier; must not be {@code null}
   * @param metrics metrics port; must not be {@code null}
   */
  public QlogTraceExtractor(JsonSupport json, TraceEventClassifier classifier, MetricsPort metrics) {
    this.json = Objects.requireNonNull(json, "json");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Parses the document and returns its events.
   *
   * @param path trace file
   * @return source over the extracted events
   * @throws TraceFormatException when the document is not valid JSON or lacks {@code traces[0].events}
   * @throws IOException when the file cannot be read
   */
  @Override
  public EventSource open(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = json.parse(reader);
    } catch (JsonProcessingException ex) {
      throw new TraceFormatException(path, "malformed JSON: " + ex.getOriginalMessage(), ex);
    }
    List<?> rawEvents = eventsOf(path, document);
    List<StreamEvent> events = new ArrayList<>();
    int skipped = 0;
    for (Object raw : rawEvents) {
      Optional<TraceEventEnvelope> envelope = toEnvelope(raw);
      if (envelope.isEmpty()) {
        skipped++;
        metrics.increment("analyze.trace.events.skipped");
        continue;
      }
      events.addAll(classifier.classify(envelope.get()));
    }
    if (skipped > 0) {
      log.debug("Skipped {} malformed trace event(s) in {}", skipped, path);
    }
    log.debug("Extracted {} event(s) from {} trace tuple(s) in {}", events.size(), rawEvents.size(), path);
    return new ListSource(path, events);
  }

  private static List<?> eventsOf(Path path, Object document) throws TraceFormatException {
    if (!(document instanceof Map<?, ?> root)) {
      throw new TraceFormatException(path, "document root must be an object", null);
    }
    if (!(root.get("traces") instanceof List<?> traces) || traces.isEmpty()) {
      throw new TraceFormatException(path, "missing non-empty \"traces\" array", null);
    }
    if (!(traces.get(0) instanceof Map<?, ?> trace)) {
      throw new TraceFormatException(path, "traces[0] must be an object", null);
    }
    if (!(trace.get("events") instanceof List<?> events)) {
      throw new TraceFormatException(path, "missing \"events\" array in traces[0]", null);
    }
    return events;
  }

  static Optional<TraceEventEnvelope> toEnvelope(Object raw) {
    if (!(raw instanceof List<?> tuple) || tuple.size() < 2) {
      return Optional.empty();
    }
    if (!(tuple.get(tuple.size() - 1) instanceof Map<?, ?> rawData)) {
      return Optional.empty();
    }
    Optional<EventTime> time = timeOf(tuple.get(0));
    if (time.isEmpty()) {
      return Optional.empty();
    }
    Map<String, Object> data = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : rawData.entrySet()) {
      data.put(String.valueOf(entry.getKey()), entry.getValue());
    }
    String type = null;
    if (data.get("type") instanceof String declared) {
      type = declared;
    } else if (tuple.size() >= 3 && tuple.get(tuple.size() - 2) instanceof String positional) {
      type = positional;
    }
    return Optional.of(new TraceEventEnvelope(time.get(), type, data));
  }

  private static Optional<EventTime> timeOf(Object raw) {
    double millis;
    if (raw instanceof Number number) {
      millis = number.doubleValue();
    } else if (raw instanceof String text) {
      try {
        millis = Double.parseDouble(text.trim());
      } catch (NumberFormatException ex) {
        return Optional.empty();
      }
    } else {
      return Optional.empty();
    }
    if (Double.isNaN(millis) || Double.isInfinite(millis) || millis < 0) {
      return Optional.empty();
    }
    return Optional.of(EventTime.ofMillis(Math.round(millis)));
  }

  private static final class ListSource implements EventSource {
    private final Path path;
    private final Iterator<StreamEvent> iterator;

    private ListSource(Path path, List<StreamEvent> events) {
      this.path = path;
      this.iterator = List.copyOf(events).iterator();
    }

    @Override
    public StreamEvent next() {
      return iterator.hasNext() ? iterator.next() : null;
    }

    @Override
    public Path path() {
      return path;
    }

    @Override
    public void close() {
      // nothing held open
    }
  }
}
