package ca.gc.cra.dart.domain.stream;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Deadline-related trace event kept verbatim for downstream inspection.
 *
 * <p>The payload is the trace's event-data object as parsed (maps, lists, strings, numbers, booleans);
 * nothing in the metrics path interprets it.</p>
 *
 * @param time event time on the trace clock
 * @param type event type as reported by the trace
 * @param rawPayload unmodifiable event-data object
 * @since 0.1.0
 */
public record DeadlineTraceEvent(EventTime time, String type, Map<String, Object> rawPayload) {

  /**
   * Copies the payload; JSON {@code null} members are kept, so {@link Map#copyOf} is not usable here.
   */
  public DeadlineTraceEvent {
    time = Objects.requireNonNull(time, "time");
    type = Objects.requireNonNull(type, "type");
    rawPayload = rawPayload == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(rawPayload));
  }
}
