package ca.gc.cra.dart.domain.extract;

import ca.gc.cra.dart.domain.stream.EventTime;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Typed view of one positional trace event tuple {@code [time, ..., data]}.
 *
 * <p>Built at the parse boundary so nothing else depends on the tuple layout.</p>
 *
 * @param time event time rounded to whole milliseconds
 * @param type event type; from {@code data.type}, else the tuple's event-type slot; may be {@code null}
 * @param data event-data object; never {@code null}
 * @since 0.1.0
 */
public record TraceEventEnvelope(EventTime time, String type, Map<String, Object> data) {

  /**
   * Validates the envelope.
   */
  public TraceEventEnvelope {
    time = Objects.requireNonNull(time, "time");
    data = Objects.requireNonNull(data, "data");
  }

  /**
   * Reads {@code data.stream_id}, accepting JSON integers and numeric strings.
   *
   * @return non-negative stream id, empty when absent or malformed
   */
  public OptionalLong streamId() {
    Object raw = data.get("stream_id");
    long value;
    if (raw instanceof Number number) {
      double asDouble = number.doubleValue();
      if (asDouble != Math.rint(asDouble)) {
        return OptionalLong.empty();
      }
      value = number.longValue();
    } else if (raw instanceof String text) {
      try {
        value = Long.parseLong(text.trim());
      } catch (NumberFormatException ex) {
        return OptionalLong.empty();
      }
    } else {
      return OptionalLong.empty();
    }
    return value < 0 ? OptionalLong.empty() : OptionalLong.of(value);
  }
}
