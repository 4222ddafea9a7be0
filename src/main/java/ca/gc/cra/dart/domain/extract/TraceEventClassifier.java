package ca.gc.cra.dart.domain.extract;

import ca.gc.cra.dart.domain.event.StreamEvent;
import ca.gc.cra.dart.domain.stream.DeadlineTraceEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalLong;

/**
 * Maps trace envelopes to stream events.
 *
 * <p>An envelope whose type mentions {@code deadline} (any case) becomes a
 * {@link StreamEvent.DeadlineTrace}; a {@code stream_data_blocked} envelope carrying a stream id becomes a
 * {@link StreamEvent.StreamBlocked}. Everything else yields nothing.</p>
 *
 * @since 0.1.0
 */
public final class TraceEventClassifier {
  static final String STREAM_DATA_BLOCKED = "stream_data_blocked";

  /**
   * Classifies one envelope.
   *
   * @param envelope parsed trace event
   * @return zero or one event
   */
  public List<StreamEvent> classify(TraceEventEnvelope envelope) {
    String type = envelope.type();
    if (type == null) {
      return List.of();
    }
    List<StreamEvent> events = new ArrayList<>(1);
    if (type.toLowerCase(Locale.ROOT).contains("deadline")) {
      events.add(new StreamEvent.DeadlineTrace(
          new DeadlineTraceEvent(envelope.time(), type, envelope.data())));
    }
    if (STREAM_DATA_BLOCKED.equals(type)) {
      OptionalLong streamId = envelope.streamId();
      if (streamId.isPresent()) {
        events.add(new StreamEvent.StreamBlocked(streamId.getAsLong(), envelope.time()));
      }
    }
    return events;
  }
}
