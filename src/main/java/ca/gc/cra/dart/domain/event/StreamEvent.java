package ca.gc.cra.dart.domain.event;

import ca.gc.cra.dart.domain.stream.DeadlineTraceEvent;
import ca.gc.cra.dart.domain.stream.EventTime;
import java.util.Objects;

/**
 * <strong>What:</strong> Closed set of typed events produced by the log and trace extractors.
 * <p><strong>Why:</strong> Both sources reduce to the same small vocabulary, so the aggregator needs no
 * knowledge of where an observation came from.</p>
 * <p><strong>Thread-safety:</strong> All variants are immutable records.</p>
 *
 * @since 0.1.0
 */
public sealed interface StreamEvent
    permits StreamEvent.DeadlineSet,
        StreamEvent.Drop,
        StreamEvent.Completed,
        StreamEvent.StreamBlocked,
        StreamEvent.DeadlineTrace {

  /**
   * Returns the time carried by the event.
   *
   * @return event time; never {@code null}
   */
  EventTime time();

  /**
   * A deadline was established for a stream.
   *
   * @param streamId stream identifier
   * @param deadlineMs nominal deadline duration in milliseconds
   * @param hard {@code true} for drop-on-miss deadlines
   * @param time when the deadline was set
   */
  record DeadlineSet(long streamId, long deadlineMs, boolean hard, EventTime time) implements StreamEvent {
    public DeadlineSet {
      requireStreamId(streamId);
      if (deadlineMs < 0) {
        throw new IllegalArgumentException("deadlineMs must be >= 0");
      }
      time = Objects.requireNonNull(time, "time");
    }
  }

  /**
   * Bytes were dropped from a stream past its deadline.
   *
   * @param streamId stream identifier
   * @param bytes number of bytes dropped
   * @param time when the drop was logged
   */
  record Drop(long streamId, long bytes, EventTime time) implements StreamEvent {
    public Drop {
      requireStreamId(streamId);
      if (bytes < 0) {
        throw new IllegalArgumentException("bytes must be >= 0");
      }
      time = Objects.requireNonNull(time, "time");
    }
  }

  /**
   * A stream finished.
   *
   * @param streamId stream identifier
   * @param time completion time
   */
  record Completed(long streamId, EventTime time) implements StreamEvent {
    public Completed {
      requireStreamId(streamId);
      time = Objects.requireNonNull(time, "time");
    }
  }

  /**
   * A {@code stream_data_blocked} trace event referenced a stream.
   *
   * @param streamId stream identifier
   * @param time trace time of the event
   */
  record StreamBlocked(long streamId, EventTime time) implements StreamEvent {
    public StreamBlocked {
      requireStreamId(streamId);
      time = Objects.requireNonNull(time, "time");
    }
  }

  /**
   * A deadline-related trace event, kept verbatim.
   *
   * @param event retained trace event
   */
  record DeadlineTrace(DeadlineTraceEvent event) implements StreamEvent {
    public DeadlineTrace {
      event = Objects.requireNonNull(event, "event");
    }

    @Override
    public EventTime time() {
      return event.time();
    }
  }

  private static void requireStreamId(long streamId) {
    if (streamId < 0) {
      throw new IllegalArgumentException("streamId must be >= 0 (was " + streamId + ")");
    }
  }
}
