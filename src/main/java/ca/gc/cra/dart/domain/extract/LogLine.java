package ca.gc.cra.dart.domain.extract;

import ca.gc.cra.dart.domain.event.StreamEvent;
import ca.gc.cra.dart.domain.stream.EventTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of tokenizing one log line.
 *
 * @param kind recognized grammar
 * @param streamId stream identifier; {@code -1} for {@link LogLineKind#UNRECOGNIZED}
 * @param value deadline milliseconds for {@link LogLineKind#DEADLINE_SET}, bytes for {@link LogLineKind#DROP},
 *     otherwise {@code 0}
 * @param hard deadline hardness for {@link LogLineKind#DEADLINE_SET}, otherwise {@code false}
 * @param time bracketed time token of the line, or {@link EventTime#SENTINEL}
 * @since 0.1.0
 */
public record LogLine(LogLineKind kind, long streamId, long value, boolean hard, EventTime time) {
  private static final LogLine UNRECOGNIZED =
      new LogLine(LogLineKind.UNRECOGNIZED, -1L, 0L, false, EventTime.SENTINEL);

  /**
   * Validates the token.
   */
  public LogLine {
    kind = Objects.requireNonNull(kind, "kind");
    time = Objects.requireNonNull(time, "time");
  }

  static LogLine unrecognized() {
    return UNRECOGNIZED;
  }

  /**
   * Indicates whether the line matched one of the grammars.
   *
   * @return {@code false} for {@link LogLineKind#UNRECOGNIZED}
   */
  public boolean recognized() {
    return kind != LogLineKind.UNRECOGNIZED;
  }

  /**
   * Converts the token into the event it denotes.
   *
   * @return event, empty for unrecognized lines
   */
  public Optional<StreamEvent> toEvent() {
    return switch (kind) {
      case DEADLINE_SET -> Optional.of(new StreamEvent.DeadlineSet(streamId, value, hard, time));
      case DROP -> Optional.of(new StreamEvent.Drop(streamId, value, time));
      case COMPLETED -> Optional.of(new StreamEvent.Completed(streamId, time));
      case UNRECOGNIZED -> Optional.empty();
    };
  }
}
