package ca.gc.cra.dart.domain.stream;

import java.util.Objects;

/**
 * Immutable observation of data dropped from a stream because its deadline expired.
 *
 * @param streamId stream identifier; never negative
 * @param bytesDropped bytes dropped by this observation; never negative
 * @param time time of the drop
 * @since 0.1.0
 */
public record GapEvent(long streamId, long bytesDropped, EventTime time) {

  /**
   * Validates the observation.
   */
  public GapEvent {
    if (streamId < 0) {
      throw new IllegalArgumentException("streamId must be >= 0");
    }
    if (bytesDropped < 0) {
      throw new IllegalArgumentException("bytesDropped must be >= 0");
    }
    time = Objects.requireNonNull(time, "time");
  }
}
