package ca.gc.cra.dart.domain.stream;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> Everything observed about one stream identifier across all inputs of a run.
 * <p><strong>Why:</strong> Deadline facts, drop totals, and completion facts arrive from different files and
 * sources; one shared record per identifier lets them meet.</p>
 * <p><strong>Role:</strong> Mutable entity owned by {@link StreamStateAggregator}; mutators are package-private so
 * only the aggregator can change it.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe. The aggregator serializes writers; readers must wait for
 * {@link StreamStateAggregator#finish()}.</p>
 *
 * @since 0.1.0
 */
public final class StreamRecord {
  private final long streamId;
  private Long deadlineMs;
  private Boolean hard;
  private EventTime setTime;
  private boolean completed;
  private EventTime completionTime;
  private long bytesDropped;
  private long blockedEvents;

  StreamRecord(long streamId) {
    if (streamId < 0) {
      throw new IllegalArgumentException("streamId must be >= 0 (was " + streamId + ")");
    }
    this.streamId = streamId;
  }

  /**
   * Returns the stream identifier.
   *
   * @return non-negative identifier
   */
  public long streamId() {
    return streamId;
  }

  /**
   * Returns the nominal deadline duration.
   *
   * @return deadline in milliseconds, empty when no deadline was set
   */
  public OptionalLong deadlineMs() {
    return deadlineMs == null ? OptionalLong.empty() : OptionalLong.of(deadlineMs);
  }

  /**
   * Returns whether the deadline is hard (drop on miss) or soft.
   *
   * @return hardness, empty when no deadline was set
   */
  public Optional<Boolean> hard() {
    return Optional.ofNullable(hard);
  }

  /**
   * Returns when the deadline was established.
   *
   * @return set time, empty when no deadline was set
   */
  public Optional<EventTime> setTime() {
    return Optional.ofNullable(setTime);
  }

  /**
   * Indicates whether a completion was observed.
   *
   * @return {@code true} once completed
   */
  public boolean completed() {
    return completed;
  }

  /**
   * Returns when the stream completed.
   *
   * @return completion time, empty when no completion was observed
   */
  public Optional<EventTime> completionTime() {
    return Optional.ofNullable(completionTime);
  }

  /**
   * Returns the cumulative number of bytes dropped.
   *
   * @return byte total, {@code 0} when nothing was dropped, capped at {@link Long#MAX_VALUE}
   */
  public long bytesDropped() {
    return bytesDropped;
  }

  /**
   * Returns the number of stream-data-blocked trace events seen for this stream.
   *
   * @return event count
   */
  public long blockedEvents() {
    return blockedEvents;
  }

  /**
   * Elapsed milliseconds from deadline set to completion.
   *
   * <p>Empty when either time is missing or inferred, or when completion precedes the set time. An inferred
   * time is the sentinel substituted for a log line without a clock token, so it is not a reading that can be
   * subtracted; a negative difference means the two clocks are not comparable.</p>
   *
   * @return decidable duration in milliseconds
   */
  public OptionalLong completionDurationMs() {
    if (setTime == null || completionTime == null || setTime.inferred() || completionTime.inferred()) {
      return OptionalLong.empty();
    }
    long duration = setTime.until(completionTime);
    return duration < 0 ? OptionalLong.empty() : OptionalLong.of(duration);
  }

  /**
   * Judges the stream against its deadline. A duration equal to the deadline is met.
   *
   * @return verdict; {@link DeadlineOutcome#UNDECIDABLE} when {@link #completionDurationMs()} is empty
   */
  public DeadlineOutcome outcome() {
    if (deadlineMs == null) {
      return DeadlineOutcome.NO_DEADLINE;
    }
    OptionalLong duration = completionDurationMs();
    if (duration.isEmpty()) {
      return DeadlineOutcome.UNDECIDABLE;
    }
    return duration.getAsLong() <= deadlineMs ? DeadlineOutcome.MET : DeadlineOutcome.MISSED;
  }

  void setDeadline(long deadlineMs, boolean hard, EventTime setTime) {
    this.deadlineMs = deadlineMs;
    this.hard = hard;
    this.setTime = setTime;
  }

  void markCompleted(EventTime time) {
    this.completed = true;
    this.completionTime = time;
  }

  // Saturates at Long.MAX_VALUE; both operands are non-negative.
  void addDropped(long bytes) {
    long sum = bytesDropped + bytes;
    this.bytesDropped = sum < 0 ? Long.MAX_VALUE : sum;
  }

  void incrementBlocked() {
    this.blockedEvents++;
  }

  @Override
  public String toString() {
    return "StreamRecord{id=" + streamId
        + ", deadlineMs=" + deadlineMs
        + ", hard=" + hard
        + ", setTime=" + setTime
        + ", completed=" + completed
        + ", completionTime=" + completionTime
        + ", bytesDropped=" + bytesDropped
        + ", blockedEvents=" + blockedEvents
        + '}';
  }
}
