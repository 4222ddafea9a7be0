package ca.gc.cra.dart.domain.stream;

import java.util.Locale;

/**
 * <strong>What:</strong> Canonical point in time on the run-local clock, in whole milliseconds.
 * <p><strong>Why:</strong> Client logs carry wall-clock {@code HH:MM:SS} tokens while traces carry relative
 * milliseconds; both are converted here at the extraction boundary so nothing downstream compares strings.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param millis milliseconds since the start of the run-local clock; never negative
 * @param inferred {@code true} when the source carried no timestamp and the sentinel was substituted
 * @since 0.1.0
 */
public record EventTime(long millis, boolean inferred) implements Comparable<EventTime> {
  /** Sentinel substituted when a matched log line carries no bracketed time token. */
  public static final EventTime SENTINEL = new EventTime(0L, true);

  private static final long SECOND = 1_000L;
  private static final long MINUTE = 60 * SECOND;
  private static final long HOUR = 60 * MINUTE;

  /**
   * Validates the millisecond offset.
   *
   * @throws IllegalArgumentException if {@code millis} is negative
   */
  public EventTime {
    if (millis < 0) {
      throw new IllegalArgumentException("millis must be >= 0 (was " + millis + ")");
    }
  }

  /**
   * Builds a time from an explicit millisecond offset.
   *
   * @param millis milliseconds on the run-local clock
   * @return observed (non-inferred) time
   */
  public static EventTime ofMillis(long millis) {
    return new EventTime(millis, false);
  }

  /**
   * Builds a time from clock components as printed in client logs.
   *
   * @param hours hour of day, 0-23
   * @param minutes minute, 0-59
   * @param seconds second, 0-59
   * @return observed time at the given clock position
   * @throws IllegalArgumentException if any component is out of range
   */
  public static EventTime ofClock(int hours, int minutes, int seconds) {
    if (hours < 0 || hours > 23 || minutes < 0 || minutes > 59 || seconds < 0 || seconds > 59) {
      throw new IllegalArgumentException(
          "clock out of range: " + hours + ":" + minutes + ":" + seconds);
    }
    return ofMillis(hours * HOUR + minutes * MINUTE + seconds * SECOND);
  }

  /**
   * Returns {@code other - this} in milliseconds; negative when {@code other} precedes this time.
   *
   * @param other later time
   * @return signed elapsed milliseconds
   */
  public long until(EventTime other) {
    return other.millis - millis;
  }

  /**
   * Formats as {@code HH:MM:SS}, or {@code HH:MM:SS.mmm} when the value has a sub-second part.
   *
   * @return clock rendering; hours grow past 23 for long traces
   */
  public String format() {
    long hours = millis / HOUR;
    long minutes = (millis % HOUR) / MINUTE;
    long seconds = (millis % MINUTE) / SECOND;
    long fraction = millis % SECOND;
    if (fraction == 0) {
      return String.format(Locale.ROOT, "%02d:%02d:%02d", hours, minutes, seconds);
    }
    return String.format(Locale.ROOT, "%02d:%02d:%02d.%03d", hours, minutes, seconds, fraction);
  }

  @Override
  public int compareTo(EventTime other) {
    return Long.compare(millis, other.millis);
  }

  @Override
  public String toString() {
    return inferred ? format() + "*" : format();
  }
}
