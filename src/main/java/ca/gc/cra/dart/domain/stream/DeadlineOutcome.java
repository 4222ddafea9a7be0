package ca.gc.cra.dart.domain.stream;

/**
 * Compliance verdict for one {@link StreamRecord}.
 *
 * @since 0.1.0
 */
public enum DeadlineOutcome {
  /** No deadline was set for the stream. */
  NO_DEADLINE,
  /** Completed no later than the deadline. */
  MET,
  /** Completed after the deadline. */
  MISSED,
  /** A deadline exists but no comparable set and completion pair does. */
  UNDECIDABLE;

  /**
   * Indicates whether the verdict counts toward met or missed.
   *
   * @return {@code true} for {@link #MET} and {@link #MISSED}
   */
  public boolean decided() {
    return this == MET || this == MISSED;
  }
}
