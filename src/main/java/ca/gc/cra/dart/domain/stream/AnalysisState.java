package ca.gc.cra.dart.domain.stream;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Finalized aggregator state handed to metrics, reporting, and exports.
 *
 * <p>The collections are unmodifiable and the owning aggregator is sealed, so the records no longer change.</p>
 *
 * @param records stream records keyed and ordered by ascending stream id
 * @param gaps gap observations in application order
 * @param deadlineTraces deadline trace events in application order
 * @param overwrittenDeadlines number of deadline-set events that replaced an earlier, different deadline
 * @since 0.1.0
 */
public record AnalysisState(
    SortedMap<Long, StreamRecord> records,
    List<GapEvent> gaps,
    List<DeadlineTraceEvent> deadlineTraces,
    long overwrittenDeadlines) {

  /**
   * Wraps the collections in unmodifiable views.
   */
  public AnalysisState {
    records = Collections.unmodifiableSortedMap(new TreeMap<>(Objects.requireNonNull(records, "records")));
    gaps = List.copyOf(Objects.requireNonNull(gaps, "gaps"));
    deadlineTraces = List.copyOf(Objects.requireNonNull(deadlineTraces, "deadlineTraces"));
  }

  /**
   * Looks up a record by id.
   *
   * @param streamId stream identifier
   * @return record or {@code null} when the id was never referenced
   */
  public StreamRecord record(long streamId) {
    return records.get(streamId);
  }
}
