package ca.gc.cra.dart.domain.stream;

import ca.gc.cra.dart.domain.event.StreamEvent;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Folds extracted events from every input into one record per stream identifier.
 * <p><strong>Why:</strong> Log lines and trace events describe the same streams from different angles; the
 * aggregator is the single place where those partial observations merge.</p>
 * <p><strong>Role:</strong> Per-run owner of the record map and the two append-only event lists. A fresh instance
 * is created for each analysis so runs never share state.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create records lazily on first reference and share them across sources.</li>
 *   <li>Apply last-writer-wins deadline updates and additive drop/blocked counters.</li>
 *   <li>Seal the state on {@link #finish()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Callers applying events from several threads must hold a
 * common lock; events of one file must be applied in file order.</p>
 *
 * @implNote Additive operations are not idempotent: applying the same input twice double counts drops and blocked
 * events. Callers process each input at most once per run.
 * @since 0.1.0
 */
public final class StreamStateAggregator {
  private static final Logger log = LoggerFactory.getLogger(StreamStateAggregator.class);

  private final Map<Long, StreamRecord> records = new HashMap<>();
  private final List<GapEvent> gaps = new ArrayList<>();
  private final List<DeadlineTraceEvent> deadlineTraces = new ArrayList<>();
  private long overwrittenDeadlines;
  private AnalysisState finished;

  /**
   * Dispatches an event to the matching operation.
   *
   * @param event extracted event; must not be {@code null}
   * @throws IllegalStateException if the aggregator was already finished
   */
  public void apply(StreamEvent event) {
    Objects.requireNonNull(event, "event");
    if (event instanceof StreamEvent.DeadlineSet set) {
      deadlineSet(set.streamId(), set.deadlineMs(), set.hard(), set.time());
    } else if (event instanceof StreamEvent.Drop drop) {
      drop(drop.streamId(), drop.bytes(), drop.time());
    } else if (event instanceof StreamEvent.Completed done) {
      completed(done.streamId(), done.time());
    } else if (event instanceof StreamEvent.StreamBlocked blocked) {
      streamBlocked(blocked.streamId());
    } else if (event instanceof StreamEvent.DeadlineTrace trace) {
      deadlineTrace(trace.event());
    } else {
      throw new IllegalArgumentException("Unsupported event type: " + event.getClass().getName());
    }
  }

  /**
   * Records a deadline, replacing any earlier one for the same stream.
   *
   * @param streamId stream identifier
   * @param deadlineMs nominal deadline in milliseconds
   * @param hard {@code true} for hard deadlines
   * @param time when the deadline was set
   */
  public void deadlineSet(long streamId, long deadlineMs, boolean hard, EventTime time) {
    Objects.requireNonNull(time, "time");
    StreamRecord record = recordFor(streamId);
    if (record.deadlineMs().isPresent()
        && (record.deadlineMs().getAsLong() != deadlineMs
            || record.hard().orElse(hard) != hard
            || !record.setTime().orElse(time).equals(time))) {
      overwrittenDeadlines++;
      log.debug("Stream {} deadline overwritten: {} ms -> {} ms", streamId,
          record.deadlineMs().getAsLong(), deadlineMs);
    }
    record.setDeadline(deadlineMs, hard, time);
  }

  /**
   * Adds dropped bytes to a stream and appends a gap observation.
   *
   * @param streamId stream identifier
   * @param bytes bytes dropped; never negative
   * @param time when the drop was observed
   */
  public void drop(long streamId, long bytes, EventTime time) {
    GapEvent gap = new GapEvent(streamId, bytes, time);
    recordFor(streamId).addDropped(bytes);
    gaps.add(gap);
  }

  /**
   * Marks a stream completed at the given time.
   *
   * @param streamId stream identifier
   * @param time completion time
   */
  public void completed(long streamId, EventTime time) {
    Objects.requireNonNull(time, "time");
    recordFor(streamId).markCompleted(time);
  }

  /**
   * Counts one stream-data-blocked trace event against a stream.
   *
   * @param streamId stream identifier
   */
  public void streamBlocked(long streamId) {
    recordFor(streamId).incrementBlocked();
  }

  /**
   * Retains a deadline trace event; no stream record is touched.
   *
   * @param event trace event
   */
  public void deadlineTrace(DeadlineTraceEvent event) {
    Objects.requireNonNull(event, "event");
    ensureOpen();
    deadlineTraces.add(event);
  }

  /**
   * Number of distinct stream ids referenced so far.
   *
   * @return record count
   */
  public int streamCount() {
    return records.size();
  }

  /**
   * Seals the aggregator and returns the final state. Repeated calls return the same state.
   *
   * @return immutable analysis state
   */
  public AnalysisState finish() {
    if (finished == null) {
      finished = new AnalysisState(new TreeMap<>(records), gaps, deadlineTraces, overwrittenDeadlines);
      log.debug("Aggregator finished with {} streams, {} gaps, {} deadline trace events",
          records.size(), gaps.size(), deadlineTraces.size());
    }
    return finished;
  }

  private StreamRecord recordFor(long streamId) {
    ensureOpen();
    return records.computeIfAbsent(streamId, StreamRecord::new);
  }

  private void ensureOpen() {
    if (finished != null) {
      throw new IllegalStateException("aggregator already finished");
    }
  }
}
