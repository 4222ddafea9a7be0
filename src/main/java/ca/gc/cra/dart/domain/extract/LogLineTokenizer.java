package ca.gc.cra.dart.domain.extract;

import ca.gc.cra.dart.domain.stream.EventTime;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Classifies client log lines into the deadline, drop, and completion grammars.
 * <p><strong>Why:</strong> Client output interleaves these lines with unrelated diagnostics; one pass per line
 * decides which grammar applies, if any.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Match all three grammars with a single alternation so at most one can apply.</li>
 *   <li>Extract the optional bracketed {@code [HH:MM:SS]} token, falling back to {@link EventTime#SENTINEL}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; compiled patterns are shared.</p>
 *
 * @since 0.1.0
 */
public final class LogLineTokenizer {
  private static final Pattern GRAMMAR = Pattern.compile(
      "Set deadline on stream (?<setId>\\d+): (?<deadline>\\d+) ms \\((?<tag>(?i:hard|soft))\\)"
          + "|Stream (?<dropId>\\d+): Dropped (?<bytes>\\d+) bytes"
          + "|Stream (?<doneId>\\d+) completed");
  private static final Pattern CLOCK = Pattern.compile("\\[(\\d{2}):(\\d{2}):(\\d{2})\\]");

  /**
   * Tokenizes one line.
   *
   * @param line raw log line; {@code null} is treated as unrecognized
   * @return tokenized line; never {@code null}
   */
  public LogLine tokenize(String line) {
    if (line == null || line.isEmpty()) {
      return LogLine.unrecognized();
    }
    Matcher matcher = GRAMMAR.matcher(line);
    if (!matcher.find()) {
      return LogLine.unrecognized();
    }
    try {
      EventTime time = clockOf(line);
      if (matcher.group("setId") != null) {
        boolean hard = matcher.group("tag").toLowerCase(Locale.ROOT).equals("hard");
        return new LogLine(
            LogLineKind.DEADLINE_SET,
            Long.parseLong(matcher.group("setId")),
            Long.parseLong(matcher.group("deadline")),
            hard,
            time);
      }
      if (matcher.group("dropId") != null) {
        return new LogLine(
            LogLineKind.DROP,
            Long.parseLong(matcher.group("dropId")),
            Long.parseLong(matcher.group("bytes")),
            false,
            time);
      }
      return new LogLine(LogLineKind.COMPLETED, Long.parseLong(matcher.group("doneId")), 0L, false, time);
    } catch (NumberFormatException ex) {
      // digits beyond the range of long
      return LogLine.unrecognized();
    }
  }

  /**
   * Extracts the first bracketed clock token of a line.
   *
   * @param line raw log line
   * @return parsed time, or {@link EventTime#SENTINEL} when absent or out of range
   */
  static EventTime clockOf(String line) {
    Matcher matcher = CLOCK.matcher(line);
    if (!matcher.find()) {
      return EventTime.SENTINEL;
    }
    int hours = Integer.parseInt(matcher.group(1));
    int minutes = Integer.parseInt(matcher.group(2));
    int seconds = Integer.parseInt(matcher.group(3));
    if (hours > 23 || minutes > 59 || seconds > 59) {
      return EventTime.SENTINEL;
    }
    return EventTime.ofClock(hours, minutes, seconds);
  }
}
