package ca.gc.cra.dart.infrastructure.source;

import ca.gc.cra.dart.application.port.EventSource;
import ca.gc.cra.dart.application.port.MetricsPort;
import ca.gc.cra.dart.domain.event.StreamEvent;
import ca.gc.cra.dart.domain.extract.LogLine;
import ca.gc.cra.dart.domain.extract.LogLineTokenizer;
import ca.gc.cra.dart.logging.Logs;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Streams deadline, drop, and completion events out of a client log file.
 * <p><strong>Why:</strong> Client logs are the only record of when deadlines were set and streams completed.</p>
 * <p><strong>Role:</strong> {@link EventSource.Factory} for text logs; each {@link #open(Path)} reads one file
 * lazily, line by line.</p>
 * <p><strong>Thread-safety:</strong> The factory is thread-safe; returned sources are single-consumer.</p>
 * <p><strong>Observability:</strong> Counts {@code analyze.lines.read} and {@code analyze.lines.matched}; unmatched
 * lines are echoed (truncated) at DEBUG.</p>
 *
 * @implNote Logs are decoded as UTF-8 with malformed bytes replaced, since client output may contain binary noise.
 * @since 0.1.0
 */
public final class TextLogExtractor implements EventSource.Factory {
  private static final Logger log = LoggerFactory.getLogger(TextLogExtractor.class);
  private static final int MAX_ECHO_BYTES = 256;

  private final LogLineTokenizer tokenizer;
  private final MetricsPort metrics;

  /**
   * Creates an extractor.
   *
   * @param tokenizer line tokenizer; must not be {@code null}
   * @param metrics metrics port; must not be {@code null}
   */
  public TextLogExtractor(LogLineTokenizer tokenizer, MetricsPort metrics) {
    this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public EventSource open(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    BufferedReader reader = new BufferedReader(new InputStreamReader(
        Files.newInputStream(path),
        StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE)));
    return new LineSource(path, reader);
  }

  private final class LineSource implements EventSource {
    private final Path path;
    private final BufferedReader reader;

    private LineSource(Path path, BufferedReader reader) {
      this.path = path;
      this.reader = reader;
    }

    @Override
    public StreamEvent next() throws IOException {
      String line;
      while ((line = reader.readLine()) != null) {
        metrics.increment("analyze.lines.read");
        LogLine token = tokenizer.tokenize(line);
        if (token.recognized()) {
          metrics.increment("analyze.lines.matched");
          return token.toEvent().orElseThrow();
        }
        if (log.isDebugEnabled()) {
          log.debug("Skipping unrecognized line: {}", Logs.truncate(line, MAX_ECHO_BYTES));
        }
      }
      return null;
    }

    @Override
    public Path path() {
      return path;
    }

    @Override
    public void close() throws IOException {
      reader.close();
    }
  }
}
