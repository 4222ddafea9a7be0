package ca.gc.cra.dart.application.port;

import ca.gc.cra.dart.domain.event.StreamEvent;
import java.io.IOException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Pull-style sequence of events extracted from one input file.
 * <p><strong>Role:</strong> Port implemented by the text-log and trace extractors.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one consumer per source.</p>
 *
 * @since 0.1.0
 */
public interface EventSource extends AutoCloseable {
  /**
   * Returns the next event or {@code null} when depleted.
   *
   * @return next event, {@code null} at end of input
   * @throws IOException if reading fails
   */
  StreamEvent next() throws IOException;

  /**
   * Returns the file backing this source.
   *
   * @return input path
   */
  Path path();

  @Override
  void close() throws IOException;

  /**
   * Opens event sources for one input format.
   */
  @FunctionalInterface
  interface Factory {
    /**
     * Opens a source over {@code path}.
     *
     * @param path input file
     * @return opened source; caller closes
     * @throws IOException if the file cannot be opened or, for whole-document formats, parsed
     */
    EventSource open(Path path) throws IOException;
  }
}
