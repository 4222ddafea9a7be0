package ca.gc.cra.dart.infrastructure.source;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Signals a trace document that is not valid JSON or lacks the expected {@code traces[0].events} structure.
 *
 * <p>Recoverable: the file contributes no events and the run continues.</p>
 *
 * @since 0.1.0
 */
public final class TraceFormatException extends IOException {
  private static final long serialVersionUID = 1L;

  private final transient Path path;

  /**
   * Creates an exception for the given document.
   *
   * @param path offending trace file
   * @param message what was wrong
   * @param cause underlying parser failure; may be {@code null}
   */
  public TraceFormatException(Path path, String message, Throwable cause) {
    super(Objects.requireNonNull(path, "path") + ": " + message, cause);
    this.path = path;
  }

  /**
   * Returns the trace file that failed to parse.
   *
   * @return file path
   */
  public Path path() {
    return path;
  }
}
