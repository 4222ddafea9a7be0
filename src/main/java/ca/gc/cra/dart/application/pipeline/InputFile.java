package ca.gc.cra.dart.application.pipeline;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A discovered input file and the extractor it is routed to.
 *
 * @param path absolute file path
 * @param kind evidence kind
 * @since 0.1.0
 */
public record InputFile(Path path, SourceKind kind) {
  public InputFile {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(kind, "kind");
  }

  /**
   * File name used for MDC and log messages.
   *
   * @return last path element
   */
  public String name() {
    Path fileName = path.getFileName();
    return fileName == null ? path.toString() : fileName.toString();
  }
}
