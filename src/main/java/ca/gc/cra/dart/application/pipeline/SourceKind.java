package ca.gc.cra.dart.application.pipeline;

/**
 * Kind of evidence an input file carries.
 *
 * @since 0.1.0
 */
public enum SourceKind {
  /** Free-text client log. */
  LOG("analyze.files.log"),
  /** Structured trace document. */
  TRACE("analyze.files.trace");

  private final String filesCounter;

  SourceKind(String filesCounter) {
    this.filesCounter = filesCounter;
  }

  /**
   * Counter incremented once per file of this kind.
   *
   * @return metric key
   */
  public String filesCounter() {
    return filesCounter;
  }
}
