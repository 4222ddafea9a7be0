package ca.gc.cra.dart.application.pipeline;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of processing one input file.
 *
 * @param input processed file
 * @param eventsApplied events applied to the aggregator; {@code 0} for failed files
 * @param failure failure cause when the file contributed nothing
 * @since 0.1.0
 */
public record FileOutcome(InputFile input, long eventsApplied, Optional<String> failure) {
  public FileOutcome {
    Objects.requireNonNull(input, "input");
    failure = failure == null ? Optional.empty() : failure;
    if (eventsApplied < 0) {
      throw new IllegalArgumentException("eventsApplied must be >= 0");
    }
    if (failure.isPresent() && eventsApplied != 0) {
      throw new IllegalArgumentException("failed files apply no events");
    }
  }

  static FileOutcome applied(InputFile input, long eventsApplied) {
    return new FileOutcome(input, eventsApplied, Optional.empty());
  }

  static FileOutcome failed(InputFile input, String cause) {
    return new FileOutcome(input, 0, Optional.of(Objects.requireNonNull(cause, "cause")));
  }

  /**
   * Whether the file was skipped because it could not be read or parsed.
   *
   * @return {@code true} for failed files
   */
  public boolean isFailed() {
    return failure.isPresent();
  }
}
