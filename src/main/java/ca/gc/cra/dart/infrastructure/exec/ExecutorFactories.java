package ca.gc.cra.dart.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the analyzer's worker pools.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size pool for reading input files in parallel.
   *
   * <p>The queue is unbounded because one task is submitted per discovered file and the file list is already in
   * memory.</p>
   *
   * @param size number of reader threads
   * @param prefix thread-name prefix; blank defaults to {@code dart-reader}
   * @param handler uncaught exception handler installed on each thread; {@code null} ignores escapes
   * @return configured executor service; callers must shut it down
   */
  public static ExecutorService newReaderPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "dart-reader" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(true);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }
}
