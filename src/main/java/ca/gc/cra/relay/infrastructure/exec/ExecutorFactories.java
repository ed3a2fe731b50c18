package ca.gc.cra.relay.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for creating named executor services aligned with RELAY concurrency requirements.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private static final UncaughtExceptionHandler LOGGING_HANDLER =
      (thread, ex) -> log.error("Uncaught exception on {}", thread.getName(), ex);

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size worker pool. Tasks queue when all workers are busy; callers bound the
   * queue through transport credits.
   *
   * @param size number of worker threads to allocate
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread; {@code null} logs
   * @return configured executor service
   */
  public static ExecutorService newWorkerPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    ThreadFactory factory = threadFactory(prefix, "relay-worker", false, handler);
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds a single daemon thread scheduler used for deadline sweeps, reorder timeouts, and
   * heartbeats.
   *
   * @param prefix thread-name prefix
   * @return scheduled executor whose cancelled tasks are removed eagerly
   */
  public static ScheduledExecutorService newScheduler(String prefix) {
    ScheduledThreadPoolExecutor executor =
        new ScheduledThreadPoolExecutor(1, threadFactory(prefix, "relay-sweeper", true, null));
    executor.setRemoveOnCancelPolicy(true);
    executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    return executor;
  }

  /**
   * Shuts down an executor, waiting up to {@code timeoutMillis} before forcing termination.
   *
   * @param executor executor to stop; {@code null} is ignored
   * @param timeoutMillis grace period
   */
  public static void shutdownGracefully(ExecutorService executor, long timeoutMillis) {
    if (executor == null) {
      return;
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static ThreadFactory threadFactory(
      String prefix, String fallback, boolean daemon, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? fallback : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, LOGGING_HANDLER);
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
