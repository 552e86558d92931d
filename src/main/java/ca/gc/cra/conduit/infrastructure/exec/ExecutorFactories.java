package ca.gc.cra.conduit.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the named executors used by the connection lifecycle, statistics sampler, reconnect
 * supervisor and tunnel relay.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);
  private static final UncaughtExceptionHandler LOGGING_HANDLER =
      (thread, ex) -> log.error("Uncaught exception on {}", thread.getName(), ex);

  private ExecutorFactories() {}

  /**
   * Builds a single-threaded executor that runs tasks strictly in submission order.
   *
   * @param prefix thread-name prefix
   * @return serial executor backed by a daemon thread
   */
  public static ExecutorService newSerialExecutor(String prefix) {
    return Executors.newSingleThreadExecutor(threadFactory(prefix, true));
  }

  /**
   * Builds a single-threaded scheduler for timers such as statistics sampling and backoff waits.
   *
   * @param prefix thread-name prefix
   * @return scheduler whose cancelled tasks are removed from the queue immediately
   */
  public static ScheduledExecutorService newScheduler(String prefix) {
    ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, threadFactory(prefix, true));
    executor.setRemoveOnCancelPolicy(true);
    executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    return executor;
  }

  /**
   * Creates a thread factory that names threads {@code prefix-N} and logs uncaught exceptions.
   *
   * @param prefix thread-name prefix; defaults to {@code conduit} when blank
   * @param daemon whether threads should be daemon threads
   * @return thread factory
   */
  public static ThreadFactory threadFactory(String prefix, boolean daemon) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "conduit" : prefix;
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(LOGGING_HANDLER);
      return thread;
    };
  }
}
