package ca.gc.cra.tee.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the executor services backing tee infrastructure.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a single-threaded daemon scheduler used to fire cancellation deadlines.
   * <p>Cancelled tasks are removed from the work queue immediately so short-lived deadlines that never fire do not
   * accumulate.</p>
   *
   * @param prefix thread-name prefix used to tag scheduler threads
   * @param handler uncaught exception handler installed on each scheduler thread
   * @return configured scheduler
   */
  public static ScheduledExecutorService newDeadlineScheduler(String prefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "tee-deadline" : prefix;
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

    ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, factory);
    executor.setRemoveOnCancelPolicy(true);
    return executor;
  }
}
