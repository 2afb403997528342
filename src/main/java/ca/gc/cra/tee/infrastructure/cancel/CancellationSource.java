package ca.gc.cra.tee.infrastructure.cancel;

import ca.gc.cra.tee.application.port.CancellationSignal;
import ca.gc.cra.tee.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Triggerable {@link CancellationSignal}.
 * <p>Fires at most once: the first {@link #cancel(Throwable)} wins, later calls are ignored. Sources created by
 * {@link #withTimeout(Duration)} fire on their own with a {@link TimeoutException} cause once the deadline passes.</p>
 * <p>Thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CancellationSource implements CancellationSignal {
  private static final Logger log = LoggerFactory.getLogger(CancellationSource.class);

  private static final class SchedulerHolder {
    private static final ScheduledExecutorService SCHEDULER =
        ExecutorFactories.newDeadlineScheduler(
            "tee-deadline",
            (thread, ex) -> log.error("Deadline task failed on {}", thread.getName(), ex));
  }

  private final Object lock = new Object();
  private final List<Runnable> callbacks = new ArrayList<>();
  private volatile Throwable cause;
  private volatile ScheduledFuture<?> deadline;

  /**
   * Creates a source that fires only when {@link #cancel} is called.
   */
  public CancellationSource() {}

  /**
   * Creates a source that fires after {@code timeout} unless cancelled earlier.
   *
   * @param timeout delay before the source fires; must be non-negative
   * @return armed source
   */
  public static CancellationSource withTimeout(Duration timeout) {
    return withTimeout(timeout, SchedulerHolder.SCHEDULER);
  }

  /**
   * Creates a source that fires after {@code timeout} on the supplied scheduler.
   *
   * @param timeout delay before the source fires; must be non-negative
   * @param scheduler scheduler that runs the deadline task
   * @return armed source
   */
  public static CancellationSource withTimeout(Duration timeout, ScheduledExecutorService scheduler) {
    Objects.requireNonNull(timeout, "timeout");
    Objects.requireNonNull(scheduler, "scheduler");
    if (timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must not be negative");
    }
    CancellationSource source = new CancellationSource();
    source.deadline = scheduler.schedule(
        () -> source.cancel(new TimeoutException("deadline of " + timeout + " exceeded")),
        timeout.toNanos(),
        TimeUnit.NANOSECONDS);
    return source;
  }

  /**
   * Fires the source with a {@link CancellationException} carrying {@code reason}.
   *
   * @param reason human-readable explanation
   * @return {@code true} when this call fired the source
   */
  public boolean cancel(String reason) {
    return cancel(new CancellationException(reason));
  }

  /**
   * Fires the source with the supplied cause and runs every registered callback.
   *
   * @param reason cause reported by {@link #cause()}; must not be {@code null}
   * @return {@code true} when this call fired the source, {@code false} when it had already fired
   */
  public boolean cancel(Throwable reason) {
    Objects.requireNonNull(reason, "reason");
    List<Runnable> toRun;
    synchronized (lock) {
      if (cause != null) {
        return false;
      }
      cause = reason;
      toRun = List.copyOf(callbacks);
      callbacks.clear();
    }
    ScheduledFuture<?> pending = deadline;
    if (pending != null) {
      pending.cancel(false);
    }
    log.debug("Cancellation fired: {}", reason.toString());
    for (Runnable callback : toRun) {
      callback.run();
    }
    return true;
  }

  @Override
  public boolean isCancelled() {
    return cause != null;
  }

  @Override
  public Throwable cause() {
    return cause;
  }

  @Override
  public Registration onCancel(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    synchronized (lock) {
      if (cause == null) {
        callbacks.add(callback);
        return () -> {
          synchronized (lock) {
            callbacks.remove(callback);
          }
        };
      }
    }
    callback.run();
    return () -> {};
  }
}
