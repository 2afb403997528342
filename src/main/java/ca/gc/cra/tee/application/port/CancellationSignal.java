package ca.gc.cra.tee.application.port;

/**
 * <strong>What:</strong> Port describing an external, cooperative cancellation source for tee readers.
 * <p><strong>Why:</strong> A reader blocked waiting for chunks must wake promptly when its caller gives up, without
 * relying on thread interruption.</p>
 * <p><strong>Role:</strong> Collaborator consumed by {@code TeeReader}; implemented by
 * {@code ca.gc.cra.tee.infrastructure.cancel.CancellationSource}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe to query and trigger from any thread.</p>
 *
 * @since 0.1.0
 */
public interface CancellationSignal {

  /**
   * Reports whether the signal has fired. Once {@code true} it stays {@code true}.
   *
   * @return {@code true} after cancellation
   */
  boolean isCancelled();

  /**
   * Explains why the signal fired.
   *
   * @return the cancellation cause, or {@code null} while the signal has not fired
   */
  Throwable cause();

  /**
   * Registers a callback run once when the signal fires. If the signal already fired the callback runs
   * immediately on the calling thread.
   *
   * @param callback action to run on cancellation; must be fast and non-blocking
   * @return handle that removes the callback when closed
   */
  Registration onCancel(Runnable callback);

  /**
   * Handle returned by {@link #onCancel(Runnable)}.
   */
  @FunctionalInterface
  interface Registration extends AutoCloseable {
    /**
     * Removes the callback; idempotent.
     */
    @Override
    void close();
  }

  /**
   * Signal that never fires.
   */
  CancellationSignal NONE = new CancellationSignal() {
    @Override public boolean isCancelled() {
      return false;
    }

    @Override public Throwable cause() {
      return null;
    }

    @Override public Registration onCancel(Runnable callback) {
      return () -> {};
    }
  };
}
