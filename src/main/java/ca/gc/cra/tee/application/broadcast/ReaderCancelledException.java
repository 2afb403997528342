package ca.gc.cra.tee.application.broadcast;

import java.io.IOException;

/**
 * Signals that a {@link TeeReader} stopped because its {@link ca.gc.cra.tee.application.port.CancellationSignal}
 * fired. Distinct from end-of-stream, which {@link TeeReader#read(byte[], int, int)} reports as {@code -1}.
 * <p>The cause is the signal's own {@code cause()}, for example a {@link java.util.concurrent.TimeoutException} for
 * deadline sources.</p>
 *
 * @since 0.1.0
 */
public class ReaderCancelledException extends IOException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param cause why the reader was cancelled; may be {@code null}
   */
  public ReaderCancelledException(Throwable cause) {
    super(cause == null ? "reader cancelled" : "reader cancelled: " + cause.getMessage(), cause);
  }
}
