/**
 * Cancellation sources implementing the {@link ca.gc.cra.tee.application.port.CancellationSignal} port.
 * <p><strong>Concurrency:</strong> Sources may be triggered from any thread; callbacks run on the triggering thread
 * (or the deadline scheduler thread for timeouts).</p>
 */
package ca.gc.cra.tee.infrastructure.cancel;
