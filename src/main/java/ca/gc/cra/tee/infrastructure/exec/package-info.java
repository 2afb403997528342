/**
 * Executor factories for tee infrastructure.
 * <p><strong>Role:</strong> Configures the daemon scheduler that drives cancellation deadlines.</p>
 * <p><strong>Concurrency:</strong> Provides thread-safe factory methods that return managed executors.</p>
 */
package ca.gc.cra.tee.infrastructure.exec;
