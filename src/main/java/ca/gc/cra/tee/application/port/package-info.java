/**
 * Ports the broadcast core depends on: metrics emission and external cancellation.
 * <p><strong>Role:</strong> Seams implemented by infrastructure adapters or by embedding callers.</p>
 * <p><strong>Concurrency:</strong> Implementations must tolerate calls from the producer and all reader threads.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tee.application.port;
