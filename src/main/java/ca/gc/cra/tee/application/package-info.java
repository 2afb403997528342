/**
 * Application layer of the tee: the broadcast core and the ports it depends on.
 * <p><strong>Role:</strong> Hosts {@code broadcast} (fan-out and readers) and {@code port} (metrics, cancellation).</p>
 * <p><strong>Concurrency:</strong> Producers never block on consumers; each reader paces itself.</p>
 * <p><strong>Metrics:</strong> Emits the {@code tee.write.*} and {@code tee.reader.*} namespaces.</p>
 */
package ca.gc.cra.tee.application;
