/**
 * Infrastructure adapters binding tee ports to concrete mechanisms (OpenTelemetry, deadline scheduling, buffers).
 * <p><strong>Concurrency:</strong> Each adapter documents its guarantees.</p>
 */
package ca.gc.cra.tee.infrastructure;
