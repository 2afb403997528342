/**
 * OpenTelemetry implementation of {@link ca.gc.cra.tee.application.port.MetricsPort}.
 * <p><strong>Concurrency:</strong> Instrument caches are concurrent maps; updates are safe from any thread.</p>
 * <p><strong>Performance:</strong> Instruments are built once per key; updates are lock-free SDK calls.</p>
 */
package ca.gc.cra.tee.infrastructure.metrics;
