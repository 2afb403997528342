package ca.gc.cra.tee.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for the tee and its readers.
 * <p><strong>Why:</strong> Lets the broadcast path count drops and catch-up events without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Application port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for events like chunk drops or reader registrations.</li>
 *   <li>Record numeric observations for chunk sizes and discarded backlog lengths.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from the producer and every reader.</p>
 * <p><strong>Performance:</strong> Calls happen while the registry lock is held; they must be non-blocking and O(1).</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code tee.reader.dropped}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier using dotted naming (e.g., {@code tee.reader.dropped}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key metric identifier using dotted naming; must not be {@code null}
   * @param value observed value (e.g., bytes, chunk count); semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates; useful for tests and embedded use.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
