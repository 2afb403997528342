/**
 * Lossy in-process fan-out of byte chunks.
 * <p><strong>Role:</strong> {@link ca.gc.cra.tee.application.broadcast.Tee} accepts writes from one producer and
 * copies each chunk to every {@link ca.gc.cra.tee.application.broadcast.TeeReader}; each reader drains its own
 * bounded queue at its own pace.</p>
 * <p><strong>Concurrency:</strong> Writes never block on readers. Readers that fall behind lose whole chunks; the
 * order of the chunks a reader does see always matches write order. No ordering holds between readers.</p>
 * <p><strong>Metrics:</strong> Emits {@code tee.*} counters through {@link ca.gc.cra.tee.application.port.MetricsPort}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tee.application.broadcast;
