package ca.gc.cra.tee.application.broadcast;

import ca.gc.cra.tee.application.port.CancellationSignal;
import ca.gc.cra.tee.application.port.MetricsPort;
import ca.gc.cra.tee.config.TeeConfig;
import ca.gc.cra.tee.validation.Numbers;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asynchronous one-to-any pipe. Each {@code write} is a chunk copied to every registered {@link TeeReader};
 * readers can be added at any time and only see chunks written after they were created.
 * <p>Writes never block and never fail. A reader whose queue is full simply misses that chunk, so a slow consumer
 * loses data instead of slowing the producer or the other readers. A chunk is delivered to a given reader
 * entirely or not at all.</p>
 * <p>{@link #close()} makes every reader reach end-of-stream once it has drained what it already holds. Closing is
 * idempotent; after it, writes are discarded and new readers start at end-of-stream.</p>
 * <p><strong>Thread-safety:</strong> all methods may be called concurrently. One lock guards the reader registry; it
 * is held for one pass over the registered readers and never waits on a reader's queue.</p>
 * <p><strong>Metrics:</strong> {@code <prefix>.write.chunks}, {@code <prefix>.write.bytes},
 * {@code <prefix>.reader.registered}, {@code <prefix>.reader.closed}, {@code <prefix>.reader.dropped},
 * {@code <prefix>.reader.catchup}, {@code <prefix>.reader.catchup.chunks}, {@code <prefix>.reader.cancelled}.</p>
 *
 * @since 0.1.0
 */
public final class Tee extends OutputStream {
  private static final Logger log = LoggerFactory.getLogger(Tee.class);

  private final TeeConfig config;
  private final MetricsPort metrics;
  private final ReentrantLock lock = new ReentrantLock();
  private final Map<Long, TeeReader> readers = new LinkedHashMap<>();
  private final AtomicLong nextReaderId = new AtomicLong();

  private final String writeChunksKey;
  private final String writeBytesKey;
  private final String registeredKey;
  private final String closedKey;
  private final String droppedKey;
  private final String catchUpKey;
  private final String catchUpChunksKey;
  private final String cancelledKey;

  // guarded by lock
  private boolean closed;

  /**
   * Creates a tee with {@link TeeConfig#defaults()} and no metrics.
   */
  public Tee() {
    this(TeeConfig.defaults(), MetricsPort.NO_OP);
  }

  /**
   * Creates a tee.
   *
   * @param config default reader marks and metric prefix
   * @param metrics metrics sink; called while the registry lock is held
   */
  public Tee(TeeConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    String prefix = config.metricsPrefix();
    this.writeChunksKey = prefix + ".write.chunks";
    this.writeBytesKey = prefix + ".write.bytes";
    this.registeredKey = prefix + ".reader.registered";
    this.closedKey = prefix + ".reader.closed";
    this.droppedKey = prefix + ".reader.dropped";
    this.catchUpKey = prefix + ".reader.catchup";
    this.catchUpChunksKey = prefix + ".reader.catchup.chunks";
    this.cancelledKey = prefix + ".reader.cancelled";
  }

  /**
   * Sends a one-byte chunk to every reader with room for it.
   */
  @Override
  public void write(int b) {
    write(new byte[] {(byte) b}, 0, 1);
  }

  /**
   * Sends {@code b} as one chunk to every reader with room for it.
   */
  @Override
  public void write(byte[] b) {
    write(b, 0, b.length);
  }

  /**
   * Sends {@code len} bytes of {@code b} as one chunk to every reader with room for it. The bytes are copied before
   * this method returns, so the caller may reuse {@code b} immediately.
   */
  @Override
  public void write(byte[] b, int off, int len) {
    Objects.checkFromIndexSize(off, len, b.length);
    byte[] chunk = Arrays.copyOfRange(b, off, off + len);
    lock.lock();
    try {
      if (closed) {
        log.debug("Discarding {}-byte write to closed tee", len);
        return;
      }
      metrics.increment(writeChunksKey);
      metrics.observe(writeBytesKey, len);
      for (TeeReader reader : readers.values()) {
        if (!reader.offer(chunk)) {
          metrics.increment(droppedKey);
        }
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Creates a reader using the configured low- and high-water marks.
   *
   * @return registered reader
   */
  public TeeReader newReader() {
    return newReader(CancellationSignal.NONE, config.lowWater(), config.highWater());
  }

  /**
   * Creates a reader that receives every chunk written from now on, dropping chunks whenever {@code highWater}
   * of them are already queued, and discarding its whole backlog once it falls {@code highWater - 1} chunks behind.
   * <p>If nothing is queued when a read starts, the read waits for {@code lowWater} chunks before returning.</p>
   *
   * @param lowWater chunks to coalesce per read when the queue is empty; {@code 0} and {@code 1} return per chunk
   * @param highWater queue capacity in chunks
   * @return registered reader
   * @throws IllegalArgumentException when a mark is negative or above {@link TeeConfig#MAX_WATER_MARK}
   */
  public TeeReader newReader(int lowWater, int highWater) {
    return newReader(CancellationSignal.NONE, lowWater, highWater);
  }

  /**
   * Same as {@link #newReader(int, int)}; blocked reads also end with {@link ReaderCancelledException} once
   * {@code signal} fires.
   *
   * @param signal cancellation source observed by every blocking read
   * @param lowWater chunks to coalesce per read when the queue is empty
   * @param highWater queue capacity in chunks
   * @return registered reader
   */
  public TeeReader newReader(CancellationSignal signal, int lowWater, int highWater) {
    Objects.requireNonNull(signal, "signal");
    Numbers.requireRange("lowWater", lowWater, 0, TeeConfig.MAX_WATER_MARK);
    Numbers.requireRange("highWater", highWater, 0, TeeConfig.MAX_WATER_MARK);
    TeeReader reader = new TeeReader(nextReaderId.incrementAndGet(), this, signal, lowWater, highWater);
    lock.lock();
    try {
      if (closed) {
        reader.endOfStream();
        log.debug("Reader {} created on closed tee; starting at end-of-stream", reader.id());
        return reader;
      }
      readers.put(reader.id(), reader);
    } finally {
      lock.unlock();
    }
    metrics.increment(registeredKey);
    log.debug("Registered reader {} (lowWater={}, highWater={})", reader.id(), lowWater, highWater);
    return reader;
  }

  /**
   * Signals end-of-stream to every registered reader and clears the registry. Idempotent.
   */
  @Override
  public void close() {
    int signalled;
    lock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      for (TeeReader reader : readers.values()) {
        reader.endOfStream();
      }
      signalled = readers.size();
      readers.clear();
    } finally {
      lock.unlock();
    }
    log.info("Tee closed; signalled end-of-stream to {} readers", signalled);
  }

  /**
   * Returns the number of currently registered readers.
   */
  public int readerCount() {
    lock.lock();
    try {
      return readers.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Reports whether {@link #close()} has been called.
   */
  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  boolean deregister(TeeReader reader) {
    lock.lock();
    try {
      if (!readers.remove(reader.id(), reader)) {
        return false;
      }
      reader.endOfStream();
    } finally {
      lock.unlock();
    }
    metrics.increment(closedKey);
    log.debug("Deregistered reader {}", reader.id());
    return true;
  }

  void recordCatchUp(TeeReader reader, int discarded) {
    metrics.increment(catchUpKey);
    metrics.observe(catchUpChunksKey, discarded);
    log.debug("Reader {} fell behind; discarded {} queued chunks", reader.id(), discarded);
  }

  void recordCancelled(TeeReader reader) {
    metrics.increment(cancelledKey);
    log.debug("Reader {} cancelled", reader.id());
  }
}
