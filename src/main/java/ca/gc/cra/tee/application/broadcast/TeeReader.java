package ca.gc.cra.tee.application.broadcast;

import ca.gc.cra.tee.application.port.CancellationSignal;
import ca.gc.cra.tee.infrastructure.buffer.GrowableBuffer;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One consumer's view of a {@link Tee}: an {@link InputStream} over every chunk the tee delivered to it.
 * <p>Chunks arrive whole or not at all. When the reader's queue nears its high-water mark the whole backlog is
 * discarded so the reader catches up with the producer instead of replaying stale data. When nothing is queued at
 * read time and the low-water mark is above one, a read waits for that many chunks (or end-of-stream) and returns
 * them as a single burst.</p>
 * <p>End-of-stream is reported as {@code -1}; cancellation as {@link ReaderCancelledException}. If either happens
 * after some chunks were collected, those bytes are returned first and the terminal condition is reported by the
 * following call. Both conditions are sticky. Reaching either one, or {@link #close()}, removes this reader's callback
 * from its {@link CancellationSignal}.</p>
 * <p><strong>Thread-safety:</strong> reads are serialized by an internal lock. {@link #close()} does not take that
 * lock and may be called while another thread is blocked in {@code read}; the blocked read then drains what was
 * already queued and reports end-of-stream.</p>
 *
 * @since 0.1.0
 */
public final class TeeReader extends InputStream {
  private final long id;
  private final Tee tee;
  private final ChunkQueue queue;
  private final int lowWater;
  private final CancellationSignal signal;
  private final CancellationSignal.Registration registration;
  private final ReentrantLock readLock = new ReentrantLock();

  // guarded by readLock
  private final GrowableBuffer pending = new GrowableBuffer();
  private boolean endOfStream;
  private boolean cancelled;
  private Throwable cancelCause;

  TeeReader(long id, Tee tee, CancellationSignal signal, int lowWater, int highWater) {
    this.id = id;
    this.tee = Objects.requireNonNull(tee, "tee");
    this.signal = Objects.requireNonNull(signal, "signal");
    this.lowWater = lowWater;
    this.queue = new ChunkQueue(highWater);
    this.registration = signal.onCancel(queue::wake);
  }

  /**
   * Returns the identity under which the owning tee registered this reader.
   */
  public long id() {
    return id;
  }

  /**
   * Returns the number of chunks a read coalesces when the queue is empty at read time.
   */
  public int lowWater() {
    return lowWater;
  }

  /**
   * Returns the queue capacity in chunks.
   */
  public int highWater() {
    return queue.capacity();
  }

  @Override
  public int read() throws IOException {
    byte[] one = new byte[1];
    int n = read(one, 0, 1);
    return n < 0 ? -1 : one[0] & 0xFF;
  }

  @Override
  public int read(byte[] b, int off, int len) throws IOException {
    Objects.checkFromIndexSize(off, len, b.length);
    if (len == 0) {
      return 0;
    }
    lockReads();
    try {
      while (pending.readableBytes() == 0) {
        if (cancelled) {
          throw new ReaderCancelledException(cancelCause);
        }
        if (endOfStream) {
          return -1;
        }
        fill();
      }
      return pending.copyInto(b, off, len);
    } finally {
      readLock.unlock();
    }
  }

  /**
   * Forwards the stream to {@code out} until end-of-stream, then closes this reader.
   * <p>The reader is closed on every exit path. A failure reported by {@code out} propagates immediately; a
   * cancellation propagates as {@link ReaderCancelledException} after the bytes collected before it were forwarded.</p>
   *
   * @param out sink receiving every delivered chunk
   * @return number of bytes forwarded
   * @throws IOException when the sink fails, the reader is cancelled, or the thread is interrupted
   */
  @Override
  public long transferTo(OutputStream out) throws IOException {
    Objects.requireNonNull(out, "out");
    try {
      lockReads();
      try {
        long total = 0;
        while (true) {
          total += pending.writeTo(out);
          if (cancelled) {
            throw new ReaderCancelledException(cancelCause);
          }
          if (endOfStream) {
            return total;
          }
          fill();
        }
      } finally {
        readLock.unlock();
      }
    } finally {
      close();
    }
  }

  /**
   * Returns the number of bytes already collected and readable without blocking.
   */
  @Override
  public int available() {
    if (!readLock.tryLock()) {
      return 0;
    }
    try {
      return pending.readableBytes();
    } finally {
      readLock.unlock();
    }
  }

  /**
   * Deregisters from the tee and signals end-of-stream to this reader. Chunks already queued stay readable.
   * Idempotent.
   */
  @Override
  public void close() {
    tee.deregister(this);
    registration.close();
  }

  boolean offer(byte[] chunk) {
    return queue.offer(chunk);
  }

  void endOfStream() {
    queue.close();
  }

  int queuedChunks() {
    return queue.size();
  }

  // Runs only while pending is empty and no terminal condition was recorded.
  private void fill() throws InterruptedIOException {
    int target = 1;
    if (lowWater > 1 && queue.isEmpty()) {
      target = lowWater;
    }
    try {
      for (int i = 0; i < target; i++) {
        byte[] chunk = queue.take(signal);
        if (chunk == null) {
          endOfStream = true;
          break;
        }
        pending.write(chunk);
      }
    } catch (ReaderCancelledException ex) {
      cancelled = true;
      cancelCause = ex.getCause();
      tee.recordCancelled(this);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("interrupted while waiting for chunks on reader " + id);
    } finally {
      int discarded = queue.discardIfNearFull();
      if (discarded > 0) {
        tee.recordCatchUp(this, discarded);
      }
    }
    if (endOfStream || cancelled) {
      // nothing left to wake once the outcome is sticky
      registration.close();
    }
  }

  private void lockReads() throws InterruptedIOException {
    try {
      readLock.lockInterruptibly();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("interrupted while waiting for reader " + id);
    }
  }

  @Override
  public String toString() {
    return "TeeReader[id=" + id + ", lowWater=" + lowWater + ", highWater=" + queue.capacity() + "]";
  }
}
