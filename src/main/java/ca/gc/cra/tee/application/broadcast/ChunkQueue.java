package ca.gc.cra.tee.application.broadcast;

import ca.gc.cra.tee.application.port.CancellationSignal;
import java.util.ArrayDeque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded chunk queue feeding one {@link TeeReader}.
 * <p>The producer side ({@link #offer(byte[])}) never blocks: a full queue refuses the chunk. The consumer side
 * ({@link #take(CancellationSignal)}) blocks until a chunk, end-of-stream, or cancellation. End-of-stream is an
 * explicit flag distinct from emptiness; chunks queued before {@link #close()} stay takeable.</p>
 * <p>A capacity of zero behaves as a rendezvous: a chunk is accepted only while a consumer is blocked in
 * {@code take} and no other hand-off is pending.</p>
 */
final class ChunkQueue {
  private final int capacity;
  private final ArrayDeque<byte[]> chunks;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private int waiting;
  private boolean closed;

  ChunkQueue(int capacity) {
    if (capacity < 0) {
      throw new IllegalArgumentException("capacity must not be negative");
    }
    this.capacity = capacity;
    this.chunks = new ArrayDeque<>(Math.min(Math.max(capacity, 1), 1024));
  }

  /**
   * Enqueues {@code chunk} without blocking.
   *
   * @return {@code false} when the queue is full or closed
   */
  boolean offer(byte[] chunk) {
    lock.lock();
    try {
      if (closed) {
        return false;
      }
      int size = chunks.size();
      if (size >= capacity && !(size == 0 && waiting > 0)) {
        return false;
      }
      chunks.addLast(chunk);
      changed.signal();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits for the next chunk. Cancellation is checked before queued data on every wake-up.
   *
   * @param signal cancellation source observed while waiting
   * @return next chunk, or {@code null} once the queue is closed and drained
   * @throws ReaderCancelledException when {@code signal} has fired
   * @throws InterruptedException when the waiting thread is interrupted
   */
  byte[] take(CancellationSignal signal) throws ReaderCancelledException, InterruptedException {
    lock.lockInterruptibly();
    try {
      waiting++;
      try {
        while (true) {
          if (signal.isCancelled()) {
            throw new ReaderCancelledException(signal.cause());
          }
          byte[] chunk = chunks.pollFirst();
          if (chunk != null) {
            return chunk;
          }
          if (closed) {
            return null;
          }
          changed.await();
        }
      } finally {
        waiting--;
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Discards the whole backlog when it has reached {@code capacity - 1} chunks. Queues smaller than two slots never
   * hold a backlog worth discarding.
   *
   * @return number of chunks discarded
   */
  int discardIfNearFull() {
    lock.lock();
    try {
      int size = chunks.size();
      if (capacity < 2 || size < capacity - 1) {
        return 0;
      }
      chunks.clear();
      return size;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Marks end-of-stream and wakes every waiter.
   *
   * @return {@code true} when this call closed the queue
   */
  boolean close() {
    lock.lock();
    try {
      if (closed) {
        return false;
      }
      closed = true;
      changed.signalAll();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Wakes waiters so they re-check their cancellation signal.
   */
  void wake() {
    lock.lock();
    try {
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  boolean isEmpty() {
    lock.lock();
    try {
      return chunks.isEmpty();
    } finally {
      lock.unlock();
    }
  }

  int size() {
    lock.lock();
    try {
      return chunks.size();
    } finally {
      lock.unlock();
    }
  }

  int capacity() {
    return capacity;
  }
}
