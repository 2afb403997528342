package ca.gc.cra.tee.infrastructure.buffer;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * Expandable byte buffer backed by a single array with manual read/write indices.
 * <p>Used by tee readers to coalesce dequeued chunks: appends land at the write index, callers drain
 * from the read index. The backing array only grows and is reused for the life of the reader.</p>
 * <p>Not thread-safe; each reader owns one instance and guards it with its read lock.</p>
 */
public final class GrowableBuffer {
  private static final int DEFAULT_CAPACITY = 2048;
  private static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

  private byte[] data;
  private int readIndex;
  private int writeIndex;

  /**
   * Creates an empty buffer with a 2 KiB backing array.
   */
  public GrowableBuffer() {
    data = new byte[DEFAULT_CAPACITY];
  }

  /**
   * Appends the provided bytes into the buffer, growing it if required.
   *
   * @param src source array; must not be {@code null}
   */
  public void write(byte[] src) {
    Objects.requireNonNull(src, "src");
    if (src.length == 0) {
      return;
    }
    ensureWritable(src.length);
    System.arraycopy(src, 0, data, writeIndex, src.length);
    writeIndex += src.length;
  }

  /**
   * Returns the number of readable bytes.
   */
  public int readableBytes() {
    return writeIndex - readIndex;
  }

  private void discard(int length) {
    if (length < 0 || length > readableBytes()) {
      throw new IllegalArgumentException("length out of bounds: " + length);
    }
    readIndex += length;
    if (readIndex == writeIndex) {
      readIndex = 0;
      writeIndex = 0;
    }
  }

  /**
   * Copies up to {@code length} readable bytes into {@code dest} and consumes them.
   *
   * @return number of bytes copied, which is {@code min(length, readableBytes())}
   */
  public int copyInto(byte[] dest, int destOffset, int length) {
    Objects.requireNonNull(dest, "dest");
    Objects.checkFromIndexSize(destOffset, length, dest.length);
    int n = Math.min(length, readableBytes());
    System.arraycopy(data, readIndex, dest, destOffset, n);
    discard(n);
    return n;
  }

  /**
   * Writes every readable byte to {@code sink} and consumes them. Nothing is consumed when the sink fails.
   *
   * @return number of bytes written
   * @throws IOException when the sink rejects the write
   */
  public int writeTo(OutputStream sink) throws IOException {
    Objects.requireNonNull(sink, "sink");
    int n = readableBytes();
    if (n == 0) {
      return 0;
    }
    sink.write(data, readIndex, n);
    discard(n);
    return n;
  }

  private void ensureWritable(int minWritableBytes) {
    if (data.length - writeIndex >= minWritableBytes) {
      return;
    }
    compact();
    if (data.length - writeIndex >= minWritableBytes) {
      return;
    }
    int readable = readableBytes();
    long required = (long) readable + minWritableBytes;
    if (required > MAX_CAPACITY) {
      throw new IllegalStateException("buffer would exceed max capacity: " + required);
    }
    long newCapacity = data.length;
    while (newCapacity < required) {
      newCapacity <<= 1;
    }
    byte[] next = new byte[(int) Math.min(newCapacity, MAX_CAPACITY)];
    System.arraycopy(data, readIndex, next, 0, readable);
    data = next;
    readIndex = 0;
    writeIndex = readable;
  }

  private void compact() {
    if (readIndex == 0) {
      return;
    }
    int readable = readableBytes();
    if (readable > 0) {
      System.arraycopy(data, readIndex, data, 0, readable);
    }
    readIndex = 0;
    writeIndex = readable;
  }
}
