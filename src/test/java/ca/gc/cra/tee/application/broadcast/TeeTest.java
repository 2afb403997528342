package ca.gc.cra.tee.application.broadcast;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tee.config.TeeConfig;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class TeeTest {
  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    executor = Executors.newCachedThreadPool();
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    executor.shutdownNow();
    assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS), "executor not drained");
  }

  @Test
  void smallQueuesKeepOnlyTheFirstChunk() throws Exception {
    Tee tee = new Tee();
    TeeReader r0 = tee.newReader(0, 0);
    TeeReader r1 = tee.newReader(0, 1);
    TeeReader r2 = tee.newReader(0, 2);

    tee.write(new byte[] {1, 2, 3});
    tee.write(new byte[] {4, 5, 6});
    tee.write(new byte[] {7, 8, 9});
    tee.close();

    assertArrayEquals(new byte[0], r0.readAllBytes());
    assertArrayEquals(new byte[] {1, 2, 3}, r1.readAllBytes());
    assertArrayEquals(new byte[] {1, 2, 3}, r2.readAllBytes());
  }

  @Test
  void readersOnlySeeWritesAfterTheirCreation() throws Exception {
    Tee tee = new Tee();
    CountDownLatch releaseIdle = new CountDownLatch(1);
    List<Future<Integer>> lengths = new ArrayList<>();
    List<Integer> expected = new ArrayList<>();

    for (int i = 0; i < 256; i++) {
      tee.write(new byte[] {(byte) i, (byte) (i + 1), (byte) (i + 2)});
      TeeReader reader = tee.newReader(1, 256);
      if (i % 7 == 3) {
        executor.submit(() -> {
          releaseIdle.await();
          reader.close();
          return null;
        });
        continue;
      }
      expected.add(3 * (255 - i));
      lengths.add(executor.submit(() -> {
        try (reader) {
          return reader.readAllBytes().length;
        }
      }));
    }
    tee.close();

    for (int i = 0; i < lengths.size(); i++) {
      assertEquals(expected.get(i), lengths.get(i).get(10, TimeUnit.SECONDS));
    }
    releaseIdle.countDown();
  }

  @Test
  void writeCopiesCallerBuffer() throws Exception {
    Tee tee = new Tee();
    TeeReader reader = tee.newReader(1, 4);
    byte[] buffer = {1, 2, 3};

    tee.write(buffer);
    buffer[0] = 9;
    tee.close();

    assertArrayEquals(new byte[] {1, 2, 3}, reader.readAllBytes());
  }

  @Test
  void writeOfRegionSendsOnlyThatRegion() throws Exception {
    Tee tee = new Tee();
    TeeReader reader = tee.newReader(1, 4);

    tee.write(new byte[] {0, 1, 2, 3, 4}, 1, 3);
    tee.write(7);
    tee.close();

    assertArrayEquals(new byte[] {1, 2, 3, 7}, reader.readAllBytes());
  }

  @Test
  void writeRejectsInvalidRegion() {
    Tee tee = new Tee();
    assertThrows(IndexOutOfBoundsException.class, () -> tee.write(new byte[2], 1, 2));
  }

  @Test
  void fullReaderDoesNotAffectOthers() throws Exception {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    Tee tee = new Tee(TeeConfig.defaults(), metrics);
    TeeReader stalled = tee.newReader(1, 1);
    TeeReader roomy = tee.newReader(1, 16);

    for (int i = 0; i < 5; i++) {
      tee.write(new byte[] {(byte) i});
    }
    tee.close();

    assertArrayEquals(new byte[] {0}, stalled.readAllBytes());
    assertArrayEquals(new byte[] {0, 1, 2, 3, 4}, roomy.readAllBytes());
    assertEquals(4, metrics.count("tee.reader.dropped"));
    assertEquals(5, metrics.count("tee.write.chunks"));
    assertEquals(List.of(1L, 1L, 1L, 1L, 1L), metrics.observed("tee.write.bytes"));
  }

  @Test
  void closeIsIdempotentAndEndsEveryReader() throws Exception {
    Tee tee = new Tee();
    TeeReader first = tee.newReader(1, 8);
    TeeReader second = tee.newReader(1, 8);
    tee.write(new byte[] {1});

    tee.close();
    tee.close();

    assertTrue(tee.isClosed());
    assertEquals(0, tee.readerCount());
    assertArrayEquals(new byte[] {1}, first.readAllBytes());
    assertArrayEquals(new byte[] {1}, second.readAllBytes());
    assertEquals(-1, first.read());
    assertEquals(-1, first.read(new byte[4], 0, 4));
  }

  @Test
  void writesAfterCloseAreDiscarded() throws Exception {
    Tee tee = new Tee();
    TeeReader reader = tee.newReader(1, 8);
    tee.close();

    tee.write(new byte[] {1, 2});

    assertEquals(-1, reader.read());
  }

  @Test
  void readerCreatedAfterCloseStartsAtEndOfStream() throws Exception {
    Tee tee = new Tee();
    tee.close();

    TeeReader reader = tee.newReader(1, 8);
    tee.write(new byte[] {1});

    assertEquals(0, tee.readerCount());
    assertEquals(-1, reader.read());
    reader.close();
  }

  @Test
  void newReaderUsesConfiguredMarks() {
    Tee tee = new Tee(new TeeConfig(3, 12, "ingest"), new RecordingMetricsPort());

    TeeReader reader = tee.newReader();

    assertEquals(3, reader.lowWater());
    assertEquals(12, reader.highWater());
  }

  @Test
  void newReaderRejectsInvalidMarks() {
    Tee tee = new Tee();

    assertThrows(IllegalArgumentException.class, () -> tee.newReader(-1, 4));
    assertThrows(IllegalArgumentException.class, () -> tee.newReader(1, -4));
    assertThrows(IllegalArgumentException.class, () -> tee.newReader(1, TeeConfig.MAX_WATER_MARK + 1));
    assertThrows(NullPointerException.class, () -> tee.newReader(null, 1, 4));
    assertEquals(0, tee.readerCount());
  }

  @Test
  void registryTracksReadersAndMetricsUseConfiguredPrefix() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    Tee tee = new Tee(new TeeConfig(1, 4, "ingest.tee"), metrics);

    TeeReader first = tee.newReader(1, 4);
    TeeReader second = tee.newReader(1, 4);
    assertEquals(2, tee.readerCount());
    assertFalse(first.id() == second.id());

    first.close();
    first.close();

    assertEquals(1, tee.readerCount());
    assertEquals(2, metrics.count("ingest.tee.reader.registered"));
    assertEquals(1, metrics.count("ingest.tee.reader.closed"));
  }

  @Test
  void closeLogsNumberOfReadersSignalled() {
    Tee tee = new Tee();
    tee.newReader(1, 4);
    tee.newReader(1, 4);

    Logger logger = (Logger) LoggerFactory.getLogger(Tee.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    boolean originalAdditive = logger.isAdditive();
    Level originalLevel = logger.getLevel();
    logger.setAdditive(false);
    logger.setLevel(Level.INFO);
    appender.start();
    logger.addAppender(appender);
    try {
      tee.close();
      tee.close();
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      logger.setLevel(originalLevel);
      appender.stop();
    }

    assertEquals(1, appender.list.size());
    assertEquals("Tee closed; signalled end-of-stream to 2 readers", appender.list.get(0).getFormattedMessage());
  }
}
