package ca.gc.cra.tee.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tee.application.broadcast.Tee;
import ca.gc.cra.tee.application.broadcast.TeeReader;
import ca.gc.cra.tee.config.TeeConfig;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterCounterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void teeDropsAreExportedAsCounter() {
    Tee tee = new Tee(TeeConfig.defaults(), adapter);
    TeeReader stalled = tee.newReader(1, 1);
    for (int i = 0; i < 4; i++) {
      tee.write(new byte[] {(byte) i});
    }
    stalled.close();
    adapter.forceFlush();

    Collection<MetricData> metrics = reader.collectAllMetrics();
    MetricData dropped = find(metrics, "tee.reader.dropped").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, dropped.getType());
    LongPointData point = dropped.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("tee.reader.dropped", point.getAttributes().get(AttributeKey.stringKey("tee.metric.key")));

    assertEquals("tee", dropped.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", dropped.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    assertTrue(find(metrics, "tee.reader.registered").isPresent());
    assertTrue(find(metrics, "tee.reader.closed").isPresent());
  }

  @Test
  void invalidKeysAreSanitizedButKeptAsAttribute() {
    adapter.increment("9 lives");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "m9_lives").orElseThrow();
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals("9 lives", point.getAttributes().get(AttributeKey.stringKey("tee.metric.key")));
  }

  @Test
  void sanitizeNameFallsBackForBlankKeys() {
    assertEquals("tee.metric", OpenTelemetryMetricsAdapter.sanitizeName("  "));
    assertEquals("tee.write.chunks", OpenTelemetryMetricsAdapter.sanitizeName("Tee.Write.Chunks"));
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}
