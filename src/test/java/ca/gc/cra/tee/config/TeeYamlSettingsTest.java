package ca.gc.cra.tee.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TeeYamlSettingsTest {

  @TempDir Path tempDir;

  @Test
  void teeSectionOverridesCommonAndOtherKeysAreIgnored() throws IOException {
    Path yaml = tempDir.resolve("shared.yaml");
    Files.writeString(yaml, """
        common:
          highWater: 32
          metricsPrefix: shared
          otel:
            exporter: none
        tee:
          highWater: 8
        capture:
          lowWater: 99
        """);

    Map<String, String> settings = TeeYamlSettings.read(yaml);

    assertEquals(Map.of("highWater", "8", "metricsPrefix", "shared"), settings);
  }

  @Test
  void missingOrEmptyFileYieldsNoSettings() throws IOException {
    Path empty = tempDir.resolve("empty.yaml");
    Files.writeString(empty, "");

    assertTrue(TeeYamlSettings.read(empty).isEmpty());
    assertTrue(TeeYamlSettings.read(tempDir.resolve("missing.yaml")).isEmpty());
  }

  @Test
  void listValuedTeeKeyIsRejected() throws IOException {
    Path yaml = tempDir.resolve("array.yaml");
    Files.writeString(yaml, """
        tee:
          highWater: [1, 2]
        """);

    assertThrows(IllegalArgumentException.class, () -> TeeYamlSettings.read(yaml));
  }

  @Test
  void nonMappingSectionIsRejected() throws IOException {
    Path yaml = tempDir.resolve("scalar.yaml");
    Files.writeString(yaml, "tee: 12\n");

    assertThrows(IllegalArgumentException.class, () -> TeeYamlSettings.read(yaml));
  }

  @Test
  void malformedYamlIsReportedAsIllegalArgument() throws IOException {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "tee: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> TeeYamlSettings.read(yaml));
  }
}
