package ca.gc.cra.tee.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads the tee keys ({@code lowWater}, {@code highWater}, {@code metricsPrefix}) from a YAML file.
 * <p>Values under the {@code tee} section override those under {@code common}. Other sections and other keys are
 * ignored, so one file can be shared with unrelated components.</p>
 */
final class TeeYamlSettings {
  static final String COMMON_SECTION = "common";
  static final List<String> KEYS =
      List.of(TeeConfig.KEY_LOW_WATER, TeeConfig.KEY_HIGH_WATER, TeeConfig.KEY_METRICS_PREFIX);

  private TeeYamlSettings() {}

  /**
   * Returns the tee settings found in {@code path}.
   *
   * @param path YAML file location
   * @return key/value pairs ready for {@link TeeConfig#fromMap(Map)}; empty when the file is missing or empty
   * @throws IOException when the file exists but cannot be read
   * @throws IllegalArgumentException when the document is malformed or a tee key holds a list or mapping
   */
  static Map<String, String> read(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Map.of();
    }
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Malformed YAML in " + path, ex);
    }
    if (document == null) {
      return Map.of();
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("Top level of " + path + " must be a mapping");
    }
    Map<String, String> settings = new HashMap<>();
    copyKeys(root.get(COMMON_SECTION), COMMON_SECTION, settings);
    copyKeys(root.get(TeeConfig.SECTION), TeeConfig.SECTION, settings);
    return Map.copyOf(settings);
  }

  private static void copyKeys(Object section, String name, Map<String, String> settings) {
    if (section == null) {
      return;
    }
    if (!(section instanceof Map<?, ?> entries)) {
      throw new IllegalArgumentException("Section '" + name + "' must be a mapping");
    }
    for (String key : KEYS) {
      Object value = entries.get(key);
      if (value == null) {
        continue;
      }
      if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
        throw new IllegalArgumentException(name + "." + key + " must be a scalar");
      }
      settings.put(key, value.toString());
    }
  }
}
