package ca.gc.cra.tee.config;

import ca.gc.cra.tee.validation.Numbers;
import ca.gc.cra.tee.validation.Strings;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable settings shared by a tee and the readers it creates without explicit marks.
 * <p><strong>Thread-safety:</strong> Record is immutable; safe for concurrent reads.</p>
 *
 * @param lowWater chunk count a reader coalesces before returning when its queue is empty at read time
 * @param highWater per-reader queue capacity in chunks
 * @param metricsPrefix dotted prefix applied to every metric key the tee emits
 * @since 0.1.0
 */
public record TeeConfig(int lowWater, int highWater, String metricsPrefix) {
  /** Largest accepted low- or high-water mark. */
  public static final int MAX_WATER_MARK = 1 << 20;

  static final int DEFAULT_LOW_WATER = 1;
  static final int DEFAULT_HIGH_WATER = 64;
  static final String DEFAULT_METRICS_PREFIX = "tee";
  static final String SECTION = "tee";
  static final String KEY_LOW_WATER = "lowWater";
  static final String KEY_HIGH_WATER = "highWater";
  static final String KEY_METRICS_PREFIX = "metricsPrefix";

  /**
   * Validates the components.
   *
   * @throws IllegalArgumentException when a water mark is outside {@code [0, MAX_WATER_MARK]} or the prefix is invalid
   */
  public TeeConfig {
    Numbers.requireRange("lowWater", lowWater, 0, MAX_WATER_MARK);
    Numbers.requireRange("highWater", highWater, 0, MAX_WATER_MARK);
    metricsPrefix = Strings.sanitizeMetricPrefix("metricsPrefix", Objects.requireNonNull(metricsPrefix, "metricsPrefix"));
  }

  /**
   * Provides the defaults used when no external configuration is supplied.
   *
   * @return low-water 1, high-water 64, prefix {@code tee}
   */
  public static TeeConfig defaults() {
    return new TeeConfig(DEFAULT_LOW_WATER, DEFAULT_HIGH_WATER, DEFAULT_METRICS_PREFIX);
  }

  /**
   * Builds a config from flat key/value pairs ({@code lowWater}, {@code highWater}, {@code metricsPrefix}).
   * Missing or blank entries keep their defaults.
   *
   * @param values flat configuration map, typically read from a YAML file by {@link #load(Path)}
   * @return validated configuration
   * @throws IllegalArgumentException when a value cannot be parsed or fails validation
   */
  public static TeeConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    int lowWater = intOrDefault(values, KEY_LOW_WATER, DEFAULT_LOW_WATER);
    int highWater = intOrDefault(values, KEY_HIGH_WATER, DEFAULT_HIGH_WATER);
    String prefix = values.get(KEY_METRICS_PREFIX);
    if (prefix == null || prefix.isBlank()) {
      prefix = DEFAULT_METRICS_PREFIX;
    }
    return new TeeConfig(lowWater, highWater, prefix);
  }

  /**
   * Loads the {@code tee} section (merged over {@code common}) of a YAML file.
   *
   * @param path YAML file location
   * @return parsed configuration, or {@link #defaults()} when the file does not exist
   * @throws IOException when the file exists but cannot be read
   * @throws IllegalArgumentException when the YAML or a value is invalid
   */
  public static TeeConfig load(Path path) throws IOException {
    return fromMap(TeeYamlSettings.read(path));
  }

  private static int intOrDefault(Map<String, String> values, String key, int fallback) {
    String raw = values.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return Numbers.parseRange(key, raw, 0, MAX_WATER_MARK);
  }
}
