package ca.gc.cra.tee.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings read from tee configuration.
 * <p><strong>Why:</strong> Metric prefixes end up as OpenTelemetry instrument names, so they are restricted to a
 * character set every exporter accepts.
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final Pattern METRIC_PREFIX_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9._-]*$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input with leading/trailing whitespace removed
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a dotted metric prefix such as {@code tee} or {@code ingest.tee}.
   *
   * @param name logical parameter name included in exception messages
   * @param prefix candidate prefix; must be non-null
   * @return trimmed prefix starting with a letter and composed of {@code [A-Za-z0-9._-]}
   * @throws IllegalArgumentException if the prefix is blank or contains unsupported characters
   */
  public static String sanitizeMetricPrefix(String name, String prefix) {
    String sanitized = requireNonBlank(name, prefix);
    if (!METRIC_PREFIX_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must start with a letter and only contain letters, digits, dot, underscore, or hyphen"));
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
