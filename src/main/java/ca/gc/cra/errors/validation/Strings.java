package ca.gc.cra.errors.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Checks the identifiers a taxonomy catalogue declares.
 * <p><strong>Why:</strong> Codes and namespaces are joined into {@code "<namespace>/<code>"} keys and written to logs
 * and wire payloads, so a code may not contain {@code '/'} and neither may contain whitespace.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class Strings {
  private static final Pattern SEGMENT = Pattern.compile("[A-Za-z0-9._-]+");

  private Strings() {
    // Utility
  }

  /**
   * Validates an error code: a single segment of letters, digits, dot, underscore or hyphen.
   *
   * @param name label used in exception messages
   * @param code candidate code; surrounding whitespace is ignored
   * @param maxLength maximum length in characters
   * @return the trimmed code
   * @throws NullPointerException if {@code code} is {@code null}
   * @throws IllegalArgumentException if the code is blank, longer than {@code maxLength} or not a single segment
   */
  public static String requireCode(String name, String code, int maxLength) {
    String value = requireBounded(name, code, maxLength);
    if (!SEGMENT.matcher(value).matches()) {
      throw new IllegalArgumentException(
          name + " must only contain letters, digits, '.', '_' or '-' (was \"" + value + "\")");
    }
    return value;
  }

  /**
   * Validates a namespace: one or more code-like segments joined by {@code '/'}, e.g. {@code cra/errors}.
   *
   * @param name label used in exception messages
   * @param namespace candidate namespace; surrounding whitespace is ignored
   * @param maxLength maximum length in characters
   * @return the trimmed namespace
   * @throws NullPointerException if {@code namespace} is {@code null}
   * @throws IllegalArgumentException if the namespace is blank, too long, or has an empty or invalid segment
   */
  public static String requireNamespace(String name, String namespace, int maxLength) {
    String value = requireBounded(name, namespace, maxLength);
    for (String segment : value.split("/", -1)) {
      if (!SEGMENT.matcher(segment).matches()) {
        throw new IllegalArgumentException(
            name + " must be '/'-separated segments of letters, digits, '.', '_' or '-' (was \"" + value + "\")");
      }
    }
    return value;
  }

  private static String requireBounded(String name, String value, int maxLength) {
    Objects.requireNonNull(value, name);
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    if (trimmed.length() > maxLength) {
      throw new IllegalArgumentException(name + " must be at most " + maxLength + " characters");
    }
    return trimmed;
  }
}
