package ca.gc.cra.errors.logging;

import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Bounds the size of error diagnostics written to operator logs.
 * <p><strong>Why:</strong> Stack traces carried in error extras can run to many kilobytes.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see ErrorLogs
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Cuts {@code value} to at most {@code maxBytes} UTF-8 bytes on a code point boundary and appends the number of
   * bytes kept and the original byte count.
   *
   * @param value text to bound; {@code null} results in {@code "<null>"}
   * @param maxBytes UTF-8 budget; must be positive
   * @return {@code value} unchanged when it fits, otherwise the cut text with a {@code "... (truncated, N of M bytes)"}
   *     suffix
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    int total = value.getBytes(StandardCharsets.UTF_8).length;
    if (total <= maxBytes) {
      return value;
    }
    int used = 0;
    int end = 0;
    while (end < value.length()) {
      int cp = value.codePointAt(end);
      int width = utf8Width(cp);
      if (used + width > maxBytes) {
        break;
      }
      used += width;
      end += Character.charCount(cp);
    }
    return value.substring(0, end) + "... (truncated, " + used + " of " + total + " bytes)";
  }

  private static int utf8Width(int cp) {
    if (cp < 0x80) {
      return 1;
    }
    if (cp < 0x800) {
      return 2;
    }
    return cp < 0x10000 ? 3 : 4;
  }
}
