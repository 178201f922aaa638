package ca.gc.cra.soak.logging;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Formatting helpers for monitor log lines.
 *
 * <p>Alert details and subscriber failure messages are caller-controlled, so they are capped before
 * they reach a log line. Byte counts are rendered in megabytes, the unit every threshold is set in.</p>
 *
 * @since SOAK 0.1
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final double BYTES_PER_MB = 1024d * 1024d;

  private Logs() {
    // Utility
  }

  /**
   * Caps a string at {@code maxBytes} of UTF-8 without splitting a code point.
   *
   * @param value text to cap; {@code null} renders as {@code "<null>"}
   * @param maxBytes UTF-8 budget; must be positive
   * @return {@code value} when it fits, otherwise the kept prefix followed by
   *     {@code "... (truncated, kept of total)"}
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
    StringBuilder kept = new StringBuilder();
    int used = 0;
    int i = 0;
    while (i < value.length()) {
      int cp = value.codePointAt(i);
      int width = utf8Width(cp);
      if (used + width > maxBytes) {
        break;
      }
      kept.appendCodePoint(cp);
      used += width;
      i += Character.charCount(cp);
    }
    return kept + "... (truncated, " + maxBytes + " of " + total + ")";
  }

  /**
   * Formats a byte count as megabytes with one decimal, for example {@code 12.5MB}.
   *
   * @param bytes byte count
   * @return formatted text
   */
  public static String megabytes(long bytes) {
    return String.format(Locale.ROOT, "%.1fMB", bytes / BYTES_PER_MB);
  }

  /**
   * Formats a ratio or percentage value with one decimal and a trailing {@code %}.
   *
   * @param percent value already scaled to 0..100
   * @return formatted text
   */
  public static String percent(double percent) {
    return String.format(Locale.ROOT, "%.1f%%", percent);
  }

  private static int utf8Width(int codePoint) {
    if (codePoint < 0x80) {
      return 1;
    }
    if (codePoint < 0x800) {
      return 2;
    }
    return codePoint < 0x10000 ? 3 : 4;
  }
}
