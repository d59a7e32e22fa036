package com.gentoro.flowplan.utility;

import java.util.Locale;
import java.util.regex.Pattern;

public class StringUtility {
  private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
  private static final Pattern DECIMAL =
      Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

  public static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  public static boolean parseBoolean(String value) {
    if (value == null) return false;
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes" -> true;
      default -> false;
    };
  }

  /** Parses a whole number, {@code null} when the text is not one. */
  public static Long parseInteger(String value) {
    if (value == null) return null;
    String trimmed = value.trim();
    if (!INTEGER.matcher(trimmed).matches()) return null;
    try {
      return Long.parseLong(trimmed);
    } catch (NumberFormatException e) {
      // out of range for a long
      return null;
    }
  }

  /** Parses a decimal number in plain or exponent notation, {@code null} otherwise. */
  public static Double parseDecimal(String value) {
    if (value == null) return null;
    String trimmed = value.trim();
    if (!DECIMAL.matcher(trimmed).matches()) return null;
    return Double.valueOf(trimmed);
  }

  /**
   * Formats a double the way the execution engine prints floats: integral values keep a trailing
   * {@code .0} ({@code 2.0}, {@code 10000000.0}) instead of Java's exponent form.
   */
  public static String formatDecimal(double value) {
    if (Double.isNaN(value)) return "nan";
    if (Double.isInfinite(value)) return value > 0 ? "inf" : "-inf";
    if (value == Math.rint(value) && Math.abs(value) < 1e16) {
      return (long) value + ".0";
    }
    return Double.toString(value);
  }

  /** Single-quoted literal with backslashes and quotes escaped. */
  public static String quote(String value) {
    StringBuilder sb = new StringBuilder("'");
    for (char c : value.toCharArray()) {
      switch (c) {
        case '\\' -> sb.append("\\\\");
        case '\'' -> sb.append("\\'");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> sb.append(c);
      }
    }
    return sb.append('\'').toString();
  }
}
