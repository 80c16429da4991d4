package com.csvinsight.profiler.util;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Shared rules for individual dataset cells: what counts as missing, what counts as numeric and
 * how a cell is rendered as text.
 */
public final class CellValues {

  private CellValues() {}

  public static boolean isMissing(Object value) {
    return value == null || "".equals(value);
  }

  public static boolean isNumeric(Object value) {
    return value instanceof Double;
  }

  /**
   * Brings a raw cell into the dataset's canonical form. Every {@link Number} becomes a {@link
   * Double} so that {@code 25} and {@code 25.0} compare equal; booleans and strings are kept; any
   * other object is reduced to its string form.
   */
  public static Object normalize(Object value) {
    if (value == null || value instanceof String || value instanceof Boolean) {
      return value;
    }
    if (value instanceof Double) {
      return value;
    }
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    return value.toString();
  }

  /** Natural text form of a cell: {@code 25} rather than {@code 25.0}, empty for missing. */
  public static String format(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof Double) {
      return formatNumber((Double) value);
    }
    return value.toString();
  }

  public static String formatNumber(double number) {
    if (Double.isNaN(number) || Double.isInfinite(number)) {
      return Double.toString(number);
    }
    if (number == Math.rint(number) && Math.abs(number) < 1e15) {
      return Long.toString((long) number);
    }
    return new BigDecimal(Double.toString(number)).stripTrailingZeros().toPlainString();
  }

  /** Two decimal places, independent of the JVM default locale. */
  public static String formatFixed(double number) {
    return String.format(Locale.ROOT, "%.2f", number);
  }

  /** {@code part / whole * 100}, or 0 when {@code whole} is 0. */
  public static double percentage(long part, long whole) {
    if (whole == 0) {
      return 0.0;
    }
    return (double) part / whole * 100;
  }
}
