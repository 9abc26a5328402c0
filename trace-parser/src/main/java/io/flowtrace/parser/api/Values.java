package io.flowtrace.parser.api;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Utilities to navigate and coerce values from untyped event maps.
 *
 * <ul>
 *   <li>Nested navigation follows a dotted path ({@code a.b.c}) through nested maps only
 *   <li>Text and numeric coercion never throw; a failed numeric coercion yields {@code NaN}
 * </ul>
 */
public final class Values {
  private static final Gson GSON = new GsonBuilder().serializeNulls().create();
  private static final Pattern DECIMAL =
      Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

  private Values() {}

  /**
   * Navigate a nested value using a dotted path.
   *
   * @param root the root event map
   * @param dottedPath path such as {@code request.headers.host}
   * @return the located value or {@code null} if any segment is missing
   */
  public static Object get(Map<String, Object> root, String dottedPath) {
    if (dottedPath == null || dottedPath.isEmpty()) return null;
    return get(root, splitPath(dottedPath));
  }

  /**
   * Navigate a nested value using a sequence of keys.
   *
   * @return the located value or {@code null} if the path cannot be followed
   */
  public static Object get(Map<String, Object> root, String... path) {
    if (root == null) return null;
    Object current = root;
    for (String segment : path) {
      if (current instanceof Map<?, ?> map) {
        current = map.get(segment);
      } else {
        return null;
      }
    }
    return current;
  }

  /** Splits a dotted path into its segments. */
  public static String[] splitPath(String dottedPath) {
    return dottedPath.split("\\.", -1);
  }

  /**
   * Text representation used by equality, pattern matching and key building. Integral numbers
   * drop a trailing {@code .0}; maps and lists are rendered as compact JSON.
   *
   * @return the text form, or {@code null} for a {@code null} value
   */
  public static String toText(Object value) {
    if (value == null) return null;
    if (value instanceof String s) return s;
    if (value instanceof Number n) return numberToText(n);
    if (value instanceof Boolean b) return b.toString();
    if (value instanceof Map<?, ?> || value instanceof List<?>) return GSON.toJson(value);
    return String.valueOf(value);
  }

  /** Like {@link #toText(Object)} but renders {@code null} as empty text. */
  public static String toTextOrEmpty(Object value) {
    String text = toText(value);
    return text == null ? "" : text;
  }

  /**
   * Best-effort numeric coercion.
   *
   * @return the numeric value, or {@code Double.NaN} when the value is absent or not numeric
   */
  public static double toNumber(Object value) {
    if (value instanceof Number n) return n.doubleValue();
    if (value instanceof Boolean b) return b ? 1.0 : 0.0;
    if (value instanceof String s) return parseNumber(s);
    return Double.NaN;
  }

  /** Parses decimal text; blank or non-decimal text yields {@code NaN}. */
  public static double parseNumber(String text) {
    if (text == null) return Double.NaN;
    String t = text.trim();
    if (t.isEmpty() || !DECIMAL.matcher(t).matches()) return Double.NaN;
    try {
      return Double.parseDouble(t);
    } catch (NumberFormatException e) {
      return Double.NaN;
    }
  }

  private static String numberToText(Number n) {
    if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) {
      return n.toString();
    }
    double d = n.doubleValue();
    if (Double.isNaN(d) || Double.isInfinite(d)) return Double.toString(d);
    if (d == Math.rint(d) && Math.abs(d) < 1e15) {
      return Long.toString((long) d);
    }
    return BigDecimal.valueOf(d).stripTrailingZeros().toString();
  }
}
