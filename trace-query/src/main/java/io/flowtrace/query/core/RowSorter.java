package io.flowtrace.query.core;

import io.flowtrace.parser.api.TraceEvent;
import io.flowtrace.parser.api.Values;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Stable sorting of events by field values. */
public final class RowSorter {
  // value kinds, in sort order
  private static final int NULL = 0;
  private static final int NUMBER = 1;
  private static final int BOOLEAN = 2;
  private static final int TEXT = 3;

  private RowSorter() {}

  /**
   * Returns a sorted copy of {@code events} ordered by a (dotted) field.
   *
   * @param events the events to sort; left untouched
   * @param field the field to sort by
   * @param ascending true for ascending order, false for descending
   */
  public static List<TraceEvent> sortedByField(
      List<TraceEvent> events, String field, boolean ascending) {
    List<TraceEvent> copy = new ArrayList<>(events);
    Comparator<TraceEvent> comparator = (a, b) -> compareValues(a.get(field), b.get(field));
    if (!ascending) {
      comparator = comparator.reversed();
    }
    copy.sort(comparator);
    return copy;
  }

  /** Returns a copy ordered by numeric timestamp; missing or non-numeric timestamps count as 0. */
  public static List<TraceEvent> sortedByTimestamp(List<TraceEvent> events, String timestampField) {
    List<TraceEvent> copy = new ArrayList<>(events);
    copy.sort(Comparator.comparingDouble(e -> e.timestampOrZero(timestampField)));
    return copy;
  }

  /**
   * Total order over event values: absent values first, then numbers (numerically), then booleans,
   * then everything else by its text form. Values of different kinds never compare by content, so
   * a field mixing numbers and text still sorts consistently.
   */
  public static int compareValues(Object a, Object b) {
    int ka = kind(a);
    int kb = kind(b);
    if (ka != kb) return Integer.compare(ka, kb);
    switch (ka) {
      case NULL:
        return 0;
      case NUMBER:
        return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
      case BOOLEAN:
        return Boolean.compare((Boolean) a, (Boolean) b);
      default:
        return Values.toTextOrEmpty(a).compareTo(Values.toTextOrEmpty(b));
    }
  }

  private static int kind(Object v) {
    if (v == null) return NULL;
    if (v instanceof Number) return NUMBER;
    if (v instanceof Boolean) return BOOLEAN;
    return TEXT;
  }
}
