package io.flowtrace.query.core;

import io.flowtrace.parser.api.TraceEvent;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/** Turns events into result rows, optionally keeping only selected fields. */
public final class RowProjector {

  private RowProjector() {}

  /**
   * Projects events to rows.
   *
   * @param fields (dotted) fields to keep, in output column order; {@code null} or empty keeps
   *     every top-level field
   * @return one row per event; a selected field the event lacks maps to {@code null}
   */
  public static List<Map<String, Object>> project(List<TraceEvent> events, List<String> fields) {
    return project(events, fields, UnaryOperator.identity());
  }

  /**
   * Like {@link #project(List, List)}, but reads each column from the path {@code resolver}
   * returns for it. Rows stay keyed by the column names as given.
   */
  public static List<Map<String, Object>> project(
      List<TraceEvent> events, List<String> fields, UnaryOperator<String> resolver) {
    List<Map<String, Object>> rows = new ArrayList<>(events.size());
    for (TraceEvent e : events) rows.add(project(e, fields, resolver));
    return rows;
  }

  public static Map<String, Object> project(TraceEvent event, List<String> fields) {
    return project(event, fields, UnaryOperator.identity());
  }

  private static Map<String, Object> project(
      TraceEvent event, List<String> fields, UnaryOperator<String> resolver) {
    if (fields == null || fields.isEmpty()) {
      return new LinkedHashMap<>(event.asMap());
    }
    Map<String, Object> row = new LinkedHashMap<>();
    for (String f : fields) row.put(f, event.get(resolver.apply(f)));
    return row;
  }
}
