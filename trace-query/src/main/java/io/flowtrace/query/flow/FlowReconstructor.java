package io.flowtrace.query.flow;

import io.flowtrace.parser.api.TraceEvent;
import io.flowtrace.parser.api.Values;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Groups events into flows: ordered sequences sharing a composite correlation key.
 *
 * <p>The key of an event is the text of each key field joined with {@value #SEPARATOR}; absent
 * values contribute empty text. Events whose key fields are all empty belong to no flow. Within a
 * flow, events are ordered by ascending timestamp and keep their input order on ties.
 */
public final class FlowReconstructor {
  public static final String SEPARATOR = "|";

  private final String timestampField;

  public FlowReconstructor() {
    this(TraceEvent.TIMESTAMP);
  }

  public FlowReconstructor(String timestampField) {
    this.timestampField = Objects.requireNonNull(timestampField, "timestampField");
  }

  /** Groups with the default {@code timestamp} field. */
  public static Map<String, List<TraceEvent>> buildFlow(
      List<TraceEvent> events, List<String> keyFields) {
    return new FlowReconstructor().build(events, keyFields);
  }

  /**
   * @return flows keyed by composite key, in order of each key's first appearance
   */
  public Map<String, List<TraceEvent>> build(List<TraceEvent> events, List<String> keyFields) {
    Objects.requireNonNull(keyFields, "keyFields");
    Map<String, List<TraceEvent>> flows = new LinkedHashMap<>();
    if (keyFields.isEmpty()) return flows;
    for (TraceEvent e : events) {
      String key = compositeKey(e, keyFields);
      if (key == null) continue;
      flows.computeIfAbsent(key, k -> new ArrayList<>()).add(e);
    }
    Comparator<TraceEvent> byTimestamp =
        Comparator.comparingDouble(e -> e.timestampOrZero(timestampField));
    for (List<TraceEvent> flow : flows.values()) {
      flow.sort(byTimestamp); // stable: equal timestamps keep input order
    }
    return flows;
  }

  /** Per-flow count and first/last timestamps, in flow order. */
  public List<FlowSummary> summarize(Map<String, List<TraceEvent>> flows) {
    List<FlowSummary> out = new ArrayList<>(flows.size());
    for (Map.Entry<String, List<TraceEvent>> entry : flows.entrySet()) {
      List<TraceEvent> events = entry.getValue();
      out.add(
          new FlowSummary(
              entry.getKey(),
              events.size(),
              timestampOf(events.get(0)),
              timestampOf(events.get(events.size() - 1))));
    }
    return out;
  }

  /**
   * @return the composite key, or {@code null} when every key component is empty
   */
  static String compositeKey(TraceEvent event, List<String> keyFields) {
    StringBuilder sb = new StringBuilder();
    boolean anyValue = false;
    for (int i = 0; i < keyFields.size(); i++) {
      if (i > 0) sb.append(SEPARATOR);
      String part = Values.toTextOrEmpty(event.get(keyFields.get(i)));
      if (!part.isEmpty()) anyValue = true;
      sb.append(part);
    }
    return anyValue ? sb.toString() : null;
  }

  private Double timestampOf(TraceEvent event) {
    double ts = Values.toNumber(event.get(timestampField));
    return Double.isNaN(ts) ? null : ts;
  }
}
