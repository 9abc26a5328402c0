package io.flowtrace.parser.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Number of events containing each top-level field, in first-seen order. Filled while loading and
 * read-only afterwards.
 */
public final class FieldFrequencyTable {
  private final Map<String, Long> counts = new LinkedHashMap<>();

  FieldFrequencyTable() {}

  /** Builds a table over events that were not produced by {@link TraceLoader}. */
  public static FieldFrequencyTable of(Iterable<TraceEvent> events) {
    FieldFrequencyTable table = new FieldFrequencyTable();
    for (TraceEvent e : events) table.record(e);
    return table;
  }

  void record(TraceEvent event) {
    for (String name : event.fieldNames()) {
      counts.merge(name, 1L, Long::sum);
    }
  }

  /** Number of events carrying {@code field}; 0 when the field was never seen. */
  public long count(String field) {
    return counts.getOrDefault(field, 0L);
  }

  public Set<String> fieldNames() {
    return Collections.unmodifiableSet(counts.keySet());
  }

  public Map<String, Long> asMap() {
    return Collections.unmodifiableMap(counts);
  }

  public boolean isEmpty() {
    return counts.isEmpty();
  }

  @Override
  public String toString() {
    return counts.toString();
  }
}
