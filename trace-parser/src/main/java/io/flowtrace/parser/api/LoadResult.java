package io.flowtrace.parser.api;

import java.util.List;
import java.util.Map;

/** Events of one batch load, in source order, with the counters of that load. */
public record LoadResult(List<TraceEvent> events, LoadSummary summary) {

  public LoadResult {
    events = List.copyOf(events);
  }

  /** Wraps events built in memory, e.g. by a caller that already decoded them. */
  public static LoadResult of(List<TraceEvent> events) {
    return new LoadResult(
        events, new LoadSummary(events.size(), 0, 0, FieldFrequencyTable.of(events)));
  }

  public FieldFrequencyTable fields() {
    return summary.fields();
  }

  /** Convenience view of the field-frequency table. */
  public Map<String, Long> fieldCounts() {
    return summary.fields().asMap();
  }

  public long skippedLines() {
    return summary.malformedLines();
  }

  public int size() {
    return events.size();
  }
}
