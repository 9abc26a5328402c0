package io.flowtrace.query.flow;

/**
 * Overview of one flow.
 *
 * @param key composite flow key
 * @param count number of events in the flow
 * @param firstTimestamp timestamp of the earliest event, {@code null} if it has none
 * @param lastTimestamp timestamp of the latest event, {@code null} if it has none
 */
public record FlowSummary(String key, int count, Double firstTimestamp, Double lastTimestamp) {

  /** Span between first and last event in milliseconds, or {@code null} if either is missing. */
  public Double durationMillis() {
    if (firstTimestamp == null || lastTimestamp == null) return null;
    return lastTimestamp - firstTimestamp;
  }
}
