package io.flowtrace.query.agg;

import io.flowtrace.parser.api.TraceEvent;
import io.flowtrace.parser.api.Values;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Scalar statistics over event collections. Values are read through numeric coercion and values
 * that do not coerce (including absent fields) are dropped, so mixed-type data never fails an
 * aggregation.
 */
public final class Aggregator {
  private static final String GROUP_SEPARATOR = "|";

  private Aggregator() {}

  public static AggregateResult aggregate(List<TraceEvent> events, AggregateRequest request) {
    Objects.requireNonNull(request, "request");
    if (request.op() == AggregateOp.COUNT) {
      return AggregateResult.of(AggregateOp.COUNT, events.size());
    }
    NumericAgg agg = new NumericAgg();
    String[] path = Values.splitPath(request.field());
    for (TraceEvent e : events) {
      double v = Values.toNumber(Values.get(e.asMap(), path));
      if (!Double.isNaN(v)) agg.add(v);
    }
    return agg.result(request.op());
  }

  /**
   * Aggregates each group of events sharing the same group-by values.
   *
   * @return one entry per group in order of first appearance
   */
  public static List<GroupedValue> aggregateBy(
      List<TraceEvent> events, List<String> groupBy, AggregateRequest request) {
    Objects.requireNonNull(groupBy, "groupBy");
    Map<String, List<TraceEvent>> groups = new LinkedHashMap<>();
    for (TraceEvent e : events) {
      groups.computeIfAbsent(groupKey(e, groupBy), k -> new ArrayList<>()).add(e);
    }
    List<GroupedValue> out = new ArrayList<>(groups.size());
    for (Map.Entry<String, List<TraceEvent>> g : groups.entrySet()) {
      out.add(new GroupedValue(g.getKey(), g.getValue().size(), aggregate(g.getValue(), request)));
    }
    return out;
  }

  /**
   * Most frequent values of {@code field}, by descending count; ties keep first-appearance order.
   * Events without the field count under the empty value.
   */
  public static List<ValueCount> topK(List<TraceEvent> events, String field, int k) {
    Objects.requireNonNull(field, "field");
    if (k <= 0) return List.of();
    Map<String, Long> counts = new LinkedHashMap<>();
    for (TraceEvent e : events) {
      counts.merge(Values.toTextOrEmpty(e.get(field)), 1L, Long::sum);
    }
    List<ValueCount> ranked = new ArrayList<>(counts.size());
    counts.forEach((value, count) -> ranked.add(new ValueCount(value, count)));
    ranked.sort(Comparator.comparingLong(ValueCount::count).reversed());
    return List.copyOf(ranked.subList(0, Math.min(k, ranked.size())));
  }

  private static String groupKey(TraceEvent e, List<String> groupBy) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < groupBy.size(); i++) {
      if (i > 0) sb.append(GROUP_SEPARATOR);
      sb.append(Values.toTextOrEmpty(e.get(groupBy.get(i))));
    }
    return sb.toString();
  }

  private static final class NumericAgg {
    long count = 0;
    double sum = 0.0;
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;

    void add(double x) {
      count++;
      sum += x;
      if (x < min) min = x;
      if (x > max) max = x;
    }

    AggregateResult result(AggregateOp op) {
      return switch (op) {
        case SUM -> AggregateResult.of(op, sum);
        case AVG -> AggregateResult.of(op, count > 0 ? sum / count : 0.0);
        case MAX -> count > 0 ? AggregateResult.of(op, max) : AggregateResult.empty(op);
        case MIN -> count > 0 ? AggregateResult.of(op, min) : AggregateResult.empty(op);
        case COUNT -> AggregateResult.of(op, count);
      };
    }
  }
}
