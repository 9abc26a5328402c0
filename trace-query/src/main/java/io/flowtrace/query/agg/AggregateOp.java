package io.flowtrace.query.agg;

import io.flowtrace.parser.api.AnalysisStage;
import io.flowtrace.parser.api.TraceAnalysisException;
import java.util.Locale;

public enum AggregateOp {
  COUNT,
  SUM,
  AVG,
  MAX,
  MIN;

  /** Case-insensitive lookup of {@code count|sum|avg|max|min}. */
  public static AggregateOp parse(String name) {
    if (name == null) {
      throw new TraceAnalysisException(AnalysisStage.AGGREGATE, "Aggregation op is required");
    }
    return switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "count" -> COUNT;
      case "sum" -> SUM;
      case "avg" -> AVG;
      case "max" -> MAX;
      case "min" -> MIN;
      default -> throw new TraceAnalysisException(
          AnalysisStage.AGGREGATE, "Unknown aggregation op: " + name);
    };
  }

  public boolean requiresField() {
    return this != COUNT;
  }

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
