package io.flowtrace.query.agg;

import io.flowtrace.parser.api.AnalysisStage;
import io.flowtrace.parser.api.TraceAnalysisException;
import java.util.Objects;

/**
 * What to compute: an op and, for every op except {@code count}, the (dotted) field to read.
 */
public record AggregateRequest(AggregateOp op, String field) {

  public AggregateRequest {
    Objects.requireNonNull(op, "op");
    if (field != null && field.isBlank()) field = null;
    if (op.requiresField() && field == null) {
      throw new TraceAnalysisException(
          AnalysisStage.AGGREGATE, "Aggregation '" + op.label() + "' requires a field");
    }
  }

  public static AggregateRequest of(String op, String field) {
    return new AggregateRequest(AggregateOp.parse(op), field);
  }

  public static AggregateRequest count() {
    return new AggregateRequest(AggregateOp.COUNT, null);
  }

  @Override
  public String toString() {
    return op.label() + (field == null ? "" : "(" + field + ")");
  }
}
