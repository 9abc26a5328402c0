package io.flowtrace.query.agg;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Scalar outcome of one aggregation. Only {@code max} and {@code min} can be empty, when no event
 * contributed a numeric value; {@code sum} and {@code avg} are 0 in that case.
 */
public final class AggregateResult {
  private final AggregateOp op;
  private final OptionalDouble value;

  private AggregateResult(AggregateOp op, OptionalDouble value) {
    this.op = op;
    this.value = value;
  }

  static AggregateResult of(AggregateOp op, double value) {
    return new AggregateResult(op, OptionalDouble.of(value));
  }

  static AggregateResult empty(AggregateOp op) {
    return new AggregateResult(op, OptionalDouble.empty());
  }

  public AggregateOp op() {
    return op;
  }

  public OptionalDouble value() {
    return value;
  }

  public boolean isPresent() {
    return value.isPresent();
  }

  /**
   * @throws java.util.NoSuchElementException for an empty {@code max}/{@code min}
   */
  public double asDouble() {
    return value.getAsDouble();
  }

  /** Integer view, meant for {@code count}. */
  public long asLong() {
    return (long) value.getAsDouble();
  }

  /** Boxed value for serialization: {@link Long} for count, {@link Double} otherwise, or null. */
  public Number toNumber() {
    if (value.isEmpty()) return null;
    if (op == AggregateOp.COUNT) return Long.valueOf(asLong());
    return Double.valueOf(value.getAsDouble());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    return o instanceof AggregateResult other && op == other.op && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(op, value);
  }

  @Override
  public String toString() {
    return op.label() + "=" + (value.isPresent() ? toNumber() : "<none>");
  }
}
