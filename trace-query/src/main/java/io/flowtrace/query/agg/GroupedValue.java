package io.flowtrace.query.agg;

/** Aggregate of one group; {@code key} joins the group-by values with {@code |}. */
public record GroupedValue(String key, int size, AggregateResult result) {}
