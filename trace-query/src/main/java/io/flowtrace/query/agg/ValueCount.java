package io.flowtrace.query.agg;

/** Occurrences of one distinct field value. */
public record ValueCount(String value, long count) {}
