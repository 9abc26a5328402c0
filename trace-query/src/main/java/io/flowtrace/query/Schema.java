package io.flowtrace.query;

import io.flowtrace.parser.api.TraceEvent;
import java.util.Map;
import java.util.Optional;

/**
 * Discovered fields of a loaded batch.
 *
 * @param fields field name to number of events carrying it
 * @param sample the first event, if any
 */
public record Schema(Map<String, Long> fields, Optional<TraceEvent> sample) {}
