package io.flowtrace.query;

import io.flowtrace.parser.api.TraceEvent;
import java.util.Map;

/**
 * Result of expanding a possibly truncated log entry.
 *
 * @param entry the entry as loaded
 * @param fullData decoded content of the entry's segment file, {@code null} when not truncated
 * @param truncatedFields truncation descriptors of the entry (field name to
 *     {@code {originalLength, threshold}}), empty when not truncated
 * @param message human-readable outcome
 */
public record ExpandedEntry(
    TraceEvent entry, Object fullData, Map<String, Object> truncatedFields, String message) {

  public boolean isTruncated() {
    return fullData != null;
  }
}
