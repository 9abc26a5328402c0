package io.flowtrace.query;

import java.util.List;

/**
 * Parameters of {@link TraceAnalysis#search(SearchRequest)}.
 *
 * @param filter filter expression; {@code null} or blank matches everything
 * @param fields fields to project; {@code null} or empty keeps whole events
 * @param sortField field to sort by; {@code null} keeps load order
 * @param descending sort direction when {@code sortField} is set
 * @param limit maximum rows; {@code null} uses the configured search limit
 */
public record SearchRequest(
    String filter, List<String> fields, String sortField, boolean descending, Integer limit) {

  public SearchRequest {
    fields = fields == null ? List.of() : List.copyOf(fields);
  }

  public static SearchRequest filter(String filter) {
    return new SearchRequest(filter, List.of(), null, false, null);
  }

  public SearchRequest withFields(List<String> fields) {
    return new SearchRequest(filter, fields, sortField, descending, limit);
  }

  public SearchRequest sortedBy(String field, boolean descending) {
    return new SearchRequest(filter, fields, field, descending, limit);
  }

  public SearchRequest limitedTo(int limit) {
    return new SearchRequest(filter, fields, sortField, descending, limit);
  }
}
