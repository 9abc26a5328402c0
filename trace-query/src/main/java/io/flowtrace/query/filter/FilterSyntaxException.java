package io.flowtrace.query.filter;

import io.flowtrace.parser.api.AnalysisStage;
import io.flowtrace.parser.api.TraceAnalysisException;

/** Raised by strict filter compilation when the query cannot be parsed completely. */
public final class FilterSyntaxException extends TraceAnalysisException {
  private final String query;
  private final int position;

  public FilterSyntaxException(String message, String query, int position) {
    super(AnalysisStage.COMPILE, message);
    this.query = query;
    this.position = position;
  }

  public FilterSyntaxException(String message, String query, int position, Throwable cause) {
    super(AnalysisStage.COMPILE, message, cause);
    this.query = query;
    this.position = position;
  }

  /** Returns the position in the query where the error occurred (-1 if unknown). */
  public int getPosition() {
    return position;
  }

  public String getQuery() {
    return query;
  }

  /** Returns the message followed by the query and a caret under the failing position. */
  public String getFormattedMessage() {
    if (position < 0 || query == null) {
      return getMessage();
    }
    StringBuilder sb = new StringBuilder();
    sb.append(getMessage()).append("\n");
    sb.append(query).append("\n");
    sb.append(" ".repeat(Math.max(0, position))).append("^");
    return sb.toString();
  }
}
