package io.flowtrace.parser.api;

import java.util.Objects;

/**
 * Unchecked failure raised by the analysis pipeline. Always tagged with the {@link AnalysisStage}
 * that produced it so callers can tell a bad filter from a bad aggregation request.
 */
public class TraceAnalysisException extends RuntimeException {
  private final AnalysisStage stage;

  public TraceAnalysisException(AnalysisStage stage, String message) {
    super(message);
    this.stage = Objects.requireNonNull(stage, "stage");
  }

  public TraceAnalysisException(AnalysisStage stage, String message, Throwable cause) {
    super(message, cause);
    this.stage = Objects.requireNonNull(stage, "stage");
  }

  public AnalysisStage getStage() {
    return stage;
  }

  @Override
  public String getMessage() {
    return "[" + stage + "] " + super.getMessage();
  }
}
