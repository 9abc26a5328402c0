package io.flowtrace.parser.api;

import java.io.IOException;

/** Raised when a trace source cannot be read at all. Malformed lines never produce this. */
public final class TraceLoadException extends IOException {
  private final String source;

  public TraceLoadException(String source, Throwable cause) {
    super("[" + AnalysisStage.LOAD + "] Unable to read trace source: " + source, cause);
    this.source = source;
  }

  public AnalysisStage getStage() {
    return AnalysisStage.LOAD;
  }

  /** Returns a description of the source that failed (usually a file path). */
  public String getSource() {
    return source;
  }
}
