package io.flowtrace.parser.api;

/** Pipeline stage an analysis failure originates from. */
public enum AnalysisStage {
  LOAD,
  COMPILE,
  EVALUATE,
  AGGREGATE
}
