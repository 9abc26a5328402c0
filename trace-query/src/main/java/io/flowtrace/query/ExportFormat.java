package io.flowtrace.query;

public enum ExportFormat {
  CSV,
  JSON
}
