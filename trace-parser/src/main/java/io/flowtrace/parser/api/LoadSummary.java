package io.flowtrace.parser.api;

/**
 * Outcome counters for one load pass.
 *
 * @param parsedLines lines decoded into events
 * @param malformedLines non-blank lines that were not a JSON object and were skipped
 * @param blankLines empty or whitespace-only lines
 * @param fields field frequency over the parsed events
 */
public record LoadSummary(
    long parsedLines, long malformedLines, long blankLines, FieldFrequencyTable fields) {

  public long totalLines() {
    return parsedLines + malformedLines + blankLines;
  }
}
