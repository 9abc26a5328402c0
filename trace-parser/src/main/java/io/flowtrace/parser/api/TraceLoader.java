package io.flowtrace.parser.api;

import io.flowtrace.parser.impl.JsonRecordDecoder;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads newline-delimited JSON trace records.
 *
 * <p>Every line is decoded on its own. Blank lines are ignored, lines that are not a JSON object
 * are skipped and counted, and loading always continues with the next line. Only a source that
 * cannot be read fails the call, with a {@link TraceLoadException}.
 *
 * <p>The batch entry points ({@code load}) and the streaming ones ({@code stream}) share the same
 * per-line routine, so both see exactly the same events for the same input. Sources are closed
 * before the call returns.
 */
public final class TraceLoader {
  private static final Logger log = LoggerFactory.getLogger(TraceLoader.class);

  private TraceLoader() {}

  /** Loads a UTF-8 JSONL file into memory. */
  public static LoadResult load(Path path) throws TraceLoadException {
    List<TraceEvent> events = new ArrayList<>();
    LoadSummary summary = stream(path, events::add);
    return new LoadResult(events, summary);
  }

  /** Loads all records from {@code reader}; the reader is closed afterwards. */
  public static LoadResult load(Reader reader, String sourceName) throws TraceLoadException {
    List<TraceEvent> events = new ArrayList<>();
    LoadSummary summary = stream(reader, sourceName, events::add);
    return new LoadResult(events, summary);
  }

  /**
   * Streams a UTF-8 JSONL file, handing each parsed event to {@code consumer} in source order.
   * Invalid byte sequences are replaced rather than failing the load.
   */
  public static LoadSummary stream(Path path, Consumer<? super TraceEvent> consumer)
      throws TraceLoadException {
    Objects.requireNonNull(path, "path");
    Reader reader;
    try {
      reader = new InputStreamReader(Files.newInputStream(path), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new TraceLoadException(path.toString(), e);
    }
    return stream(reader, path.toString(), consumer);
  }

  /** Streams records from {@code reader}; the reader is closed afterwards. */
  public static LoadSummary stream(
      Reader reader, String sourceName, Consumer<? super TraceEvent> consumer)
      throws TraceLoadException {
    Objects.requireNonNull(reader, "reader");
    Objects.requireNonNull(consumer, "consumer");
    FieldFrequencyTable fields = new FieldFrequencyTable();
    long parsed = 0;
    long malformed = 0;
    long blank = 0;
    long lineNo = 0;
    BufferedReader buffered =
        reader instanceof BufferedReader br ? br : new BufferedReader(reader);
    try (BufferedReader in = buffered) {
      String line;
      while ((line = in.readLine()) != null) {
        lineNo++;
        if (line.isBlank()) {
          blank++;
          continue;
        }
        TraceEvent event = parseLine(line, lineNo, sourceName);
        if (event == null) {
          malformed++;
          continue;
        }
        parsed++;
        fields.record(event);
        consumer.accept(event);
      }
    } catch (IOException e) {
      throw new TraceLoadException(sourceName, e);
    }
    if (malformed > 0) {
      log.warn("Skipped {} malformed line(s) out of {} in {}", malformed, lineNo, sourceName);
    }
    log.debug(
        "Loaded {} event(s) from {} ({} malformed, {} blank)",
        parsed,
        sourceName,
        malformed,
        blank);
    return new LoadSummary(parsed, malformed, blank, fields);
  }

  /**
   * Decodes one non-blank line.
   *
   * @return the event, or {@code null} if the line is not a JSON object
   */
  static TraceEvent parseLine(String line, long lineNo, String sourceName) {
    try {
      return TraceEvent.of(JsonRecordDecoder.decodeObject(line.trim()));
    } catch (IOException e) {
      log.debug("Skipping malformed record at {}:{}: {}", sourceName, lineNo, e.getMessage());
      return null;
    }
  }
}
