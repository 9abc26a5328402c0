package io.flowtrace.parser.api;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mockito;

class TraceLoaderTest {

  private static Path resource(String name) throws URISyntaxException {
    return Paths.get(TraceLoaderTest.class.getResource(name).toURI());
  }

  @Test
  void skipsMalformedLineAndCountsFields() throws Exception {
    LoadResult result =
        TraceLoader.load(new StringReader("{\"a\":1,\"b\":2}\nnot-json\n{\"a\":3}\n"), "inline");

    assertEquals(2, result.size());
    assertEquals(Map.of("a", 1L, "b", 2L), result.events().get(0).asMap());
    assertEquals(Map.of("a", 3L), result.events().get(1).asMap());
    assertEquals(Map.of("a", 2L, "b", 1L), result.fieldCounts());
    assertEquals(1, result.skippedLines());
    assertEquals(0, result.summary().blankLines());
  }

  @Test
  void blankLinesAreNotErrors() throws Exception {
    LoadResult result = TraceLoader.load(new StringReader("\n   \n{\"x\":true}\n\t\n"), "inline");
    assertEquals(1, result.size());
    assertEquals(0, result.skippedLines());
    assertEquals(3, result.summary().blankLines());
  }

  @Test
  void preservesSourceOrderWithoutSorting() throws Exception {
    LoadResult result =
        TraceLoader.load(
            new StringReader("{\"timestamp\":30}\n{\"timestamp\":10}\n{\"timestamp\":20}\n"),
            "inline");
    List<Object> stamps = new ArrayList<>();
    for (TraceEvent e : result.events()) stamps.add(e.get("timestamp"));
    assertEquals(List.of(30L, 10L, 20L), stamps);
  }

  @Test
  void nonObjectJsonValuesAreMalformed() throws Exception {
    LoadResult result =
        TraceLoader.load(new StringReader("[1,2]\n42\n\"text\"\nnull\n{\"ok\":1}\n"), "inline");
    assertEquals(1, result.size());
    assertEquals(4, result.skippedLines());
  }

  @Test
  void rejectsLenientJsonAndTrailingContent() throws Exception {
    LoadResult result =
        TraceLoader.load(
            new StringReader("{a:1}\n{'a':1}\n{\"a\":1} trailing\n{\"a\":1}{\"b\":2}\n{\"a\":1}\n"),
            "inline");
    assertEquals(1, result.size());
    assertEquals(4, result.skippedLines());
  }

  @Test
  void countsNullValuedFields() throws Exception {
    LoadResult result = TraceLoader.load(new StringReader("{\"a\":null}\n{\"a\":1}\n"), "inline");
    assertEquals(2L, result.fields().count("a"));
    assertFalse(result.events().get(0).has("a"));
  }

  @Test
  void loadsFixtureFile() throws Exception {
    LoadResult result = TraceLoader.load(resource("/mixed.jsonl"));
    assertEquals(4, result.size());
    assertEquals(2, result.summary().malformedLines());
    assertEquals(2, result.summary().blankLines());
    assertEquals(8, result.summary().totalLines());
    assertEquals(4L, result.fields().count("timestamp"));
    assertEquals(2L, result.fields().count("durationMicros"));
    assertEquals(1L, result.fields().count("sql"));
    assertEquals(0L, result.fields().count("missing"));
    assertEquals(
        List.of(
            "timestamp", "event", "thread", "class", "method", "args", "sql", "durationMicros",
            "result"),
        new ArrayList<>(result.fields().fieldNames()));
  }

  @Test
  void streamingMatchesBatchLoading() throws Exception {
    Path file = resource("/mixed.jsonl");
    List<TraceEvent> streamed = new ArrayList<>();
    LoadSummary summary = TraceLoader.stream(file, streamed::add);
    LoadResult batch = TraceLoader.load(file);

    assertEquals(batch.events(), streamed);
    assertEquals(batch.summary().parsedLines(), summary.parsedLines());
    assertEquals(batch.summary().malformedLines(), summary.malformedLines());
    assertEquals(batch.fieldCounts(), summary.fields().asMap());
  }

  @Test
  @SuppressWarnings("unchecked")
  void streamingInvokesCallbackPerParsedEventInOrder() throws Exception {
    Consumer<TraceEvent> consumer = mock(Consumer.class);
    TraceLoader.stream(new StringReader("{\"n\":1}\nbroken\n{\"n\":2}\n"), "inline", consumer);

    verify(consumer, times(2)).accept(any());
    InOrder order = Mockito.inOrder(consumer);
    order.verify(consumer).accept(TraceEvent.of(Map.of("n", 1L)));
    order.verify(consumer).accept(TraceEvent.of(Map.of("n", 2L)));
  }

  @Test
  void missingFileFailsWithLoadStage(@TempDir Path dir) {
    Path missing = dir.resolve("absent.jsonl");
    TraceLoadException ex = assertThrows(TraceLoadException.class, () -> TraceLoader.load(missing));
    assertEquals(AnalysisStage.LOAD, ex.getStage());
    assertEquals(missing.toString(), ex.getSource());
    assertTrue(ex.getMessage().contains("LOAD"));
  }

  @Test
  void readFailureClosesSourceAndReportsLoadStage() {
    FailingReader reader = new FailingReader();
    assertThrows(TraceLoadException.class, () -> TraceLoader.load(reader, "broken-stream"));
    assertTrue(reader.closed);
  }

  @Test
  void closesReaderAfterSuccessfulLoad() throws Exception {
    TrackingReader reader = new TrackingReader("{\"a\":1}\n");
    TraceLoader.load(reader, "inline");
    assertTrue(reader.closed);
  }

  private static final class FailingReader extends Reader {
    boolean closed;

    @Override
    public int read(char[] cbuf, int off, int len) throws IOException {
      throw new IOException("device unavailable");
    }

    @Override
    public void close() {
      closed = true;
    }
  }

  private static final class TrackingReader extends StringReader {
    boolean closed;

    TrackingReader(String s) {
      super(s);
    }

    @Override
    public void close() {
      closed = true;
      super.close();
    }
  }
}
