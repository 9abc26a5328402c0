package io.flowtrace.query;

import static org.junit.jupiter.api.Assertions.*;

import io.flowtrace.parser.api.AnalysisStage;
import io.flowtrace.parser.api.TraceAnalysisException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AnalyzerConfigTest {

  @Test
  void defaults() {
    AnalyzerConfig c = AnalyzerConfig.defaults();
    assertEquals("timestamp", c.timestampField());
    assertEquals(List.of(), c.correlationKeys());
    assertEquals(List.of("result"), c.errorFields());
    assertEquals(200, c.searchLimit());
    assertEquals(50, c.sampleLimit());
    assertEquals(20, c.topK());
    assertEquals(500, c.errorLimit());
    assertEquals(64, c.filterCacheSize());
    assertFalse(c.strictFilters());
    assertTrue(c.errorPattern().matcher("java.lang.RuntimeException").find());
    assertTrue(c.errorPattern().matcher("HTTP 500").find());
    assertFalse(c.errorPattern().matcher("OK").find());
  }

  @Test
  void partialJsonKeepsOtherDefaults() {
    AnalyzerConfig c =
        AnalyzerConfig.fromJson(
            "{\"correlationKeys\":[\"traceId\"],\"fieldAliases\":{\"dur\":\"durationMicros\"},"
                + "\"searchLimit\":5,\"strictFilters\":true}");
    assertEquals(List.of("traceId"), c.correlationKeys());
    assertEquals(Map.of("dur", "durationMicros"), c.fieldAliases());
    assertEquals(5, c.searchLimit());
    assertTrue(c.strictFilters());
    assertEquals(50, c.sampleLimit());
    assertEquals("durationMicros", c.resolveField("dur"));
    assertEquals("other", c.resolveField("other"));
    assertNull(c.resolveField(null));
  }

  @Test
  void emptyDocumentMeansDefaults() {
    assertEquals(200, AnalyzerConfig.fromJson("").searchLimit());
    assertEquals(200, AnalyzerConfig.fromJson("{}").searchLimit());
  }

  @Test
  void nullsFallBackToDefaults() {
    AnalyzerConfig c =
        AnalyzerConfig.fromJson("{\"timestampField\":null,\"correlationKeys\":null}");
    assertEquals("timestamp", c.timestampField());
    assertEquals(List.of(), c.correlationKeys());
  }

  @Test
  void invalidValuesAreLoadErrors() {
    TraceAnalysisException ex =
        assertThrows(TraceAnalysisException.class, () -> AnalyzerConfig.fromJson("{\"topK\":0}"));
    assertEquals(AnalysisStage.LOAD, ex.getStage());
    assertTrue(ex.getMessage().contains("topK"));

    assertThrows(
        TraceAnalysisException.class, () -> AnalyzerConfig.fromJson("{\"errorPattern\":\"(\"}"));
    assertThrows(TraceAnalysisException.class, () -> AnalyzerConfig.fromJson("{\"topK\":\"x\"}"));
    assertThrows(TraceAnalysisException.class, () -> AnalyzerConfig.fromJson("[1,2]"));
  }

  @Test
  void nullEntriesAreLoadErrors() {
    for (String json :
        List.of(
            "{\"correlationKeys\":[null]}",
            "{\"errorFields\":[\"result\",null]}",
            "{\"fieldAliases\":{\"dur\":null}}")) {
      TraceAnalysisException ex =
          assertThrows(TraceAnalysisException.class, () -> AnalyzerConfig.fromJson(json), json);
      assertEquals(AnalysisStage.LOAD, ex.getStage());
    }
  }

  @Test
  void loadsFromFile(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("config.json");
    Files.writeString(file, "{\"timestampField\":\"ts\",\"errorFields\":[\"status\"]}");
    AnalyzerConfig c = AnalyzerConfig.load(file);
    assertEquals("ts", c.timestampField());
    assertEquals(List.of("status"), c.errorFields());
  }

  @Test
  void unreadableFileIsLoadError(@TempDir Path dir) {
    TraceAnalysisException ex =
        assertThrows(
            TraceAnalysisException.class, () -> AnalyzerConfig.load(dir.resolve("nope.json")));
    assertEquals(AnalysisStage.LOAD, ex.getStage());
  }

  @Test
  void configPathResolution() {
    assertEquals(Paths.get("/a/b.json"), AnalyzerConfig.resolveConfigPath("/a/b.json", "/c.json"));
    assertEquals(Paths.get("/c.json"), AnalyzerConfig.resolveConfigPath(" ", "/c.json"));
    assertEquals(
        Paths.get(System.getProperty("user.home"), ".flowtrace", "config.json"),
        AnalyzerConfig.resolveConfigPath(null, null));
  }

  @Test
  void systemPropertySelectsFile(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("custom.json");
    Files.writeString(file, "{\"sampleLimit\":7}");
    String previous = System.getProperty(AnalyzerConfig.CONFIG_PROPERTY);
    System.setProperty(AnalyzerConfig.CONFIG_PROPERTY, file.toString());
    try {
      assertEquals(7, AnalyzerConfig.load().sampleLimit());
      System.setProperty(AnalyzerConfig.CONFIG_PROPERTY, dir.resolve("absent.json").toString());
      assertEquals(50, AnalyzerConfig.load().sampleLimit());
    } finally {
      if (previous == null) {
        System.clearProperty(AnalyzerConfig.CONFIG_PROPERTY);
      } else {
        System.setProperty(AnalyzerConfig.CONFIG_PROPERTY, previous);
      }
    }
  }
}
