package io.flowtrace.query;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import io.flowtrace.parser.api.AnalysisStage;
import io.flowtrace.parser.api.TraceAnalysisException;
import io.flowtrace.parser.api.TraceEvent;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Analyzer settings, read from a JSON file.
 *
 * <p>Example:
 *
 * <pre>
 * {
 *   "timestampField": "timestamp",
 *   "correlationKeys": ["traceId"],
 *   "errorFields": ["result", "exception"],
 *   "fieldAliases": {"dur": "durationMicros"},
 *   "searchLimit": 100
 * }
 * </pre>
 *
 * Keys left out keep their defaults.
 */
public final class AnalyzerConfig {
  private static final Logger log = LoggerFactory.getLogger(AnalyzerConfig.class);

  static final String CONFIG_PROPERTY = "flowtrace.config";
  static final String CONFIG_ENV = "FLOWTRACE_CONFIG";
  private static final String DEFAULT_DIR = ".flowtrace";
  private static final String DEFAULT_FILE = "config.json";

  private static final Gson GSON = new Gson();

  private String timestampField = TraceEvent.TIMESTAMP;
  private List<String> correlationKeys = List.of();
  private List<String> errorFields = List.of("result");
  private String errorPattern = "(error|exception|fail|500|NOK)";
  private Map<String, String> fieldAliases = Map.of();
  private int searchLimit = 200;
  private int sampleLimit = 50;
  private int topK = 20;
  private int errorLimit = 500;
  private int filterCacheSize = 64;
  private boolean strictFilters = false;

  private AnalyzerConfig() {}

  public static AnalyzerConfig defaults() {
    return new AnalyzerConfig();
  }

  /**
   * Loads the configuration from (in order): 1. System property: flowtrace.config 2. Environment
   * variable: FLOWTRACE_CONFIG 3. Default: ~/.flowtrace/config.json. A missing file yields the
   * defaults.
   */
  public static AnalyzerConfig load() {
    Path path = resolveConfigPath(System.getProperty(CONFIG_PROPERTY), System.getenv(CONFIG_ENV));
    if (!Files.isRegularFile(path)) {
      log.debug("No analyzer configuration at {}, using defaults", path);
      return defaults();
    }
    return load(path);
  }

  /**
   * Reads the configuration stored at {@code path}.
   *
   * @throws TraceAnalysisException if the file cannot be read or is not valid configuration
   */
  public static AnalyzerConfig load(Path path) {
    String json;
    try {
      json = Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new TraceAnalysisException(
          AnalysisStage.LOAD, "Unable to read analyzer configuration " + path, e);
    }
    log.debug("Loading analyzer configuration from {}", path);
    return fromJson(json);
  }

  /**
   * @throws TraceAnalysisException if the text is not valid configuration
   */
  public static AnalyzerConfig fromJson(String json) {
    AnalyzerConfig config;
    try {
      config = GSON.fromJson(json, AnalyzerConfig.class);
    } catch (JsonParseException e) {
      throw new TraceAnalysisException(
          AnalysisStage.LOAD, "Invalid analyzer configuration: " + e.getMessage(), e);
    }
    if (config == null) return defaults();
    config.validate();
    return config;
  }

  static Path resolveConfigPath(String sysProp, String envVar) {
    if (sysProp != null && !sysProp.isBlank()) {
      return Paths.get(sysProp);
    }
    if (envVar != null && !envVar.isBlank()) {
      return Paths.get(envVar);
    }
    return Paths.get(System.getProperty("user.home"), DEFAULT_DIR, DEFAULT_FILE);
  }

  private void validate() {
    if (timestampField == null || timestampField.isBlank()) timestampField = TraceEvent.TIMESTAMP;
    correlationKeys = copyNames("correlationKeys", correlationKeys);
    errorFields = copyNames("errorFields", errorFields);
    fieldAliases = copyAliases(fieldAliases);
    if (errorPattern == null) errorPattern = defaults().errorPattern;
    try {
      Pattern.compile(errorPattern);
    } catch (PatternSyntaxException e) {
      throw new TraceAnalysisException(
          AnalysisStage.LOAD, "Invalid errorPattern '" + errorPattern + "'", e);
    }
    requirePositive("searchLimit", searchLimit);
    requirePositive("sampleLimit", sampleLimit);
    requirePositive("topK", topK);
    requirePositive("errorLimit", errorLimit);
    requirePositive("filterCacheSize", filterCacheSize);
  }

  private static List<String> copyNames(String name, List<String> values) {
    if (values == null) return List.of();
    for (String v : values) {
      if (v == null) {
        throw new TraceAnalysisException(
            AnalysisStage.LOAD, "Configuration value " + name + " must not contain null");
      }
    }
    return List.copyOf(values);
  }

  private static Map<String, String> copyAliases(Map<String, String> aliases) {
    if (aliases == null) return Map.of();
    for (Map.Entry<String, String> alias : aliases.entrySet()) {
      if (alias.getValue() == null) {
        throw new TraceAnalysisException(
            AnalysisStage.LOAD, "Field alias '" + alias.getKey() + "' has no target");
      }
    }
    return Map.copyOf(aliases);
  }

  private static void requirePositive(String name, int value) {
    if (value < 1) {
      throw new TraceAnalysisException(
          AnalysisStage.LOAD, "Configuration value " + name + " must be >= 1 but was " + value);
    }
  }

  public String timestampField() {
    return timestampField;
  }

  public List<String> correlationKeys() {
    return correlationKeys;
  }

  public List<String> errorFields() {
    return errorFields;
  }

  /** Error pattern, matched case-insensitively. */
  public Pattern errorPattern() {
    return Pattern.compile(errorPattern, Pattern.CASE_INSENSITIVE);
  }

  public Map<String, String> fieldAliases() {
    return fieldAliases;
  }

  /** Resolves an alias to its field path; unknown names are returned unchanged. */
  public String resolveField(String field) {
    return field == null ? null : fieldAliases.getOrDefault(field, field);
  }

  public int searchLimit() {
    return searchLimit;
  }

  public int sampleLimit() {
    return sampleLimit;
  }

  public int topK() {
    return topK;
  }

  public int errorLimit() {
    return errorLimit;
  }

  public int filterCacheSize() {
    return filterCacheSize;
  }

  public boolean strictFilters() {
    return strictFilters;
  }
}
