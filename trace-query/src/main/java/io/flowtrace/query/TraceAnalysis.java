package io.flowtrace.query;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.flowtrace.parser.api.AnalysisStage;
import io.flowtrace.parser.api.LoadResult;
import io.flowtrace.parser.api.TraceAnalysisException;
import io.flowtrace.parser.api.TraceEvent;
import io.flowtrace.parser.api.TraceLoadException;
import io.flowtrace.parser.api.TraceLoader;
import io.flowtrace.parser.api.Values;
import io.flowtrace.parser.impl.JsonRecordDecoder;
import io.flowtrace.query.agg.AggregateRequest;
import io.flowtrace.query.agg.AggregateResult;
import io.flowtrace.query.agg.Aggregator;
import io.flowtrace.query.agg.GroupedValue;
import io.flowtrace.query.agg.ValueCount;
import io.flowtrace.query.core.RowProjector;
import io.flowtrace.query.core.RowSorter;
import io.flowtrace.query.filter.CompiledFilter;
import io.flowtrace.query.filter.CompiledFilterCache;
import io.flowtrace.query.filter.FilterCompiler;
import io.flowtrace.query.flow.FlowReconstructor;
import io.flowtrace.query.flow.FlowSummary;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One analysis pass over a loaded trace batch.
 *
 * <p>Every query method takes an optional filter expression (see {@link
 * io.flowtrace.query.filter.FilterParser}); {@code null} or blank selects every event. Field
 * arguments accept the aliases configured in {@link AnalyzerConfig#fieldAliases()}.
 *
 * <p>Instances are not thread-safe: the compiled-filter cache belongs to the instance.
 */
public final class TraceAnalysis {
  private static final Logger log = LoggerFactory.getLogger(TraceAnalysis.class);

  static final String TRUNCATED_FIELDS = "truncatedFields";
  static final String FULL_LOG_FILE = "fullLogFile";
  static final String EXPANDED_DATA = "_expandedData";

  private static final Gson GSON = new GsonBuilder().serializeNulls().create();

  private final LoadResult data;
  private final Path source;
  private final AnalyzerConfig config;
  private final CompiledFilterCache filters;
  private final FlowReconstructor flowReconstructor;
  private final Pattern errorPattern;

  private TraceAnalysis(LoadResult data, Path source, AnalyzerConfig config) {
    this.data = Objects.requireNonNull(data, "data");
    this.source = source;
    this.config = Objects.requireNonNull(config, "config");
    this.filters =
        new CompiledFilterCache(
            new FilterCompiler(config.fieldAliases(), config.strictFilters()),
            config.filterCacheSize());
    this.flowReconstructor = new FlowReconstructor(config.timestampField());
    this.errorPattern = config.errorPattern();
  }

  /** Loads {@code path} with the configuration resolved by {@link AnalyzerConfig#load()}. */
  public static TraceAnalysis open(Path path) throws TraceLoadException {
    return open(path, AnalyzerConfig.load());
  }

  public static TraceAnalysis open(Path path, AnalyzerConfig config) throws TraceLoadException {
    LoadResult result = TraceLoader.load(path);
    log.debug("Opened {} with {} event(s)", path, result.size());
    return new TraceAnalysis(result, path, config);
  }

  /** Wraps an already loaded batch; {@link #expand} needs a source file and is unavailable. */
  public static TraceAnalysis of(LoadResult data, AnalyzerConfig config) {
    return new TraceAnalysis(data, null, config);
  }

  public LoadResult data() {
    return data;
  }

  public List<TraceEvent> events() {
    return data.events();
  }

  public AnalyzerConfig config() {
    return config;
  }

  public Optional<Path> source() {
    return Optional.ofNullable(source);
  }

  public CompiledFilterCache filterCache() {
    return filters;
  }

  public Schema schema() {
    List<TraceEvent> events = data.events();
    return new Schema(
        data.fieldCounts(), events.isEmpty() ? Optional.empty() : Optional.of(events.get(0)));
  }

  /** Events matching {@code filter}, in load order. */
  public List<TraceEvent> filter(String filter) {
    CompiledFilter compiled = filters.get(filter);
    if (compiled.isIdentity()) return data.events();
    return compiled.select(data.events());
  }

  public List<Map<String, Object>> search(SearchRequest request) {
    return project(searchEvents(request), request.fields());
  }

  /**
   * Like {@link #search(SearchRequest)}; with {@code autoExpand}, rows whose entry was truncated
   * get the content of its segment file under {@value #EXPANDED_DATA}. Segment files that cannot
   * be read are logged and the row is returned unexpanded.
   */
  public List<Map<String, Object>> searchExpanded(SearchRequest request, boolean autoExpand) {
    List<TraceEvent> events = searchEvents(request);
    List<Map<String, Object>> rows = project(events, request.fields());
    if (!autoExpand) return rows;
    for (int i = 0; i < events.size(); i++) {
      TraceEvent e = events.get(i);
      if (!isTruncated(e)) continue;
      try {
        rows.get(i).put(EXPANDED_DATA, readSegment(e));
      } catch (TraceAnalysisException ex) {
        log.warn("Failed to expand log entry: {}", ex.getMessage());
      }
    }
    return rows;
  }

  /** Matching events ordered by timestamp (stable), optionally projected. */
  public List<Map<String, Object>> timeline(String filter, List<String> fields) {
    List<TraceEvent> ordered = RowSorter.sortedByTimestamp(filter(filter), config.timestampField());
    return project(ordered, fields);
  }

  /**
   * Groups every event into flows.
   *
   * @param keys key fields; {@code null} or empty uses the configured correlation keys
   */
  public Map<String, List<TraceEvent>> flows(List<String> keys) {
    return flowReconstructor.build(data.events(), flowKeys(keys));
  }

  public List<FlowSummary> flowSummaries(List<String> keys) {
    return flowReconstructor.summarize(flows(keys));
  }

  public AggregateResult aggregate(AggregateRequest request, String filter) {
    return Aggregator.aggregate(filter(filter), resolve(request));
  }

  public List<GroupedValue> aggregateBy(
      List<String> groupBy, AggregateRequest request, String filter) {
    return Aggregator.aggregateBy(filter(filter), resolveFields(groupBy), resolve(request));
  }

  /**
   * @param k number of values to return; {@code null} uses the configured default
   */
  public List<ValueCount> topK(String field, Integer k, String filter) {
    int limit = k == null ? config.topK() : k;
    return Aggregator.topK(filter(filter), config.resolveField(field), limit);
  }

  /**
   * Matching events whose configured error fields look like a failure, up to the configured error
   * limit.
   */
  public List<TraceEvent> errors(String filter) {
    List<TraceEvent> hits = new ArrayList<>();
    for (TraceEvent e : filter(filter)) {
      if (hits.size() >= config.errorLimit()) break;
      if (looksLikeError(e)) hits.add(e);
    }
    return hits;
  }

  /**
   * @param limit maximum events; {@code null} uses the configured sample limit
   */
  public List<TraceEvent> sample(String filter, Integer limit) {
    List<TraceEvent> matching = filter(filter);
    int n = Math.min(matching.size(), limit == null ? config.sampleLimit() : Math.max(0, limit));
    return List.copyOf(matching.subList(0, n));
  }

  /**
   * Renders matching events as a JSON array or as CSV. CSV columns are {@code fields} or, when
   * none are given, the fields of the first row; each cell holds the JSON encoding of the value
   * and absent or null values are written as {@code ""}.
   */
  public String export(String filter, List<String> fields, ExportFormat format) {
    List<TraceEvent> events = filter(filter);
    List<String> wanted = fields == null ? List.of() : fields;
    if (format == ExportFormat.JSON) {
      return GSON.toJson(project(events, wanted));
    }
    List<String> columns;
    if (!wanted.isEmpty()) {
      columns = wanted;
    } else if (!events.isEmpty()) {
      columns = new ArrayList<>(events.get(0).fieldNames());
    } else {
      columns = List.of();
    }
    StringBuilder sb = new StringBuilder(String.join(",", columns));
    for (TraceEvent e : events) {
      sb.append('\n');
      sb.append(
          columns.stream()
              .map(c -> csvCell(e.get(config.resolveField(c))))
              .collect(Collectors.joining(",")));
    }
    return sb.toString();
  }

  /**
   * Finds the entry with {@code timestamp} (and {@code eventKind}, when given) and, if it was
   * truncated by the agent, loads the full record from its segment file.
   *
   * @throws TraceAnalysisException if no entry matches or its segment file cannot be read
   */
  public ExpandedEntry expand(long timestamp, String eventKind) {
    TraceEvent entry =
        data.events().stream()
            .filter(e -> Values.toNumber(e.get(config.timestampField())) == timestamp)
            .filter(e -> eventKind == null || eventKind.equals(e.kind().orElse(null)))
            .findFirst()
            .orElseThrow(
                () ->
                    new TraceAnalysisException(
                        AnalysisStage.EVALUATE,
                        "Log entry not found: timestamp=" + timestamp + ", event=" + eventKind));
    if (!isTruncated(entry)) {
      return new ExpandedEntry(entry, null, Map.of(), "Log entry is not truncated");
    }
    Object full = readSegment(entry);
    return new ExpandedEntry(
        entry,
        full,
        entry.map(TRUNCATED_FIELDS).orElse(Map.of()),
        "Full log data retrieved successfully");
  }

  private List<TraceEvent> searchEvents(SearchRequest request) {
    List<TraceEvent> events = filter(request.filter());
    if (request.sortField() != null) {
      events =
          RowSorter.sortedByField(
              events, config.resolveField(request.sortField()), !request.descending());
    }
    int limit = request.limit() == null ? config.searchLimit() : Math.max(0, request.limit());
    return events.size() > limit ? events.subList(0, limit) : events;
  }

  private boolean looksLikeError(TraceEvent e) {
    for (String field : config.errorFields()) {
      String text = Values.toTextOrEmpty(e.get(config.resolveField(field)));
      if (errorPattern.matcher(text).find()) return true;
    }
    return false;
  }

  private static boolean isTruncated(TraceEvent e) {
    return e.has(TRUNCATED_FIELDS) && e.has(FULL_LOG_FILE);
  }

  private Object readSegment(TraceEvent entry) {
    if (source == null) {
      throw new TraceAnalysisException(
          AnalysisStage.EVALUATE, "Cannot expand entries of a batch without a source file");
    }
    Path base = source.toAbsolutePath().normalize().getParent();
    String name = Values.toTextOrEmpty(entry.get(FULL_LOG_FILE));
    Path segment;
    try {
      segment = base.resolve(name).normalize();
    } catch (InvalidPathException e) {
      throw new TraceAnalysisException(
          AnalysisStage.EVALUATE, "Invalid segmented file name '" + name + "'", e);
    }
    if (!segment.startsWith(base)) {
      throw new TraceAnalysisException(
          AnalysisStage.EVALUATE, "Segmented file is outside the trace directory: " + segment);
    }
    if (!Files.isRegularFile(segment)) {
      throw new TraceAnalysisException(
          AnalysisStage.EVALUATE, "Segmented file not found: " + segment);
    }
    try {
      return JsonRecordDecoder.decodeDocument(Files.readString(segment, StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new TraceAnalysisException(
          AnalysisStage.EVALUATE, "Unable to read segmented file " + segment, e);
    }
  }

  private List<Map<String, Object>> project(List<TraceEvent> events, List<String> fields) {
    return RowProjector.project(events, fields, config::resolveField);
  }

  private List<String> flowKeys(List<String> keys) {
    List<String> effective = keys == null || keys.isEmpty() ? config.correlationKeys() : keys;
    return resolveFields(effective);
  }

  private List<String> resolveFields(List<String> fields) {
    if (fields == null || fields.isEmpty() || config.fieldAliases().isEmpty()) return fields;
    return fields.stream().map(config::resolveField).collect(Collectors.toList());
  }

  private AggregateRequest resolve(AggregateRequest request) {
    if (request.field() == null) return request;
    return new AggregateRequest(request.op(), config.resolveField(request.field()));
  }

  private static String csvCell(Object value) {
    return value == null ? "\"\"" : GSON.toJson(value);
  }
}
