package io.flowtrace.query.filter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Bounded LRU cache of compiled filters keyed by their query text. Each instance belongs to one
 * analysis; nothing is shared between instances.
 */
public final class CompiledFilterCache {
  private static final String BLANK_KEY = "";

  private final FilterCompiler compiler;
  private final Map<String, CompiledFilter> entries;
  private long hits;
  private long misses;

  public CompiledFilterCache(FilterCompiler compiler, int maxEntries) {
    this.compiler = Objects.requireNonNull(compiler, "compiler");
    if (maxEntries < 1) throw new IllegalArgumentException("maxEntries must be >= 1");
    this.entries =
        new LinkedHashMap<>(16, 0.75f, true) {
          @Override
          protected boolean removeEldestEntry(Map.Entry<String, CompiledFilter> eldest) {
            return size() > maxEntries;
          }
        };
  }

  /** Returns the cached filter for {@code query}, compiling it on first use. */
  public CompiledFilter get(String query) {
    String key = query == null || query.isBlank() ? BLANK_KEY : query;
    CompiledFilter cached = entries.get(key);
    if (cached != null) {
      hits++;
      return cached;
    }
    misses++;
    CompiledFilter compiled = compiler.compileFilter(query);
    entries.put(key, compiled);
    return compiled;
  }

  /** Drops the entry for {@code query}, if present. */
  public void invalidate(String query) {
    entries.remove(query == null || query.isBlank() ? BLANK_KEY : query);
  }

  public void clear() {
    entries.clear();
  }

  public int size() {
    return entries.size();
  }

  public long hits() {
    return hits;
  }

  public long misses() {
    return misses;
  }
}
