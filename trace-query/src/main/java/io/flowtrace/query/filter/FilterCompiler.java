package io.flowtrace.query.filter;

import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Compiles filter text into {@link CompiledFilter} predicates.
 *
 * <p>The static entry points use no aliases. {@link #compile(String)} recovers from malformed
 * input (see {@link FilterParser}); {@link #compileStrict(String)} rejects it.
 */
public final class FilterCompiler {
  private static final FilterCompiler PERMISSIVE = new FilterCompiler(Map.of(), false);
  private static final FilterCompiler STRICT = new FilterCompiler(Map.of(), true);

  private final Map<String, String> aliases;
  private final boolean strict;

  /**
   * @param aliases field-name aliases, applied to every field a filter references
   * @param strict reject malformed filters instead of recovering
   */
  public FilterCompiler(Map<String, String> aliases, boolean strict) {
    this.aliases = Map.copyOf(Objects.requireNonNull(aliases, "aliases"));
    this.strict = strict;
  }

  /** Permissive compilation; {@code null} or blank text matches every event. */
  public static CompiledFilter compile(String query) {
    return PERMISSIVE.compileFilter(query);
  }

  /**
   * Strict compilation; {@code null} or blank text matches every event.
   *
   * @throws FilterSyntaxException if the query is malformed
   */
  public static CompiledFilter compileStrict(String query) {
    return STRICT.compileFilter(query);
  }

  public CompiledFilter compileFilter(String query) {
    UnaryOperator<String> resolver = aliases.isEmpty() ? UnaryOperator.identity() : this::resolve;
    return new CompiledFilter(query, FilterParser.parse(query, strict, resolver));
  }

  public boolean isStrict() {
    return strict;
  }

  private String resolve(String field) {
    return aliases.getOrDefault(field, field);
  }
}
