package io.flowtrace.query.filter;

import static io.flowtrace.query.filter.FilterAst.*;

import io.flowtrace.query.filter.FilterToken.Type;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser for filter expressions.
 *
 * <pre>
 * expr    := and ( 'or' and )*
 * and     := primary ( 'and' primary )*
 * primary := '(' expr ')' | 'not' primary | 'exists' '(' IDENT ')'
 *          | IDENT ( CMP ( STRING | IDENT )? )?
 * </pre>
 *
 * <p>In permissive mode the parser never fails: a token that cannot start a primary is consumed
 * and replaced by {@link True}, a missing {@code )} is tolerated and tokens left after the
 * top-level expression are ignored. Groups and {@code not} nest at most {@value #MAX_DEPTH}
 * levels; anything deeper is replaced by {@link True}. Strict mode reports each of these as a
 * {@link FilterSyntaxException}.
 */
public final class FilterParser {
  private static final Logger log = LoggerFactory.getLogger(FilterParser.class);

  static final int MAX_DEPTH = 256;

  private final String query;
  private final List<FilterToken> tokens;
  private final boolean strict;
  private final UnaryOperator<String> fieldResolver;
  private int i = 0;
  private int depth = 0;

  private FilterParser(
      String query, List<FilterToken> tokens, boolean strict, UnaryOperator<String> fieldResolver) {
    this.query = query;
    this.tokens = tokens;
    this.strict = strict;
    this.fieldResolver = fieldResolver;
  }

  /** Permissive parse; a blank query yields {@link True}. */
  public static Node parse(String query) {
    return parse(query, false, UnaryOperator.identity());
  }

  /**
   * Strict parse.
   *
   * @throws FilterSyntaxException on any token the grammar does not accept
   */
  public static Node parseStrict(String query) {
    return parse(query, true, UnaryOperator.identity());
  }

  /**
   * @param strict fail on malformed input instead of recovering
   * @param fieldResolver maps field names as written (e.g. aliases) to dotted paths
   */
  public static Node parse(String query, boolean strict, UnaryOperator<String> fieldResolver) {
    if (query == null || query.isBlank()) return True.INSTANCE;
    List<FilterToken> tokens = FilterTokenizer.tokenize(query);
    return new FilterParser(query, tokens, strict, fieldResolver).parseQuery();
  }

  private Node parseQuery() {
    Node root = parseOr();
    if (i < tokens.size()) {
      FilterToken stray = tokens.get(i);
      if (strict) {
        throw error("Unexpected token '" + stray + "'", stray.position());
      }
      log.debug(
          "Ignoring trailing filter tokens {} in '{}'",
          tokens.subList(i, tokens.size()).stream()
              .map(FilterToken::toString)
              .collect(Collectors.joining(" ")),
          query);
    }
    return root;
  }

  private Node parseOr() {
    Node left = parseAnd();
    while (peekIs(Type.OR)) {
      i++;
      left = new Binary(left, Lop.OR, parseAnd());
    }
    return left;
  }

  private Node parseAnd() {
    Node left = parsePrimary();
    while (peekIs(Type.AND)) {
      i++;
      left = new Binary(left, Lop.AND, parsePrimary());
    }
    return left;
  }

  private Node parsePrimary() {
    FilterToken tok = peek();
    if (tok == null) {
      if (strict) throw error("Unexpected end of filter", query.length());
      return True.INSTANCE;
    }
    switch (tok.type()) {
      case LPAREN -> {
        if (tooDeep(tok)) return True.INSTANCE;
        i++;
        depth++;
        Node inner = parseOr();
        depth--;
        if (peekIs(Type.RPAREN)) {
          i++;
        } else if (strict) {
          throw error("Missing ')' for '(' opened", tok.position());
        }
        return inner;
      }
      case NOT -> {
        if (tooDeep(tok)) return True.INSTANCE;
        i++;
        depth++;
        Node inner = parsePrimary();
        depth--;
        return new Not(inner);
      }
      case IDENT -> {
        return parseComparison();
      }
      default -> {
        if (strict) throw error("Unexpected token '" + tok + "'", tok.position());
        i++;
        return True.INSTANCE;
      }
    }
  }

  private Node parseComparison() {
    FilterToken fieldTok = tokens.get(i++);
    String field = fieldTok.text();
    FilterToken next = peek();
    if (next != null && next.type().isComparator()) {
      i++;
      Op op = Op.fromToken(next.type());
      FilterToken value = peek();
      if (value != null && value.type().isValue()) {
        i++;
        if (strict && op == Op.REGEX) validatePattern(value);
        return new Predicate(resolve(field), op, value.text());
      }
      if (strict) {
        int at = value == null ? query.length() : value.position();
        throw error("Expected a value after '" + next.text() + "'", at);
      }
      return new Predicate(resolve(field), op, null);
    }
    if ("exists".equalsIgnoreCase(field)
        && peekIs(Type.LPAREN)
        && peekIs(1, Type.IDENT)
        && peekIs(2, Type.RPAREN)) {
      String target = tokens.get(i + 1).text();
      i += 3;
      return Predicate.exists(resolve(target));
    }
    return Predicate.exists(resolve(field));
  }

  /** Past the nesting limit the rest of the query is dropped, or rejected in strict mode. */
  private boolean tooDeep(FilterToken tok) {
    if (depth < MAX_DEPTH) return false;
    if (strict) {
      throw error("Filter nested deeper than " + MAX_DEPTH + " levels", tok.position());
    }
    log.debug(
        "Filter '{}' nests deeper than {} levels, ignoring the rest from position {}",
        abbreviate(query),
        MAX_DEPTH,
        tok.position());
    i = tokens.size();
    return true;
  }

  private static String abbreviate(String text) {
    return text.length() <= 80 ? text : text.substring(0, 80) + "...";
  }

  private void validatePattern(FilterToken value) {
    try {
      Pattern.compile(value.text());
    } catch (PatternSyntaxException e) {
      throw new FilterSyntaxException(
          "Invalid pattern '" + value.text() + "': " + e.getDescription(),
          query,
          value.position(),
          e);
    }
  }

  private String resolve(String field) {
    String resolved = fieldResolver.apply(field);
    return resolved == null ? field : resolved;
  }

  private FilterToken peek() {
    return i < tokens.size() ? tokens.get(i) : null;
  }

  private boolean peekIs(Type type) {
    return peekIs(0, type);
  }

  private boolean peekIs(int ahead, Type type) {
    int at = i + ahead;
    return at < tokens.size() && tokens.get(at).type() == type;
  }

  private FilterSyntaxException error(String message, int position) {
    return new FilterSyntaxException(message + " at position " + position, query, position);
  }
}
