package io.flowtrace.query.filter;

import static io.flowtrace.query.filter.FilterAst.*;

import io.flowtrace.parser.api.TraceEvent;
import io.flowtrace.parser.api.Values;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A filter lowered into an evaluable predicate. Field paths are split and patterns compiled once
 * here, so {@link #test(TraceEvent)} does no parsing and keeps no state between calls.
 */
public final class CompiledFilter implements java.util.function.Predicate<TraceEvent> {
  private static final Logger log = LoggerFactory.getLogger(CompiledFilter.class);

  private final String query;
  private final Node ast;
  private final java.util.function.Predicate<TraceEvent> predicate;

  CompiledFilter(String query, Node ast) {
    this.query = query;
    this.ast = Objects.requireNonNull(ast, "ast");
    this.predicate = lower(ast);
  }

  @Override
  public boolean test(TraceEvent event) {
    return predicate.test(event);
  }

  /** Returns the events matching this filter, in their original order. */
  public List<TraceEvent> select(List<TraceEvent> events) {
    List<TraceEvent> out = new ArrayList<>();
    for (TraceEvent e : events) {
      if (predicate.test(e)) out.add(e);
    }
    return out;
  }

  public String query() {
    return query;
  }

  public Node ast() {
    return ast;
  }

  /** True when the whole filter reduced to {@link True}, e.g. for a blank query. */
  public boolean isIdentity() {
    return ast instanceof True;
  }

  @Override
  public String toString() {
    return "CompiledFilter{" + ast + "}";
  }

  private java.util.function.Predicate<TraceEvent> lower(Node node) {
    if (node instanceof True) {
      return e -> true;
    } else if (node instanceof Not not) {
      var inner = lower(not.inner());
      return e -> !inner.test(e);
    } else if (node instanceof Binary bin) {
      return lowerChain(bin);
    } else if (node instanceof Predicate p) {
      return lowerPredicate(p);
    }
    throw new IllegalStateException("Unknown filter node: " + node);
  }

  /**
   * Lowers a left-leaning run of the same operator ({@code a and b and c ...}) as one flat list,
   * so long chains do not recurse once per operand.
   */
  private java.util.function.Predicate<TraceEvent> lowerChain(Binary bin) {
    Lop op = bin.op();
    Deque<Node> operands = new ArrayDeque<>();
    Node cur = bin;
    while (cur instanceof Binary b && b.op() == op) {
      operands.addFirst(b.right());
      cur = b.left();
    }
    operands.addFirst(cur);
    List<java.util.function.Predicate<TraceEvent>> parts = new ArrayList<>(operands.size());
    for (Node operand : operands) parts.add(lower(operand));
    // every operand is evaluated; none has side effects
    if (op == Lop.AND) {
      return e -> {
        boolean all = true;
        for (var p : parts) all &= p.test(e);
        return all;
      };
    }
    return e -> {
      boolean any = false;
      for (var p : parts) any |= p.test(e);
      return any;
    };
  }

  private java.util.function.Predicate<TraceEvent> lowerPredicate(Predicate p) {
    String[] path = Values.splitPath(p.field());
    String literal = p.literal() == null ? "" : p.literal();
    return switch (p.op()) {
      case EXISTS -> e -> Values.get(e.asMap(), path) != null;
      case EQ -> e -> {
        Object v = Values.get(e.asMap(), path);
        return v != null && literal.equals(Values.toText(v));
      };
      case REGEX -> regexPredicate(path, literal);
      case LT, GT, LE, GE -> orderingPredicate(path, p.op(), literal);
    };
  }

  private java.util.function.Predicate<TraceEvent> regexPredicate(String[] path, String literal) {
    Pattern pattern = compilePattern(literal);
    if (pattern == null) return e -> false;
    return e -> {
      Object v = Values.get(e.asMap(), path);
      return v != null && pattern.matcher(Values.toText(v)).find();
    };
  }

  private static java.util.function.Predicate<TraceEvent> orderingPredicate(
      String[] path, Op op, String literal) {
    double rhs = Values.parseNumber(literal);
    return e -> {
      Object v = Values.get(e.asMap(), path);
      return v != null && compareNumbers(Values.toNumber(v), op, rhs);
    };
  }

  private Pattern compilePattern(String literal) {
    try {
      return Pattern.compile(literal);
    } catch (PatternSyntaxException e) {
      log.warn(
          "Invalid pattern '{}' in filter '{}': {}; the comparison will never match",
          literal,
          query,
          e.getDescription());
      return null;
    }
  }

  static boolean compareNumbers(double lhs, Op op, double rhs) {
    if (Double.isNaN(lhs) || Double.isNaN(rhs)) return false;
    return switch (op) {
      case LT -> lhs < rhs;
      case GT -> lhs > rhs;
      case LE -> lhs <= rhs;
      case GE -> lhs >= rhs;
      default -> throw new IllegalArgumentException("Not an ordering comparator: " + op);
    };
  }
}
