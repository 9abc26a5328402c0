package io.flowtrace.query.filter;

import java.util.Objects;

/** Filter expression AST model. Nodes are immutable and shared freely between evaluations. */
public final class FilterAst {
  private FilterAst() {}

  public enum Op {
    EXISTS(""),
    EQ("=="),
    REGEX("~="),
    LT("<"),
    GT(">"),
    LE("<="),
    GE(">=");

    private final String symbol;

    Op(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }

    public boolean isOrdering() {
      return this == LT || this == GT || this == LE || this == GE;
    }

    static Op fromToken(FilterToken.Type type) {
      return switch (type) {
        case EQ -> EQ;
        case MATCH -> REGEX;
        case LT -> LT;
        case GT -> GT;
        case LE -> LE;
        case GE -> GE;
        default -> throw new IllegalArgumentException("Not a comparator: " + type);
      };
    }
  }

  public enum Lop {
    AND,
    OR
  }

  public sealed interface Node permits True, Predicate, Not, Binary {}

  /** Matches every event; produced for empty filters and for unparseable fragments. */
  public static final class True implements Node {
    public static final True INSTANCE = new True();

    private True() {}

    @Override
    public String toString() {
      return "true";
    }
  }

  /**
   * Field test.
   *
   * @param field dotted field path
   * @param op comparator; {@link Op#EXISTS} for the bare-field and {@code exists(...)} forms
   * @param literal right-hand literal, {@code null} for EXISTS or when the literal was omitted
   */
  public record Predicate(String field, Op op, String literal) implements Node {
    public Predicate {
      Objects.requireNonNull(field, "field");
      Objects.requireNonNull(op, "op");
    }

    public static Predicate exists(String field) {
      return new Predicate(field, Op.EXISTS, null);
    }

    @Override
    public String toString() {
      if (op == Op.EXISTS) return "exists(" + field + ")";
      return field + " " + op.symbol() + " " + (literal == null ? "<none>" : '"' + literal + '"');
    }
  }

  public record Not(Node inner) implements Node {
    @Override
    public String toString() {
      return "not " + inner;
    }
  }

  public record Binary(Node left, Lop op, Node right) implements Node {
    @Override
    public String toString() {
      return "(" + left + (op == Lop.AND ? " and " : " or ") + right + ")";
    }
  }
}
