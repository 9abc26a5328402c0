package io.flowtrace.query.filter;

/**
 * One lexical token of a filter expression.
 *
 * @param type token kind
 * @param text token text; for quoted literals the content between the quotes
 * @param position offset of the token's first character in the query
 */
public record FilterToken(Type type, String text, int position) {

  public enum Type {
    IDENT,
    STRING,
    LPAREN,
    RPAREN,
    AND,
    OR,
    NOT,
    EQ,
    MATCH,
    LT,
    GT,
    LE,
    GE,
    UNKNOWN;

    public boolean isComparator() {
      return switch (this) {
        case EQ, MATCH, LT, GT, LE, GE -> true;
        default -> false;
      };
    }

    /** True for tokens that can stand as the right-hand side of a comparison. */
    public boolean isValue() {
      return this == IDENT || this == STRING;
    }
  }

  @Override
  public String toString() {
    return type == Type.STRING ? '"' + text + '"' : text;
  }
}
