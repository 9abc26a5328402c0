package io.flowtrace.query.filter;

import io.flowtrace.query.filter.FilterToken.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Splits a filter expression into tokens.
 *
 * <ul>
 *   <li>whitespace separates tokens and is otherwise ignored
 *   <li>{@code "..."} is a literal read verbatim up to the next quote (no escapes); an unterminated
 *       literal runs to the end of the input
 *   <li>{@code ==}, {@code ~=}, {@code <=}, {@code >=} win over {@code <} and {@code >}
 *   <li>a run of letters, digits, {@code _} and {@code .} is an identifier, or one of the
 *       case-insensitive keywords {@code and}, {@code or}, {@code not}
 *   <li>any other character becomes a single {@link Type#UNKNOWN} token
 * </ul>
 */
public final class FilterTokenizer {
  private final String input;
  private int pos = 0;

  private FilterTokenizer(String input) {
    this.input = input;
  }

  public static List<FilterToken> tokenize(String input) {
    return new FilterTokenizer(input == null ? "" : input).run();
  }

  private List<FilterToken> run() {
    List<FilterToken> tokens = new ArrayList<>();
    while (!eof()) {
      char c = input.charAt(pos);
      int start = pos;
      if (Character.isWhitespace(c)) {
        pos++;
      } else if (c == '"') {
        tokens.add(readQuoted());
      } else if (c == '(') {
        pos++;
        tokens.add(new FilterToken(Type.LPAREN, "(", start));
      } else if (c == ')') {
        pos++;
        tokens.add(new FilterToken(Type.RPAREN, ")", start));
      } else if (match("==")) {
        tokens.add(new FilterToken(Type.EQ, "==", start));
      } else if (match("~=")) {
        tokens.add(new FilterToken(Type.MATCH, "~=", start));
      } else if (match("<=")) {
        tokens.add(new FilterToken(Type.LE, "<=", start));
      } else if (match(">=")) {
        tokens.add(new FilterToken(Type.GE, ">=", start));
      } else if (match("<")) {
        tokens.add(new FilterToken(Type.LT, "<", start));
      } else if (match(">")) {
        tokens.add(new FilterToken(Type.GT, ">", start));
      } else if (isWordChar(c)) {
        tokens.add(readWord());
      } else {
        pos++;
        tokens.add(new FilterToken(Type.UNKNOWN, String.valueOf(c), start));
      }
    }
    return tokens;
  }

  private FilterToken readQuoted() {
    int start = pos;
    pos++; // opening quote
    int close = input.indexOf('"', pos);
    String text;
    if (close < 0) {
      text = input.substring(pos);
      pos = input.length();
    } else {
      text = input.substring(pos, close);
      pos = close + 1;
    }
    return new FilterToken(Type.STRING, text, start);
  }

  private FilterToken readWord() {
    int start = pos;
    while (!eof() && isWordChar(input.charAt(pos))) pos++;
    String word = input.substring(start, pos);
    Type type =
        switch (word.toLowerCase(Locale.ROOT)) {
          case "and" -> Type.AND;
          case "or" -> Type.OR;
          case "not" -> Type.NOT;
          default -> Type.IDENT;
        };
    return new FilterToken(type, type == Type.IDENT ? word : word.toLowerCase(Locale.ROOT), start);
  }

  private static boolean isWordChar(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9')
        || c == '_'
        || c == '.';
  }

  private boolean match(String s) {
    if (input.startsWith(s, pos)) {
      pos += s.length();
      return true;
    }
    return false;
  }

  private boolean eof() {
    return pos >= input.length();
  }
}
