package io.intellixity.flatdoc.persistence.query;

import io.intellixity.flatdoc.persistence.document.FlatKeys;
import io.intellixity.flatdoc.persistence.error.InvalidArgumentException;
import io.intellixity.flatdoc.persistence.error.InvalidConditionException;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for equality conjunctions over original flat keys.\n
 *
 * <pre>
 * where     := condition (AND condition)*          AND is case-insensitive
 * condition := key '=' value
 * key       := [A-Za-z0-9_./-]+ | '"' chars '"'      "" escapes a double quote
 * value     := '\'' chars '\'' | [A-Za-z0-9_.+-]+     '' escapes a single quote
 * </pre>
 *
 * Values are always compared as text. The parser never produces SQL; keys are encoded and values bound later.\n
 */
public final class WhereConditionParser {
  private final String src;
  private int pos;

  private WhereConditionParser(String src) {
    this.src = src;
  }

  public static WhereClause parse(String condition) {
    if (condition == null || condition.isBlank()) {
      throw new InvalidConditionException("Where condition must be non-empty");
    }
    return new WhereConditionParser(condition).where();
  }

  private WhereClause where() {
    List<Condition> out = new ArrayList<>();
    skipWs();
    out.add(condition());
    while (true) {
      boolean sawWs = skipWs();
      if (pos >= src.length()) break;
      if (!sawWs || !keyword("AND")) throw error("expected AND");
      if (!skipWs()) throw error("expected whitespace after AND");
      out.add(condition());
    }
    return new WhereClause(out);
  }

  private Condition condition() {
    String key = key();
    skipWs();
    if (pos >= src.length() || src.charAt(pos) != '=') throw error("expected '='");
    pos++;
    skipWs();
    String value = value();
    try {
      return new Condition(FlatKeys.normalize(key), value);
    } catch (InvalidArgumentException e) {
      throw new InvalidConditionException("Invalid key '" + key + "' in condition '" + src + "': " + e.getMessage());
    }
  }

  private String key() {
    if (pos < src.length() && src.charAt(pos) == '"') return quoted('"');
    int start = pos;
    while (pos < src.length() && isKeyChar(src.charAt(pos))) pos++;
    if (pos == start) throw error("expected key");
    return src.substring(start, pos);
  }

  private String value() {
    if (pos < src.length() && src.charAt(pos) == '\'') return quoted('\'');
    int start = pos;
    while (pos < src.length() && isBareValueChar(src.charAt(pos))) pos++;
    if (pos == start) throw error("expected value");
    return src.substring(start, pos);
  }

  private String quoted(char q) {
    int open = pos++;
    StringBuilder sb = new StringBuilder();
    while (pos < src.length()) {
      char c = src.charAt(pos++);
      if (c != q) {
        sb.append(c);
        continue;
      }
      if (pos < src.length() && src.charAt(pos) == q) {
        sb.append(q);
        pos++;
        continue;
      }
      return sb.toString();
    }
    pos = open;
    throw error("unterminated quoted text");
  }

  private boolean keyword(String kw) {
    int end = pos + kw.length();
    if (end > src.length() || !src.regionMatches(true, pos, kw, 0, kw.length())) return false;
    pos = end;
    return true;
  }

  private boolean skipWs() {
    int start = pos;
    while (pos < src.length() && Character.isWhitespace(src.charAt(pos))) pos++;
    return pos > start;
  }

  private InvalidConditionException error(String what) {
    return new InvalidConditionException("Cannot parse condition '" + src + "' at position " + pos + ": " + what);
  }

  private static boolean isKeyChar(char c) {
    return isAlnum(c) || c == '_' || c == '.' || c == '/' || c == '-';
  }

  private static boolean isBareValueChar(char c) {
    return isAlnum(c) || c == '_' || c == '.' || c == '+' || c == '-';
  }

  private static boolean isAlnum(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9');
  }
}
