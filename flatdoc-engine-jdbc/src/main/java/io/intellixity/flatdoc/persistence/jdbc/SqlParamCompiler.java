package io.intellixity.flatdoc.persistence.jdbc;

/**
 * Compiles SQL containing named parameters (e.g. :b1) into JDBC SQL with '?' binds.
 *
 * Rules:
 * - Params are recognized as ':' followed by [A-Za-z_][A-Za-z0-9_]*\n
 * - '::' is treated as a SQL cast and not a param.\n
 * - Params inside single-quoted literals or double-quoted identifiers are ignored.\n
 */
public final class SqlParamCompiler {
  private SqlParamCompiler() {}

  /**
   * Rewrite a SQL string containing named params (":name") into JDBC SQL with '?' placeholders.\n
   * Purely lexical scanning.\n
   */
  public static String toJdbcSql(String sql) {
    if (sql == null) return "";
    StringBuilder out = new StringBuilder(sql.length());
    scan(sql, out);
    return out.toString();
  }

  /** Number of named params in {@code sql}. */
  public static int paramCount(String sql) {
    if (sql == null) return 0;
    return scan(sql, null);
  }

  private static int scan(String sql, StringBuilder out) {
    int params = 0;
    char quote = 0;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (quote != 0) {
        append(out, ch);
        if (ch == quote) {
          // Doubled quote is an escape inside the literal/identifier.
          if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
            append(out, quote);
            i++;
          } else {
            quote = 0;
          }
        }
        continue;
      }

      if (ch == '\'' || ch == '"') {
        quote = ch;
        append(out, ch);
        continue;
      }

      if (ch == ':') {
        // Skip :: casts
        if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
          append(out, ':');
          append(out, ':');
          i++;
          continue;
        }

        int start = i + 1;
        if (start < sql.length() && isIdentStart(sql.charAt(start))) {
          int end = start + 1;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          append(out, '?');
          params++;
          i = end - 1;
          continue;
        }
      }

      append(out, ch);
    }
    return params;
  }

  private static void append(StringBuilder out, char c) {
    if (out != null) out.append(c);
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}
