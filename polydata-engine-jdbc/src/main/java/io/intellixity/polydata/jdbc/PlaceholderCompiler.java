package io.intellixity.polydata.jdbc;

import io.intellixity.polydata.error.UnsupportedQueryException;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites numbered placeholders ({@code $1}, {@code $2}, ...) into JDBC {@code ?} markers.
 * <p>
 * Rules:
 * <ul>
 *   <li>{@code $} followed by digits is a placeholder; numbers are 1-based bind positions</li>
 *   <li>placeholders inside quoted literals and quoted identifiers are ignored</li>
 *   <li>doubled quote characters are escapes</li>
 *   <li>a number may repeat; binds are re-emitted in appearance order</li>
 * </ul>
 * Statements without numbered placeholders pass through unchanged.
 */
public final class PlaceholderCompiler {
  private PlaceholderCompiler() {}

  public static SqlStatement toJdbc(SqlStatement stmt) {
    String sql = stmt.sql();
    StringBuilder out = new StringBuilder(sql.length());
    List<Object> binds = new ArrayList<>();
    boolean numbered = false;
    char quote = 0;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (quote != 0) {
        out.append(ch);
        if (ch == quote) {
          if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
            out.append(quote);
            i++;
          } else {
            quote = 0;
          }
        }
        continue;
      }

      if (ch == '\'' || ch == '"' || ch == '`') {
        quote = ch;
        out.append(ch);
        continue;
      }

      if (ch == '$' && i + 1 < sql.length() && Character.isDigit(sql.charAt(i + 1))) {
        int end = i + 1;
        while (end < sql.length() && Character.isDigit(sql.charAt(end))) end++;
        int n = Integer.parseInt(sql.substring(i + 1, end));
        if (n < 1 || n > stmt.binds().size()) {
          throw new UnsupportedQueryException("Placeholder $" + n + " has no bind (binds=" + stmt.binds().size() + ")");
        }
        binds.add(stmt.binds().get(n - 1));
        out.append('?');
        numbered = true;
        i = end - 1;
        continue;
      }

      out.append(ch);
    }

    if (!numbered) return stmt;
    return new SqlStatement(out.toString(), binds, stmt.execKind());
  }

  /** Number of bind markers ({@code $n} or {@code ?}) outside quoted text. */
  public static int countPlaceholders(String sql) {
    int count = 0;
    char quote = 0;
    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);
      if (quote != 0) {
        if (ch == quote) {
          if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) i++;
          else quote = 0;
        }
        continue;
      }
      if (ch == '\'' || ch == '"' || ch == '`') {
        quote = ch;
      } else if (ch == '?') {
        count++;
      } else if (ch == '$' && i + 1 < sql.length() && Character.isDigit(sql.charAt(i + 1))) {
        count++;
        while (i + 1 < sql.length() && Character.isDigit(sql.charAt(i + 1))) i++;
      }
    }
    return count;
  }
}
