package io.intellixity.tandem.persistence.jdbc;

import io.intellixity.tandem.persistence.error.ValidationException;
import io.intellixity.tandem.persistence.exec.BackendKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexical placeholder rewriting for JDBC.\n
 *
 * Rules:\n
 * - Named params are ':' followed by [A-Za-z_][A-Za-z0-9_]* and become '?'\n
 * - '::' is treated as a SQL cast and not a param\n
 * - Positional params '$1', '$2', ... (raw queries) become '?' with binds reordered by index\n
 * - Anything inside single quotes is left alone\n
 */
public final class SqlParamCompiler {
  private SqlParamCompiler() {}

  /** Rewrite named params (":b1") into JDBC '?' placeholders. Bind order is appearance order. */
  public static String toJdbcSql(String sql) {
    if (sql == null) return "";
    StringBuilder out = new StringBuilder(sql.length() + 16);
    boolean inSingleQuote = false;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (ch == '\'') {
        // Handle '' escape
        if (inSingleQuote && i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
          out.append("''");
          i++;
          continue;
        }
        inSingleQuote = !inSingleQuote;
        out.append(ch);
        continue;
      }

      if (!inSingleQuote && ch == ':') {
        // Skip :: casts
        if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
          out.append("::");
          i++;
          continue;
        }

        int start = i + 1;
        if (start < sql.length() && isIdentStart(sql.charAt(start))) {
          int end = start + 1;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          out.append('?');
          i = end - 1;
          continue;
        }
      }

      out.append(ch);
    }

    return out.toString();
  }

  /**
   * Compile a raw query with positional params.\n
   *
   * SQL using '$n' placeholders gets them rewritten to '?' with binds picked by index (a param may be
   * referenced more than once). SQL already using '?' keeps the params in the given order.\n
   */
  public static SqlStatement compilePositional(String sql, List<?> params) {
    List<?> p = (params == null) ? List.of() : params;
    StringBuilder out = new StringBuilder(sql.length());
    List<Bind> binds = new ArrayList<>();
    boolean inSingleQuote = false;
    boolean sawDollar = false;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);
      if (ch == '\'') {
        if (inSingleQuote && i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
          out.append("''");
          i++;
          continue;
        }
        inSingleQuote = !inSingleQuote;
        out.append(ch);
        continue;
      }
      if (!inSingleQuote && ch == '$' && i + 1 < sql.length() && Character.isDigit(sql.charAt(i + 1))) {
        int end = i + 1;
        while (end < sql.length() && Character.isDigit(sql.charAt(end))) end++;
        int idx = Integer.parseInt(sql.substring(i + 1, end));
        if (idx < 1 || idx > p.size()) {
          throw new ValidationException(BackendKind.SECONDARY, "rawQuery",
              "Parameter $" + idx + " has no value (" + p.size() + " given)", null);
        }
        binds.add(Bind.infer(p.get(idx - 1)));
        out.append('?');
        sawDollar = true;
        i = end - 1;
        continue;
      }
      out.append(ch);
    }

    if (sawDollar) return new SqlStatement(out.toString(), binds);
    List<Bind> inOrder = new ArrayList<>(p.size());
    for (Object v : p) inOrder.add(Bind.infer(v));
    return new SqlStatement(sql, inOrder);
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}
