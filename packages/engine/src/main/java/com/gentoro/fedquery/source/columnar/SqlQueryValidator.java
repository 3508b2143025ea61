package com.gentoro.fedquery.source.columnar;

import com.gentoro.fedquery.plan.DataSourceKind;
import com.gentoro.fedquery.source.AdapterException;
import com.gentoro.fedquery.source.AdapterException.Kind;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read-only guard for columnar-store SQL.
 *
 * <p>A statement passes when it is a single read statement ({@code SELECT}, {@code WITH}, {@code
 * SHOW}, {@code DESCRIBE}, {@code EXPLAIN}), contains no comments, and mentions none of the
 * administrative or writing keywords outside string literals and quoted identifiers.
 */
public class SqlQueryValidator {
  public static final int DEFAULT_MAX_QUERY_SIZE = 10_000;

  private static final List<String> DANGEROUS_KEYWORDS =
      List.of(
          "DROP", "TRUNCATE", "ALTER", "GRANT", "REVOKE", "SYSTEM", "SHUTDOWN", "KILL", "OUTFILE");
  private static final List<String> WRITE_KEYWORDS =
      List.of("INSERT", "UPDATE", "DELETE", "CREATE", "RENAME", "ATTACH", "DETACH", "OPTIMIZE");
  private static final Set<String> READ_STATEMENTS =
      Set.of("SELECT", "WITH", "SHOW", "DESCRIBE", "DESC", "EXPLAIN");
  private static final Pattern WORD = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private final int maxQuerySize;

  public SqlQueryValidator() {
    this(DEFAULT_MAX_QUERY_SIZE);
  }

  public SqlQueryValidator(int maxQuerySize) {
    this.maxQuerySize = maxQuerySize;
  }

  /**
   * Validate {@code sql} and return it without surrounding whitespace and trailing semicolon.
   *
   * @throws AdapterException with kind {@link Kind#INVALID_QUERY} when rejected
   */
  public String validate(String sql) {
    if (sql == null || sql.isBlank()) {
      throw invalid("Query not specified");
    }
    if (sql.length() > maxQuerySize) {
      throw invalid("Query exceeds maximum size of " + maxQuerySize + " characters");
    }
    String trimmed = sql.strip();
    while (trimmed.endsWith(";")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1).stripTrailing();
    }

    String code = maskQuoted(trimmed);
    if (code.contains("--") || code.contains("/*") || code.contains("#")) {
      throw invalid("Query contains comment syntax");
    }
    if (code.indexOf(';') >= 0) {
      throw invalid("Multi-statement queries are not allowed");
    }

    Matcher words = WORD.matcher(code);
    boolean first = true;
    while (words.find()) {
      String word = words.group().toUpperCase(Locale.ROOT);
      if (first) {
        if (!READ_STATEMENTS.contains(word)) {
          throw invalid("Only read statements are allowed, got '" + word + "'");
        }
        first = false;
      }
      if (DANGEROUS_KEYWORDS.contains(word)) {
        throw invalid("Query contains dangerous operation: " + word);
      }
      if (WRITE_KEYWORDS.contains(word)) {
        throw invalid("Write operation (" + word + ") is not allowed");
      }
    }
    if (first) {
      throw invalid("Query does not contain a statement");
    }
    return trimmed;
  }

  /**
   * Replace the content of string literals and quoted identifiers with blanks, keeping offsets.
   * Unterminated quotes are rejected.
   */
  static String maskQuoted(String sql) {
    StringBuilder out = new StringBuilder(sql.length());
    char quote = 0;
    for (int i = 0; i < sql.length(); i++) {
      char c = sql.charAt(i);
      if (quote == 0) {
        if (c == '\'' || c == '"' || c == '`') {
          quote = c;
        }
        out.append(c);
      } else if (c == '\\' && i + 1 < sql.length()) {
        out.append("  ");
        i++;
      } else if (c == quote) {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
          out.append("  ");
          i++;
        } else {
          quote = 0;
          out.append(c);
        }
      } else {
        out.append(' ');
      }
    }
    if (quote != 0) {
      throw invalid("Query contains an unterminated quoted section");
    }
    return out.toString();
  }

  private static AdapterException invalid(String message) {
    return new AdapterException(Kind.INVALID_QUERY, DataSourceKind.COLUMNAR_STORE, message);
  }
}
