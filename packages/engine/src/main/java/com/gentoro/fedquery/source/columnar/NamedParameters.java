package com.gentoro.fedquery.source.columnar;

import java.util.ArrayList;
import java.util.List;

/** Rewrites {@code :name} placeholders into JDBC positional markers. */
final class NamedParameters {

  /**
   * @param sql statement with every named placeholder replaced by {@code ?}
   * @param names parameter names in placeholder order; a name may repeat
   */
  record Rewritten(String sql, List<String> names) {}

  private NamedParameters() {}

  /**
   * Placeholders inside string literals and quoted identifiers are left alone, as are {@code ::}
   * casts.
   */
  static Rewritten rewrite(String sql) {
    String masked = SqlQueryValidator.maskQuoted(sql);
    StringBuilder out = new StringBuilder(sql.length());
    List<String> names = new ArrayList<>();
    int i = 0;
    while (i < sql.length()) {
      char c = masked.charAt(i);
      boolean placeholder =
          c == ':'
              && i + 1 < sql.length()
              && isNameStart(masked.charAt(i + 1))
              && (i == 0 || masked.charAt(i - 1) != ':');
      if (!placeholder) {
        out.append(sql.charAt(i++));
        continue;
      }
      int end = i + 1;
      while (end < sql.length() && isNamePart(masked.charAt(end))) {
        end++;
      }
      names.add(sql.substring(i + 1, end));
      out.append('?');
      i = end;
    }
    return new Rewritten(out.toString(), names);
  }

  private static boolean isNameStart(char c) {
    return Character.isLetter(c) || c == '_';
  }

  private static boolean isNamePart(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }
}
