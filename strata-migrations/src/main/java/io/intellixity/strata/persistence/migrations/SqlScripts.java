package io.intellixity.strata.persistence.migrations;

import io.intellixity.strata.persistence.sql.SqlLexer;

import java.util.ArrayList;
import java.util.List;

/** Splits a script into statements on {@code ;} outside literals, quoted identifiers and comments. */
public final class SqlScripts {
  private SqlScripts() {}

  public static List<String> split(String script) {
    List<String> out = new ArrayList<>();
    if (script == null || script.isBlank()) return out;

    int start = 0;
    int i = 0;
    while (i < script.length()) {
      int skipped = SqlLexer.skipNonCode(script, i);
      if (skipped != i) {
        i = skipped;
        continue;
      }
      if (script.charAt(i) == ';') {
        addTrimmed(out, script.substring(start, i));
        start = i + 1;
      }
      i++;
    }
    addTrimmed(out, script.substring(start));
    return out;
  }

  private static void addTrimmed(List<String> out, String statement) {
    String s = statement.strip();
    if (!s.isEmpty() && !isOnlyComments(s)) out.add(s);
  }

  private static boolean isOnlyComments(String s) {
    int i = 0;
    while (i < s.length()) {
      char ch = s.charAt(i);
      if (Character.isWhitespace(ch)) {
        i++;
        continue;
      }
      boolean comment = (ch == '-' || ch == '/') && SqlLexer.skipNonCode(s, i) != i;
      if (!comment) return false;
      i = SqlLexer.skipNonCode(s, i);
    }
    return true;
  }
}
