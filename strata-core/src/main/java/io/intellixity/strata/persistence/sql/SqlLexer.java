package io.intellixity.strata.persistence.sql;

/**
 * Purely lexical SQL scanning: recognizes the regions where placeholder and statement-separator
 * characters are not code.
 * <p>
 * Covered: single-quoted literals ({@code ''} escape), double-quoted and back-quoted identifiers,
 * {@code --} line comments, {@code /* *}{@code /} block comments and Postgres dollar-quoted
 * bodies ({@code $$...$$}, {@code $tag$...$tag$}).
 */
public final class SqlLexer {
  private SqlLexer() {}

  /** Index just past the literal, identifier or comment starting at {@code i}; {@code i} if none starts there. */
  public static int skipNonCode(String sql, int i) {
    int len = sql.length();
    char ch = sql.charAt(i);
    char next = (i + 1 < len) ? sql.charAt(i + 1) : '\0';

    if (ch == '\'' || ch == '"' || ch == '`') return skipQuoted(sql, i, ch);
    if (ch == '-' && next == '-') {
      int eol = sql.indexOf('\n', i + 2);
      return eol < 0 ? len : eol + 1;
    }
    if (ch == '/' && next == '*') {
      int end = sql.indexOf("*/", i + 2);
      return end < 0 ? len : end + 2;
    }
    if (ch == '$') {
      String tag = dollarTag(sql, i);
      if (tag != null) {
        int end = sql.indexOf(tag, i + tag.length());
        return end < 0 ? len : end + tag.length();
      }
    }
    return i;
  }

  private static int skipQuoted(String sql, int i, char quote) {
    int j = i + 1;
    while (j < sql.length()) {
      if (sql.charAt(j) == quote) {
        if (j + 1 < sql.length() && sql.charAt(j + 1) == quote) {
          j += 2;
          continue;
        }
        return j + 1;
      }
      j++;
    }
    return sql.length();
  }

  // "$$" or "$tag$"; "$1" is a placeholder, not a tag.
  private static String dollarTag(String sql, int i) {
    int j = i + 1;
    while (j < sql.length() && (Character.isLetter(sql.charAt(j)) || sql.charAt(j) == '_')) j++;
    if (j < sql.length() && sql.charAt(j) == '$') return sql.substring(i, j + 1);
    return null;
  }
}
