package io.intellixity.strata.persistence.sql;

/** How a driver expects positional parameters to be written. */
public enum PlaceholderStyle {
  /** {@code ?} */
  QUESTION,
  /** {@code $1, $2} */
  DOLLAR,
  /** {@code :arg1, :arg2} */
  NAMED,
  /** {@code @p1, @p2} */
  AT;

  /** Placeholder text for the 1-based parameter index. */
  public String placeholder(int index) {
    return switch (this) {
      case QUESTION -> "?";
      case DOLLAR -> "$" + index;
      case NAMED -> ":arg" + index;
      case AT -> "@p" + index;
    };
  }

  /** Rewrites every {@code ?} outside literals, quoted identifiers and comments. */
  public String rebind(String sql) {
    if (sql == null) return "";
    if (this == QUESTION) return sql;

    StringBuilder out = new StringBuilder(sql.length() + 16);
    int n = 0;
    int i = 0;
    while (i < sql.length()) {
      int skip = SqlLexer.skipNonCode(sql, i);
      if (skip > i) {
        out.append(sql, i, skip);
        i = skip;
        continue;
      }
      char ch = sql.charAt(i);
      if (ch == '?') out.append(placeholder(++n));
      else out.append(ch);
      i++;
    }
    return out.toString();
  }
}
