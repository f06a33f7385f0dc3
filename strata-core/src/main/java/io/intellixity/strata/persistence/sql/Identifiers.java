package io.intellixity.strata.persistence.sql;

import java.util.regex.Pattern;

/** Table and column names are spliced into SQL unquoted, so they must be plain identifiers. */
public final class Identifiers {
  private static final Pattern IDENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  private static final Pattern QUALIFIED = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

  private Identifiers() {}

  public static boolean isIdentifier(String name) {
    return name != null && IDENT.matcher(name).matches();
  }

  /** Identifier optionally qualified by a schema, e.g. {@code audit.events}. */
  public static boolean isTableName(String name) {
    return name != null && QUALIFIED.matcher(name).matches();
  }
}
