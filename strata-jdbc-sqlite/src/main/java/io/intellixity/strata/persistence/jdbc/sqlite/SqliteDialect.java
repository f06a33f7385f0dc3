package io.intellixity.strata.persistence.jdbc.sqlite;

import io.intellixity.strata.persistence.sql.AbstractDialect;
import io.intellixity.strata.persistence.sql.PlaceholderStyle;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.sql.SQLException;
import java.util.Set;

/** SQLite dialect: {@code ?} placeholders; unique and primary-key constraint failures count as duplicates. */
public final class SqliteDialect extends AbstractDialect {
  @Override public String id() { return "sqlite3"; }
  @Override public Set<String> aliases() { return Set.of("sqlite"); }
  @Override public PlaceholderStyle placeholderStyle() { return PlaceholderStyle.QUESTION; }

  @Override
  protected boolean isVendorUniqueViolation(SQLException e) {
    if (!(e instanceof SQLiteException se)) return false;
    SQLiteErrorCode code = se.getResultCode();
    return code == SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE || code == SQLiteErrorCode.SQLITE_CONSTRAINT_PRIMARYKEY;
  }
}
