package io.intellixity.strata.persistence.sql;

import java.sql.SQLException;
import java.util.Locale;

/**
 * Shared unique-violation detection.
 * <p>
 * Walks the exception chain (causes and {@link SQLException#getNextException()}). A link counts
 * when the dialect recognizes it, when it reports SQLState {@code 23505} or vendor code
 * {@code 1062}, or when its message mentions a duplicate or unique constraint.
 */
public abstract class AbstractDialect implements Dialect {
  public static final String SQLSTATE_UNIQUE_VIOLATION = "23505";
  public static final int MYSQL_DUPLICATE_ENTRY = 1062;

  @Override
  public final boolean isUniqueViolation(SQLException e) {
    int guard = 0;
    for (Throwable t = e; t != null && guard++ < 32; t = next(t)) {
      if (t instanceof SQLException se) {
        if (isVendorUniqueViolation(se)) return true;
        if (SQLSTATE_UNIQUE_VIOLATION.equals(se.getSQLState())) return true;
        if (se.getErrorCode() == MYSQL_DUPLICATE_ENTRY) return true;
      }
      String msg = t.getMessage();
      if (msg != null) {
        String lower = msg.toLowerCase(Locale.ROOT);
        if (lower.contains("duplicate") || lower.contains("unique")) return true;
      }
    }
    return false;
  }

  /** Driver-specific check; the generic rules apply when this returns false. */
  protected boolean isVendorUniqueViolation(SQLException e) {
    return false;
  }

  private static Throwable next(Throwable t) {
    if (t instanceof SQLException se && se.getNextException() != null) return se.getNextException();
    return t.getCause();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + id() + "]";
  }
}
