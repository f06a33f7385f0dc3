package io.intellixity.strata.persistence.error;

/**
 * Root of the data-access exception hierarchy.
 * <p>
 * Every failure raised by repositories, connection clients and the migration runner is (or wraps)
 * one of these. Driver failures keep the original {@link java.sql.SQLException} as the cause and
 * expose its SQLState when one was reported.
 */
public class DataAccessException extends RuntimeException {
  private final String sqlState;

  public DataAccessException(String message) {
    this(message, null, null);
  }

  public DataAccessException(String message, Throwable cause) {
    this(message, cause, null);
  }

  public DataAccessException(String message, Throwable cause, String sqlState) {
    super(message, cause);
    this.sqlState = sqlState;
  }

  /** SQLState reported by the driver, or null. */
  public String sqlState() { return sqlState; }
}
