package io.intellixity.strata.persistence.error;

/** A unique or primary-key constraint rejected the statement. */
public final class DuplicateKeyException extends DataAccessException {
  public DuplicateKeyException(String message, Throwable cause, String sqlState) {
    super(message, cause, sqlState);
  }
}
