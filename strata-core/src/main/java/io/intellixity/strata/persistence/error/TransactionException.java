package io.intellixity.strata.persistence.error;

/**
 * Commit or rollback failed.
 * <p>
 * When a rollback fails after the transaction callback failed, the callback failure is the cause
 * and the rollback failure is attached as suppressed.
 */
public final class TransactionException extends DataAccessException {
  public TransactionException(String message, Throwable cause) {
    super(message, cause);
  }
}
