package io.intellixity.strata.persistence.error;

/** The operation context was cancelled or its deadline passed. */
public final class OperationCancelledException extends DataAccessException {
  public OperationCancelledException(String message) {
    super(message);
  }

  public OperationCancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}
