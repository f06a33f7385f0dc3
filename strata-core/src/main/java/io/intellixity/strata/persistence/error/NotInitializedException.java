package io.intellixity.strata.persistence.error;

/** A connection client was used before it connected. */
public final class NotInitializedException extends DataAccessException {
  public NotInitializedException(String message) {
    super(message);
  }
}
