package io.intellixity.strata.persistence.error;

/** A write-style operation was attempted on an entity that has no id yet. */
public final class NotPersistedException extends DataAccessException {
  public NotPersistedException(String message) {
    super(message);
  }
}
