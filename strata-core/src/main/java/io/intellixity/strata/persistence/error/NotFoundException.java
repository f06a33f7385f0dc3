package io.intellixity.strata.persistence.error;

/** Zero rows matched a scoped read or write. */
public final class NotFoundException extends DataAccessException {
  public NotFoundException(String message) {
    super(message);
  }
}
