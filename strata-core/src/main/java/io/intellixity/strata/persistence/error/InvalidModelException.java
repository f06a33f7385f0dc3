package io.intellixity.strata.persistence.error;

/** The entity mapping is malformed (bad identifiers, duplicate columns, broken factory). */
public final class InvalidModelException extends DataAccessException {
  public InvalidModelException(String message) {
    super(message);
  }
}
