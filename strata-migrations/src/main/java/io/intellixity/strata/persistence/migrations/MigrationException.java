package io.intellixity.strata.persistence.migrations;

import io.intellixity.strata.persistence.error.DataAccessException;

/**
 * A batch of migrations stopped part way. Migrations before the failing one stay applied
 * (or reverted); {@link #completed()} says how many.
 */
public final class MigrationException extends DataAccessException {
  private final int completed;

  public MigrationException(String message, int completed) {
    this(message, null, completed);
  }

  public MigrationException(String message, Throwable cause, int completed) {
    super(message, cause);
    this.completed = completed;
  }

  public int completed() { return completed; }
}
