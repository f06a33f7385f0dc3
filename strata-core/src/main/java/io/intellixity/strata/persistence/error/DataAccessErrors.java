package io.intellixity.strata.persistence.error;

/** Reclassification rules shared by repositories and runners. */
public final class DataAccessErrors {
  private DataAccessErrors() {}

  /**
   * Sentinel failures pass through untouched; anything else is wrapped with the operation name.
   */
  public static RuntimeException translate(String op, RuntimeException e) {
    if (isSentinel(e)) return e;
    return new DataAccessException(op + " failed: " + e.getMessage(), e,
        (e instanceof DataAccessException dae) ? dae.sqlState() : null);
  }

  public static boolean isSentinel(Throwable e) {
    return e instanceof NotFoundException
        || e instanceof DuplicateKeyException
        || e instanceof NotPersistedException
        || e instanceof InvalidModelException
        || e instanceof NotInitializedException
        || e instanceof OperationCancelledException;
  }

  public static boolean isNotFound(Throwable e) {
    return e instanceof NotFoundException;
  }

  public static boolean isDuplicateKey(Throwable e) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t instanceof DuplicateKeyException) return true;
    }
    return false;
  }
}
