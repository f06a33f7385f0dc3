package io.intellixity.strata.persistence.exec;

/**
 * An open transaction. Statements run on the transaction's connection until
 * {@link #commit()} or {@link #rollback()} ends it; either call releases the connection.
 */
public interface TxHandle extends SqlExecutor {
  void commit();
  void rollback();
  boolean isActive();
}
