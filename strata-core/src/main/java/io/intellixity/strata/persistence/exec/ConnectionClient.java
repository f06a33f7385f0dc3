package io.intellixity.strata.persistence.exec;

import io.intellixity.strata.persistence.sql.Dialect;

/**
 * Pooled connection to one database.
 * <p>
 * Every statement operation fails with
 * {@link io.intellixity.strata.persistence.error.NotInitializedException} until the client has
 * connected. {@link #rebind(String)} works regardless.
 */
public interface ConnectionClient extends SqlExecutor, AutoCloseable {
  Dialect dialect();

  TxHandle beginTransaction(OperationContext ctx);

  /** Rewrites {@code ?} placeholders into the dialect's native form. */
  default String rebind(String sql) { return dialect().rebind(sql); }

  void ping(OperationContext ctx);

  boolean isInitialized();

  @Override void close();
}
