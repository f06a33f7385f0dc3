package io.intellixity.strata.persistence.jdbc;

import io.intellixity.strata.persistence.error.TransactionException;
import io.intellixity.strata.persistence.exec.OperationContext;
import io.intellixity.strata.persistence.exec.TxHandle;
import io.intellixity.strata.persistence.mapping.RowReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/** A transaction pinned to one pooled connection; the connection returns to the pool on commit or rollback. */
final class JdbcTransaction implements TxHandle {
  private static final Logger log = LoggerFactory.getLogger(JdbcTransaction.class);

  private final Connection conn;
  private final JdbcStatementRunner runner;
  private final OperationContext ctx;
  private boolean active = true;

  JdbcTransaction(Connection conn, JdbcStatementRunner runner, OperationContext ctx) {
    this.conn = conn;
    this.runner = runner;
    this.ctx = ctx;
  }

  @Override
  public long execute(OperationContext ctx, String sql, List<?> args) {
    requireActive();
    return runner.execute(conn, ctx, sql, args);
  }

  @Override
  public <R> List<R> query(OperationContext ctx, String sql, List<?> args, RowReader<R> reader) {
    requireActive();
    return runner.query(conn, ctx, sql, args, reader, 0);
  }

  @Override
  public <R> Optional<R> queryOne(OperationContext ctx, String sql, List<?> args, RowReader<R> reader) {
    requireActive();
    List<R> rows = runner.query(conn, ctx, sql, args, reader, 1);
    return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
  }

  @Override
  public void commit() {
    requireActive();
    active = false;
    try {
      conn.commit();
      log.debug("strata.tx commit");
    } catch (SQLException e) {
      throw runner.translate(ctx, e);
    } finally {
      release();
    }
  }

  @Override
  public void rollback() {
    requireActive();
    active = false;
    try {
      conn.rollback();
      log.debug("strata.tx rollback");
    } catch (SQLException e) {
      throw runner.translate(OperationContext.background(), e);
    } finally {
      release();
    }
  }

  @Override
  public boolean isActive() { return active; }

  private void requireActive() {
    if (!active) throw new TransactionException("transaction has already been committed or rolled back", null);
  }

  private void release() {
    try {
      conn.close();
    } catch (SQLException e) {
      log.warn("strata.tx failed to release connection error={}", e.toString());
    }
  }
}
