package io.intellixity.strata.persistence.jdbc;

import io.intellixity.strata.persistence.error.DataAccessException;
import io.intellixity.strata.persistence.error.DuplicateKeyException;
import io.intellixity.strata.persistence.error.OperationCancelledException;
import io.intellixity.strata.persistence.exec.OperationContext;
import io.intellixity.strata.persistence.mapping.RowReader;
import io.intellixity.strata.persistence.sql.Dialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs statements on a given connection for both the pooled client and open transactions.
 * <p>
 * The context is checked before the statement is prepared; its remaining time becomes the JDBC
 * query timeout and cancelling it cancels the running statement.
 */
final class JdbcStatementRunner {
  private static final Logger log = LoggerFactory.getLogger(JdbcClient.class);

  private final Dialect dialect;

  JdbcStatementRunner(Dialect dialect) {
    this.dialect = dialect;
  }

  long execute(Connection c, OperationContext ctx, String sql, List<?> args) {
    ctx.throwIfDone();
    long start = System.nanoTime();
    debugSql("EXEC", sql, args);
    try (PreparedStatement ps = c.prepareStatement(sql);
         OperationContext.Registration ignored = ctx.onCancel(() -> cancel(ps))) {
      applyTimeout(ps, ctx);
      JdbcBinder.bindAll(ps, args);
      long n = ps.executeUpdate();
      debugDone("EXEC", n, System.nanoTime() - start);
      return n;
    } catch (SQLException e) {
      throw translate(ctx, e);
    }
  }

  <R> List<R> query(Connection c, OperationContext ctx, String sql, List<?> args, RowReader<R> reader, int maxRows) {
    ctx.throwIfDone();
    long start = System.nanoTime();
    debugSql("QUERY", sql, args);
    try (PreparedStatement ps = c.prepareStatement(sql);
         OperationContext.Registration ignored = ctx.onCancel(() -> cancel(ps))) {
      applyTimeout(ps, ctx);
      if (maxRows > 0) ps.setMaxRows(maxRows);
      JdbcBinder.bindAll(ps, args);
      try (ResultSet rs = ps.executeQuery()) {
        List<R> out = new ArrayList<>();
        JdbcRowAdapter row = new JdbcRowAdapter(rs);
        while (rs.next()) out.add(reader.read(row));
        debugDone("QUERY", out.size(), System.nanoTime() - start);
        return out;
      }
    } catch (SQLException e) {
      throw translate(ctx, e);
    }
  }

  /** Maps a driver failure onto the data-access hierarchy. */
  RuntimeException translate(OperationContext ctx, SQLException e) {
    if (ctx.isCancelled()) return new OperationCancelledException("operation cancelled: " + e.getMessage(), e);
    if (ctx.isExpired() || (e instanceof SQLTimeoutException && ctx.deadline().isPresent())) {
      return new OperationCancelledException("deadline exceeded: " + e.getMessage(), e);
    }
    if (dialect.isUniqueViolation(e)) {
      return new DuplicateKeyException("duplicate key: " + e.getMessage(), e, e.getSQLState());
    }
    return new DataAccessException(e.getMessage(), e, e.getSQLState());
  }

  private static void applyTimeout(Statement st, OperationContext ctx) throws SQLException {
    if (ctx.remaining().isEmpty()) return;
    Duration left = ctx.remaining().get();
    if (left.isZero()) throw new OperationCancelledException("deadline exceeded");
    long seconds = Math.max(1, (left.toMillis() + 999) / 1000);
    st.setQueryTimeout((int) Math.min(Integer.MAX_VALUE, seconds));
  }

  private static void cancel(Statement st) {
    try {
      st.cancel();
    } catch (SQLException e) {
      log.warn("strata.jdbc cancel failed error={}", e.toString());
    }
  }

  private void debugSql(String op, String sql, List<?> args) {
    if (!log.isDebugEnabled()) return;
    log.debug("strata.jdbc op={} dialect={} bindCount={} sql={}", op, dialect.id(), args.size(), dialect.rebind(sql));

    // TRACE: value types only, never values
    if (log.isTraceEnabled()) {
      for (int i = 0; i < args.size(); i++) {
        log.trace("strata.jdbc bind index={} valueType={}", i + 1, JdbcBinder.describe(args.get(i)));
      }
    }
  }

  private static void debugDone(String op, long result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("strata.jdbc_done op={} durationMs={} result={}", op, durationNanos / 1_000_000.0, result);
  }
}
