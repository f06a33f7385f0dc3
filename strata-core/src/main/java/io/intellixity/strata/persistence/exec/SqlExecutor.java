package io.intellixity.strata.persistence.exec;

import io.intellixity.strata.persistence.mapping.RowReader;

import java.util.List;
import java.util.Optional;

/**
 * Runs parameterized SQL. Statements use {@code ?} placeholders; arguments bind positionally.
 */
public interface SqlExecutor {
  /** Runs a statement that returns no rows and reports the affected row count. */
  long execute(OperationContext ctx, String sql, List<?> args);

  <R> List<R> query(OperationContext ctx, String sql, List<?> args, RowReader<R> reader);

  /** First row only, or empty when the query matched nothing. */
  default <R> Optional<R> queryOne(OperationContext ctx, String sql, List<?> args, RowReader<R> reader) {
    List<R> rows = query(ctx, sql, args, reader);
    return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
  }
}
