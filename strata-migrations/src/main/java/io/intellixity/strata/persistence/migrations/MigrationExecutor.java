package io.intellixity.strata.persistence.migrations;

import io.intellixity.strata.persistence.exec.OperationContext;
import io.intellixity.strata.persistence.exec.SqlExecutor;
import io.intellixity.strata.persistence.mapping.RowReader;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Statement access handed to migration and seed callbacks; bound to one transaction or client. */
public interface MigrationExecutor {
  /** Runs a statement with {@code ?} placeholders and returns the affected row count. */
  long exec(String sql, Object... args);

  <R> List<R> query(String sql, List<?> args, RowReader<R> reader);

  /** Runs every call on {@code executor} under {@code ctx}. */
  static MigrationExecutor bind(SqlExecutor executor, OperationContext ctx) {
    Objects.requireNonNull(executor, "executor");
    Objects.requireNonNull(ctx, "ctx");
    return new MigrationExecutor() {
      @Override
      public long exec(String sql, Object... args) {
        List<Object> bound = (args == null) ? Collections.emptyList() : Arrays.asList(args);
        return executor.execute(ctx, sql, bound);
      }

      @Override
      public <R> List<R> query(String sql, List<?> args, RowReader<R> reader) {
        return executor.query(ctx, sql, args == null ? Collections.emptyList() : args, reader);
      }
    };
  }
}
