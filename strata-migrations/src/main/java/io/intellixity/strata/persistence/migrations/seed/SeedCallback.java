package io.intellixity.strata.persistence.migrations.seed;

import io.intellixity.strata.persistence.exec.OperationContext;
import io.intellixity.strata.persistence.migrations.MigrationExecutor;

@FunctionalInterface
public interface SeedCallback {
  void run(OperationContext ctx, MigrationExecutor db) throws Exception;
}
