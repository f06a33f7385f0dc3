package io.intellixity.strata.persistence.migrations;

@FunctionalInterface
public interface MigrationCallback {
  void run(MigrationExecutor executor) throws Exception;
}
