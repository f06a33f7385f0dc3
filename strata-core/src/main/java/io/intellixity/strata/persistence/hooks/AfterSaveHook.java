package io.intellixity.strata.persistence.hooks;

/** Runs on create and update once the row is written. */
@FunctionalInterface
public interface AfterSaveHook {
  void afterSave();
}
