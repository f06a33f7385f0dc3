package io.intellixity.strata.persistence.hooks;

/** Runs on create and update, after validation. */
@FunctionalInterface
public interface BeforeSaveHook {
  void beforeSave();
}
