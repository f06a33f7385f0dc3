package io.intellixity.strata.persistence.hooks;

/** Runs first on create and update; a failure aborts before any SQL. */
@FunctionalInterface
public interface ValidateHook {
  void validate();
}
