package io.intellixity.strata.persistence.hooks;

/** Runs on every entity a read returns, before it reaches the caller. */
@FunctionalInterface
public interface AfterFindHook {
  void afterFind();
}
