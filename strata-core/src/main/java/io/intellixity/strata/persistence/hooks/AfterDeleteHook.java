package io.intellixity.strata.persistence.hooks;

@FunctionalInterface
public interface AfterDeleteHook {
  void afterDelete();
}
