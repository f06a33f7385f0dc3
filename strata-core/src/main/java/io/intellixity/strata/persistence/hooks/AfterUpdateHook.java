package io.intellixity.strata.persistence.hooks;

@FunctionalInterface
public interface AfterUpdateHook {
  void afterUpdate();
}
