package io.intellixity.strata.persistence.hooks;

@FunctionalInterface
public interface AfterCreateHook {
  void afterCreate();
}
