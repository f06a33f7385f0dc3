package io.intellixity.strata.persistence.hooks;

@FunctionalInterface
public interface BeforeDeleteHook {
  void beforeDelete();
}
