package io.intellixity.strata.persistence.hooks;

@FunctionalInterface
public interface BeforeCreateHook {
  void beforeCreate();
}
