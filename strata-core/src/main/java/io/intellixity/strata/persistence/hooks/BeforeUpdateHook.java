package io.intellixity.strata.persistence.hooks;

@FunctionalInterface
public interface BeforeUpdateHook {
  void beforeUpdate();
}
