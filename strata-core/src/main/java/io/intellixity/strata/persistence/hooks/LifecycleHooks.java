package io.intellixity.strata.persistence.hooks;

/**
 * Invokes the hook interfaces an entity opts into.
 * <p>
 * Create runs validate, beforeSave, beforeCreate, then (after the insert) afterCreate, afterSave.
 * Update mirrors it with the update hooks. The first hook to throw aborts the operation; its
 * exception reaches the caller unchanged.
 */
public final class LifecycleHooks {
  private LifecycleHooks() {}

  public static void beforeCreate(Object entity) {
    if (entity instanceof ValidateHook h) h.validate();
    if (entity instanceof BeforeSaveHook h) h.beforeSave();
    if (entity instanceof BeforeCreateHook h) h.beforeCreate();
  }

  public static void afterCreate(Object entity) {
    if (entity instanceof AfterCreateHook h) h.afterCreate();
    if (entity instanceof AfterSaveHook h) h.afterSave();
  }

  public static void beforeUpdate(Object entity) {
    if (entity instanceof ValidateHook h) h.validate();
    if (entity instanceof BeforeSaveHook h) h.beforeSave();
    if (entity instanceof BeforeUpdateHook h) h.beforeUpdate();
  }

  public static void afterUpdate(Object entity) {
    if (entity instanceof AfterUpdateHook h) h.afterUpdate();
    if (entity instanceof AfterSaveHook h) h.afterSave();
  }

  public static void beforeDelete(Object entity) {
    if (entity instanceof BeforeDeleteHook h) h.beforeDelete();
  }

  public static void afterDelete(Object entity) {
    if (entity instanceof AfterDeleteHook h) h.afterDelete();
  }

  public static void afterFind(Object entity) {
    if (entity instanceof AfterFindHook h) h.afterFind();
  }
}
