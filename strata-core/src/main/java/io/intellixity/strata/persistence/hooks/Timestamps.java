package io.intellixity.strata.persistence.hooks;

import io.intellixity.strata.persistence.model.IdGenerator;
import io.intellixity.strata.persistence.model.Model;

import java.time.Instant;

/** Stamps the base fields of a model right before the corresponding write. */
public final class Timestamps {
  private Timestamps() {}

  /** Assigns an id when the model has none; created and updated both become {@code now}. */
  public static void applyBeforeCreate(Model model, Instant now, IdGenerator ids) {
    if (model.isNew()) model.setId(ids.next());
    model.setCreatedAt(now);
    model.setUpdatedAt(now);
  }

  public static void applyBeforeCreate(Model model, Instant now) {
    applyBeforeCreate(model, now, IdGenerator.uuid());
  }

  public static void applyBeforeUpdate(Model model, Instant now) {
    model.setUpdatedAt(now);
  }

  public static void applyBeforeDelete(Model model, Instant now) {
    model.markDeleted(now);
  }
}
