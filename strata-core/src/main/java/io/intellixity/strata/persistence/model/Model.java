package io.intellixity.strata.persistence.model;

import java.time.Instant;

/**
 * Base for every persisted entity.
 * <p>
 * An entity is new while its id is empty. The id never changes once assigned. A non-null
 * {@code deletedAt} marks the row as soft deleted; default queries skip it.
 */
public abstract class Model {
  private String id = "";
  private Instant createdAt;
  private Instant updatedAt;
  private Instant deletedAt;

  public String getId() { return id; }

  public void setId(String id) {
    String next = (id == null) ? "" : id;
    if (!this.id.isEmpty() && !this.id.equals(next)) {
      throw new IllegalStateException("id is already assigned: " + this.id);
    }
    this.id = next;
  }

  /** Forgets an id that never reached the database, e.g. after a failed insert. */
  public void discardId() { this.id = ""; }

  public Instant getCreatedAt() { return createdAt; }
  public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

  public Instant getUpdatedAt() { return updatedAt; }
  public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

  public Instant getDeletedAt() { return deletedAt; }
  public void setDeletedAt(Instant deletedAt) { this.deletedAt = deletedAt; }

  public boolean isNew() { return id.isEmpty(); }

  public boolean isPersisted() { return !id.isEmpty() && createdAt != null; }

  public boolean isDeleted() { return deletedAt != null; }

  public void markDeleted(Instant at) { this.deletedAt = at; }

  public void restore() { this.deletedAt = null; }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{id=" + id + ", deleted=" + isDeleted() + "}";
  }
}
