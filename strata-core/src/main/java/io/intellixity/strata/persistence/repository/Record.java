package io.intellixity.strata.persistence.repository;

import io.intellixity.strata.persistence.error.NotPersistedException;
import io.intellixity.strata.persistence.exec.OperationContext;
import io.intellixity.strata.persistence.model.EntityMapping;
import io.intellixity.strata.persistence.model.Model;

import java.util.Objects;

/**
 * An entity together with the repository that produced it, so it can persist itself.
 * State queries always read the wrapped entity.
 */
public final class Record<T extends Model> {
  private T entity;
  private final AbstractRepository<T> repository;

  Record(T entity, AbstractRepository<T> repository) {
    this.entity = Objects.requireNonNull(entity, "entity");
    this.repository = Objects.requireNonNull(repository, "repository");
  }

  public T entity() { return entity; }
  public AbstractRepository<T> repository() { return repository; }
  public String id() { return entity.getId(); }

  public boolean isNew() { return entity.isNew(); }
  public boolean isPersisted() { return entity.isPersisted(); }
  public boolean isDeleted() { return entity.isDeleted(); }

  public void save(OperationContext ctx) { repository.save(ctx, entity); }
  public void create(OperationContext ctx) { repository.create(ctx, entity); }
  public void update(OperationContext ctx) { repository.update(ctx, entity); }
  public void delete(OperationContext ctx) { repository.delete(ctx, entity); }
  public void hardDelete(OperationContext ctx) { repository.hardDelete(ctx, entity); }
  public void restore(OperationContext ctx) { repository.restore(ctx, entity); }

  /** Replaces the wrapped entity with the stored row. */
  public void reload(OperationContext ctx) {
    if (entity.isNew()) throw new NotPersistedException("cannot reload a record that has not been persisted");
    entity = repository.findById(ctx, entity.getId()).entity();
  }

  /** Bumps {@code updated_at} without changing anything else. */
  public void touch(OperationContext ctx) {
    if (entity.isNew()) throw new NotPersistedException("cannot touch a record that has not been persisted");
    repository.update(ctx, entity);
  }

  /** New, unsaved record carrying the same mapped values but no id or timestamps. */
  public Record<T> duplicate() {
    EntityMapping<T> mapping = repository.mapping();
    T copy = mapping.newInstance();
    mapping.copyDeclared(entity, copy);
    return repository.wrap(copy);
  }

  @Override
  public String toString() {
    return "Record{" + entity + "}";
  }
}
