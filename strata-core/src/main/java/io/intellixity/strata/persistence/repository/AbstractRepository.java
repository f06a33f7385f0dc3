package io.intellixity.strata.persistence.repository;

import io.intellixity.strata.persistence.error.DataAccessErrors;
import io.intellixity.strata.persistence.error.NotFoundException;
import io.intellixity.strata.persistence.error.NotPersistedException;
import io.intellixity.strata.persistence.exec.OperationContext;
import io.intellixity.strata.persistence.exec.SqlExecutor;
import io.intellixity.strata.persistence.hooks.LifecycleHooks;
import io.intellixity.strata.persistence.hooks.Timestamps;
import io.intellixity.strata.persistence.mapping.ColumnTypes;
import io.intellixity.strata.persistence.mapping.RowReader;
import io.intellixity.strata.persistence.model.EntityMapping;
import io.intellixity.strata.persistence.model.IdGenerator;
import io.intellixity.strata.persistence.model.Model;
import io.intellixity.strata.persistence.query.QueryBuilder;
import io.intellixity.strata.persistence.query.QueryOption;
import io.intellixity.strata.persistence.query.QueryOptions;
import io.intellixity.strata.persistence.sql.SqlStatement;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.function.Supplier;

/**
 * CRUD, soft delete and bulk operations for one entity type.
 * <p>
 * Subclasses decide where statements run: {@link Repository} uses the pooled client,
 * {@link TxRepository} an open transaction. Every read and scoped write excludes soft-deleted rows
 * unless the query asks for them.
 */
public abstract class AbstractRepository<T extends Model> {
  protected final EntityMapping<T> mapping;
  protected final Clock clock;
  protected final IdGenerator ids;

  protected AbstractRepository(EntityMapping<T> mapping, Clock clock, IdGenerator ids) {
    this.mapping = Objects.requireNonNull(mapping, "mapping");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.ids = Objects.requireNonNull(ids, "ids");
  }

  /** Where this repository's statements run. */
  protected abstract SqlExecutor executor();

  public EntityMapping<T> mapping() { return mapping; }

  public String tableName() { return mapping.table(); }

  public Record<T> newRecord() {
    return new Record<>(mapping.newInstance(), this);
  }

  public Record<T> wrap(T entity) {
    return new Record<>(Objects.requireNonNull(entity, "entity"), this);
  }

  public void create(OperationContext ctx, T entity) {
    LifecycleHooks.beforeCreate(entity);

    BaseFields before = BaseFields.of(entity);
    Timestamps.applyBeforeCreate(entity, now(), ids);

    LinkedHashMap<String, Object> values = mapping.encode(entity);
    String sql = "INSERT INTO " + tableName() + " (" + String.join(", ", values.keySet()) + ") VALUES ("
        + String.join(", ", Collections.nCopies(values.size(), "?")) + ")";
    try {
      executor().execute(ctx, sql, new ArrayList<>(values.values()));
    } catch (RuntimeException e) {
      before.restoreInto(entity);
      throw DataAccessErrors.translate("create", e);
    }

    LifecycleHooks.afterCreate(entity);
  }

  public void update(OperationContext ctx, T entity) {
    requirePersisted(entity);
    LifecycleHooks.beforeUpdate(entity);

    Instant previous = entity.getUpdatedAt();
    Timestamps.applyBeforeUpdate(entity, now());

    LinkedHashMap<String, Object> values = mapping.encode(entity);
    values.remove(EntityMapping.ID);
    values.remove(EntityMapping.CREATED_AT);
    values.remove(EntityMapping.DELETED_AT);

    List<String> set = new ArrayList<>(values.size());
    values.keySet().forEach(c -> set.add(c + " = ?"));
    List<Object> args = new ArrayList<>(values.values());
    args.add(entity.getId());

    String sql = "UPDATE " + tableName() + " SET " + String.join(", ", set)
        + " WHERE id = ? AND deleted_at IS NULL";
    long rows;
    try {
      rows = executor().execute(ctx, sql, args);
    } catch (RuntimeException e) {
      entity.setUpdatedAt(previous);
      throw DataAccessErrors.translate("update", e);
    }
    if (rows == 0) {
      entity.setUpdatedAt(previous);
      throw notFound(entity.getId());
    }

    LifecycleHooks.afterUpdate(entity);
  }

  public void save(OperationContext ctx, T entity) {
    if (entity.isNew()) create(ctx, entity);
    else update(ctx, entity);
  }

  /** Soft delete: stamps {@code deleted_at}; the row stays but default reads stop returning it. */
  public void delete(OperationContext ctx, T entity) {
    requirePersisted(entity);
    LifecycleHooks.beforeDelete(entity);

    Instant now = now();
    long rows = run(ctx, "delete",
        "UPDATE " + tableName() + " SET deleted_at = ? WHERE id = ? AND deleted_at IS NULL",
        Arrays.asList(now, entity.getId()));
    if (rows == 0) throw notFound(entity.getId());

    Timestamps.applyBeforeDelete(entity, now);
    LifecycleHooks.afterDelete(entity);
  }

  public void hardDelete(OperationContext ctx, T entity) {
    requirePersisted(entity);
    LifecycleHooks.beforeDelete(entity);

    long rows = run(ctx, "hard delete", "DELETE FROM " + tableName() + " WHERE id = ?", List.of(entity.getId()));
    if (rows == 0) throw notFound(entity.getId());

    LifecycleHooks.afterDelete(entity);
  }

  /** Clears {@code deleted_at} of a soft-deleted row. Runs no hooks. */
  public void restore(OperationContext ctx, T entity) {
    requirePersisted(entity);

    Instant now = now();
    long rows = run(ctx, "restore",
        "UPDATE " + tableName() + " SET deleted_at = NULL, updated_at = ? WHERE id = ? AND deleted_at IS NOT NULL",
        Arrays.asList(now, entity.getId()));
    if (rows == 0) throw notFound(entity.getId());

    entity.restore();
    Timestamps.applyBeforeUpdate(entity, now);
  }

  public Record<T> findById(OperationContext ctx, String id) {
    List<T> found = read("find by id",
        () -> executor().query(ctx, "SELECT * FROM " + tableName() + " WHERE id = ? AND deleted_at IS NULL",
            Collections.singletonList(id), mapping::read));
    if (found.isEmpty()) throw notFound(id);
    return wrapFound(found.get(0));
  }

  public List<Record<T>> findAll(OperationContext ctx, QueryOption... options) {
    SqlStatement st = query(options).build();
    List<T> found = read("find all", () -> executor().query(ctx, st.sql(), st.args(), mapping::read));
    List<Record<T>> out = new ArrayList<>(found.size());
    for (T e : found) out.add(wrapFound(e));
    return out;
  }

  /** First match of the options; {@link NotFoundException} when nothing matches. */
  public Record<T> findOne(OperationContext ctx, QueryOption... options) {
    List<Record<T>> found = findAll(ctx, append(options, QueryOptions.limit(1)));
    if (found.isEmpty()) throw new NotFoundException(mapping.type().getSimpleName() + " not found");
    return found.get(0);
  }

  /** Oldest match by {@code created_at}. */
  public Record<T> first(OperationContext ctx, QueryOption... options) {
    return findOne(ctx, append(options, QueryOptions.orderByAsc(EntityMapping.CREATED_AT)));
  }

  /** Newest match by {@code created_at}. */
  public Record<T> last(OperationContext ctx, QueryOption... options) {
    return findOne(ctx, append(options, QueryOptions.orderByDesc(EntityMapping.CREATED_AT)));
  }

  public long count(OperationContext ctx, QueryOption... options) {
    SqlStatement st = query(options).buildCount();
    Optional<Long> n = read("count",
        () -> executor().queryOne(ctx, st.sql(), st.args(), RowReader.firstColumn(ColumnTypes.longType())));
    return n.orElse(0L);
  }

  public boolean exists(OperationContext ctx, String id) {
    String sql = "SELECT EXISTS(SELECT 1 FROM " + tableName() + " WHERE id = ? AND deleted_at IS NULL)";
    Optional<Boolean> b = read("exists check",
        () -> executor().queryOne(ctx, sql, Collections.singletonList(id), RowReader.firstColumn(ColumnTypes.bool())));
    return b.orElse(false);
  }

  public boolean existsWhere(OperationContext ctx, QueryOption... options) {
    return count(ctx, options) > 0;
  }

  /** Soft-deletes every live row matching the options' conditions. Bypasses hooks. */
  public long deleteWhere(OperationContext ctx, QueryOption... options) {
    QueryBuilder qb = query(options);
    List<Object> args = new ArrayList<>();
    args.add(now());
    args.addAll(qb.whereArgs());
    String sql = "UPDATE " + tableName() + " SET deleted_at = ? WHERE " + scopedConditions(qb);
    return run(ctx, "delete where", sql, args);
  }

  /**
   * Sets the given columns on every live row matching the options' conditions and stamps
   * {@code updated_at}. Bypasses hooks. An empty update map touches nothing.
   */
  public long updateWhere(OperationContext ctx, Map<String, ?> updates, QueryOption... options) {
    if (updates == null || updates.isEmpty()) return 0;
    QueryBuilder qb = query(options);

    List<String> set = new ArrayList<>(updates.size() + 1);
    List<Object> args = new ArrayList<>(updates.size() + qb.whereArgs().size() + 1);
    for (Map.Entry<String, ?> e : updates.entrySet()) {
      if (EntityMapping.UPDATED_AT.equals(e.getKey())) continue;
      set.add(e.getKey() + " = ?");
      args.add(e.getValue());
    }
    set.add(EntityMapping.UPDATED_AT + " = ?");
    args.add(now());
    args.addAll(qb.whereArgs());

    String sql = "UPDATE " + tableName() + " SET " + String.join(", ", set) + " WHERE " + scopedConditions(qb);
    return run(ctx, "update where", sql, args);
  }

  protected Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MILLIS);
  }

  private QueryBuilder query(QueryOption... options) {
    return QueryBuilder.forTable(tableName()).apply(options);
  }

  private static String scopedConditions(QueryBuilder qb) {
    List<String> conditions = new ArrayList<>(qb.whereConditions().size() + 1);
    conditions.add(QueryBuilder.SOFT_DELETE_FILTER);
    conditions.addAll(qb.whereConditions());
    return String.join(" AND ", conditions);
  }

  private static QueryOption[] append(QueryOption[] options, QueryOption extra) {
    QueryOption[] base = (options == null) ? new QueryOption[0] : options;
    QueryOption[] out = Arrays.copyOf(base, base.length + 1);
    out[base.length] = extra;
    return out;
  }

  private Record<T> wrapFound(T entity) {
    LifecycleHooks.afterFind(entity);
    return new Record<>(entity, this);
  }

  private long run(OperationContext ctx, String op, String sql, List<?> args) {
    try {
      return executor().execute(ctx, sql, args);
    } catch (RuntimeException e) {
      throw DataAccessErrors.translate(op, e);
    }
  }

  private static <R> R read(String op, Supplier<R> query) {
    try {
      return query.get();
    } catch (RuntimeException e) {
      throw DataAccessErrors.translate(op, e);
    }
  }

  private void requirePersisted(T entity) {
    if (entity.isNew()) {
      throw new NotPersistedException(mapping.type().getSimpleName() + " has not been persisted");
    }
  }

  private NotFoundException notFound(String id) {
    return new NotFoundException(mapping.type().getSimpleName() + " " + id + " not found");
  }

  /** Base fields captured before stamping, put back if the insert fails. */
  private record BaseFields(boolean wasNew, Instant createdAt, Instant updatedAt) {
    static BaseFields of(Model m) {
      return new BaseFields(m.isNew(), m.getCreatedAt(), m.getUpdatedAt());
    }

    void restoreInto(Model m) {
      if (wasNew) m.discardId();
      m.setCreatedAt(createdAt);
      m.setUpdatedAt(updatedAt);
    }
  }
}
