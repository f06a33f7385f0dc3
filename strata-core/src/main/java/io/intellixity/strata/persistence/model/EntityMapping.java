package io.intellixity.strata.persistence.model;

import io.intellixity.strata.persistence.error.InvalidModelException;
import io.intellixity.strata.persistence.mapping.ColumnType;
import io.intellixity.strata.persistence.mapping.ColumnTypes;
import io.intellixity.strata.persistence.mapping.RowAdapter;
import io.intellixity.strata.persistence.sql.Identifiers;

import java.util.*;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Binds an entity type to its table.
 * <p>
 * The base columns {@code id}, {@code created_at}, {@code updated_at} and {@code deleted_at} come
 * first, followed by the declared columns in declaration order. That order is the column order of
 * every INSERT and UPDATE the repository emits.
 */
public final class EntityMapping<T extends Model> {
  public static final String ID = "id";
  public static final String CREATED_AT = "created_at";
  public static final String UPDATED_AT = "updated_at";
  public static final String DELETED_AT = "deleted_at";

  private final Class<T> type;
  private final String table;
  private final Supplier<? extends T> factory;
  private final List<Column<T, ?>> columns;
  private final Map<String, Column<T, ?>> byName;

  private EntityMapping(Class<T> type, String table, Supplier<? extends T> factory, List<Column<T, ?>> columns) {
    this.type = type;
    this.table = table;
    this.factory = factory;
    this.columns = List.copyOf(columns);
    Map<String, Column<T, ?>> m = new LinkedHashMap<>();
    for (Column<T, ?> c : columns) m.put(c.name(), c);
    this.byName = Collections.unmodifiableMap(m);
  }

  public static <T extends Model> Builder<T> builder(Class<T> type, String table, Supplier<? extends T> factory) {
    return new Builder<>(type, table, factory);
  }

  public Class<T> type() { return type; }
  public String table() { return table; }
  public List<Column<T, ?>> columns() { return columns; }
  public List<String> columnNames() { return List.copyOf(byName.keySet()); }
  public Optional<Column<T, ?>> column(String name) { return Optional.ofNullable(byName.get(name)); }

  public T newInstance() {
    T e = factory.get();
    if (e == null) throw new InvalidModelException("factory for " + type.getSimpleName() + " returned null");
    if (!e.isNew()) throw new InvalidModelException("factory for " + type.getSimpleName() + " returned an entity with an id");
    return e;
  }

  /** Builds an entity from the row; columns the result does not carry are left untouched. */
  public T read(RowAdapter row) {
    T e = newInstance();
    for (Column<T, ?> c : columns) {
      if (row.has(c.name())) c.read(e, row);
    }
    return e;
  }

  /** Encoded values of every column, in column order. */
  public LinkedHashMap<String, Object> encode(T entity) {
    LinkedHashMap<String, Object> out = new LinkedHashMap<>();
    for (Column<T, ?> c : columns) out.put(c.name(), c.encode(entity));
    return out;
  }

  /** Copies the declared (non-base) columns from one entity to another. */
  public void copyDeclared(T from, T to) {
    for (Column<T, ?> c : columns) {
      if (!isBaseColumn(c.name())) c.copy(from, to);
    }
  }

  public static boolean isBaseColumn(String name) {
    return ID.equals(name) || CREATED_AT.equals(name) || UPDATED_AT.equals(name) || DELETED_AT.equals(name);
  }

  public static final class Builder<T extends Model> {
    private final Class<T> type;
    private final String table;
    private final Supplier<? extends T> factory;
    private final List<Column<T, ?>> declared = new ArrayList<>();

    private Builder(Class<T> type, String table, Supplier<? extends T> factory) {
      this.type = type;
      this.table = table;
      this.factory = factory;
    }

    public <V> Builder<T> column(String name, ColumnType<V> columnType, Function<T, V> getter, BiConsumer<T, V> setter) {
      declared.add(new Column<>(name, columnType, getter, setter));
      return this;
    }

    public EntityMapping<T> build() {
      if (type == null) throw new InvalidModelException("entity type is required");
      String who = type.getSimpleName();
      if (!Identifiers.isTableName(table)) throw new InvalidModelException("invalid table name for " + who + ": " + table);
      if (factory == null) throw new InvalidModelException("factory is required for " + who);

      List<Column<T, ?>> all = new ArrayList<>();
      all.add(new Column<T, String>(ID, ColumnTypes.string(), Model::getId, Model::setId));
      all.add(new Column<T, java.time.Instant>(CREATED_AT, ColumnTypes.instant(), Model::getCreatedAt, Model::setCreatedAt));
      all.add(new Column<T, java.time.Instant>(UPDATED_AT, ColumnTypes.instant(), Model::getUpdatedAt, Model::setUpdatedAt));
      all.add(new Column<T, java.time.Instant>(DELETED_AT, ColumnTypes.instant(), Model::getDeletedAt, Model::setDeletedAt));

      Set<String> seen = new HashSet<>();
      all.forEach(c -> seen.add(c.name()));
      for (Column<T, ?> c : declared) {
        if (!Identifiers.isIdentifier(c.name())) throw new InvalidModelException("invalid column name on " + who + ": " + c.name());
        if (c.type() == null || c.getter() == null || c.setter() == null) {
          throw new InvalidModelException("column " + c.name() + " on " + who + " needs a type, getter and setter");
        }
        if (!seen.add(c.name())) throw new InvalidModelException("duplicate column on " + who + ": " + c.name());
        all.add(c);
      }
      return new EntityMapping<>(type, table, factory, all);
    }
  }
}
