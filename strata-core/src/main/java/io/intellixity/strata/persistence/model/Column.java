package io.intellixity.strata.persistence.model;

import io.intellixity.strata.persistence.mapping.ColumnType;
import io.intellixity.strata.persistence.mapping.RowAdapter;

import java.util.function.BiConsumer;
import java.util.function.Function;

/** One mapped column: name, type and the accessors that move the value in and out of the entity. */
public record Column<T, V>(String name, ColumnType<V> type, Function<T, V> getter, BiConsumer<T, V> setter) {
  public Object encode(T entity) {
    return type.encode(getter.apply(entity));
  }

  public void read(T entity, RowAdapter row) {
    setter.accept(entity, row.decode(name, type));
  }

  public void copy(T from, T to) {
    setter.accept(to, getter.apply(from));
  }
}
