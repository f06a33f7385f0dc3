package io.intellixity.strata.persistence.mapping;

import java.util.List;

/** Read-only view of the current result row. */
public interface RowAdapter {
  List<String> columns();

  boolean has(String column);

  Object raw(String column);

  /** 1-based positional access. */
  Object raw(int index);

  default boolean isNull(String column) { return raw(column) == null; }

  default <V> V decode(String column, ColumnType<V> type) {
    return type.decode(raw(column));
  }
}
