package io.intellixity.strata.persistence.mapping;

@FunctionalInterface
public interface RowReader<R> {
  R read(RowAdapter row);

  /** Reads the first column of each row with the given type. */
  static <V> RowReader<V> firstColumn(ColumnType<V> type) {
    return row -> type.decode(row.raw(1));
  }
}
