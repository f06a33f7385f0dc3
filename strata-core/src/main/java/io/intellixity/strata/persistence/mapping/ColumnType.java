package io.intellixity.strata.persistence.mapping;

/**
 * Converts between a driver value and a Java field value.
 * <p>
 * {@code decode} accepts whatever the driver returned for the column (possibly null);
 * {@code encode} produces the value handed to the driver as a bind argument.
 */
public interface ColumnType<V> {
  String id();
  Class<V> javaType();
  V decode(Object raw);
  Object encode(V value);
}
