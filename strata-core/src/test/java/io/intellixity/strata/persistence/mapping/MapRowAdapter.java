package io.intellixity.strata.persistence.mapping;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Row backed by an ordered map, for tests that never touch a driver. */
public final class MapRowAdapter implements RowAdapter {
  private final LinkedHashMap<String, Object> values;

  public MapRowAdapter(Map<String, ?> values) {
    this.values = new LinkedHashMap<>(values);
  }

  @Override public List<String> columns() { return new ArrayList<>(values.keySet()); }
  @Override public boolean has(String column) { return values.containsKey(column); }

  @Override
  public Object raw(String column) {
    if (!values.containsKey(column)) throw new IllegalArgumentException("Unknown column label: " + column);
    return values.get(column);
  }

  @Override
  public Object raw(int index) {
    return new ArrayList<>(values.values()).get(index - 1);
  }
}
