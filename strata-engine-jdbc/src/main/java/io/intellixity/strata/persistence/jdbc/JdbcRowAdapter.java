package io.intellixity.strata.persistence.jdbc;

import io.intellixity.strata.persistence.error.DataAccessException;
import io.intellixity.strata.persistence.mapping.RowAdapter;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.*;

/** {@link RowAdapter} over the current row of a JDBC result set; columns resolve by label, case-insensitively. */
public final class JdbcRowAdapter implements RowAdapter {
  private final ResultSet rs;
  private Map<String, Integer> colIndex;
  private List<String> labels;

  public JdbcRowAdapter(ResultSet rs) {
    this.rs = Objects.requireNonNull(rs, "rs");
  }

  @Override
  public List<String> columns() {
    index();
    return labels;
  }

  @Override
  public boolean has(String column) {
    return index().containsKey(key(column));
  }

  @Override
  public Object raw(String column) {
    Integer i = index().get(key(column));
    if (i == null) throw new IllegalArgumentException("Unknown column label: " + column);
    return raw(i);
  }

  @Override
  public Object raw(int index) {
    try {
      return rs.getObject(index);
    } catch (SQLException e) {
      throw new DataAccessException("failed to read column " + index + ": " + e.getMessage(), e, e.getSQLState());
    }
  }

  private Map<String, Integer> index() {
    if (colIndex == null) {
      try {
        ResultSetMetaData md = rs.getMetaData();
        Map<String, Integer> m = new HashMap<>();
        List<String> l = new ArrayList<>(md.getColumnCount());
        for (int i = 1; i <= md.getColumnCount(); i++) {
          String label = md.getColumnLabel(i);
          l.add(label);
          m.putIfAbsent(key(label), i);
        }
        colIndex = m;
        labels = Collections.unmodifiableList(l);
      } catch (SQLException e) {
        throw new DataAccessException("failed to read result metadata: " + e.getMessage(), e, e.getSQLState());
      }
    }
    return colIndex;
  }

  private static String key(String label) {
    return label == null ? "" : label.toLowerCase(Locale.ROOT);
  }
}
