package io.intellixity.strata.persistence.jdbc;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;

/** Binds positional arguments; {@link Instant} goes through {@link Timestamp}, enums bind by name. */
final class JdbcBinder {
  private JdbcBinder() {}

  static void bindAll(PreparedStatement ps, List<?> args) throws SQLException {
    for (int i = 0; i < args.size(); i++) bind(ps, i + 1, args.get(i));
  }

  static void bind(PreparedStatement ps, int index, Object value) throws SQLException {
    if (value == null) ps.setNull(index, Types.NULL);
    else if (value instanceof Instant i) ps.setTimestamp(index, Timestamp.from(i));
    else if (value instanceof String s) ps.setString(index, s);
    else if (value instanceof Enum<?> e) ps.setString(index, e.name());
    else if (value instanceof BigDecimal d) ps.setBigDecimal(index, d);
    else if (value instanceof byte[] b) ps.setBytes(index, b);
    else ps.setObject(index, value);
  }

  /** Value type for TRACE logging; never the value itself. */
  static String describe(Object value) {
    if (value == null) return "null";
    if (value instanceof CharSequence cs) return value.getClass().getSimpleName() + "(len=" + cs.length() + ")";
    if (value instanceof byte[] b) return "byte[" + b.length + "]";
    return value.getClass().getSimpleName();
  }
}
