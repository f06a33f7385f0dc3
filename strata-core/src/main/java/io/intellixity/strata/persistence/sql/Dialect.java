package io.intellixity.strata.persistence.sql;

import java.sql.SQLException;
import java.util.Set;

/**
 * Database-specific behavior the data layer needs: placeholder style and unique-violation
 * detection. Implementations are listed in {@code META-INF/strata.factories}.
 */
public interface Dialect {
  /** Canonical driver name, e.g. {@code postgres}. */
  String id();

  /** Other driver names that resolve to this dialect. */
  default Set<String> aliases() { return Set.of(); }

  PlaceholderStyle placeholderStyle();

  default String rebind(String sql) { return placeholderStyle().rebind(sql); }

  boolean isUniqueViolation(SQLException e);
}
