package io.intellixity.strata.persistence.sql;

import java.sql.SQLException;
import java.util.Set;

/** MySQL / MariaDB: {@code ?} placeholders, duplicate entry is error 1062 with SQLState 23000. */
public final class MySqlDialect extends AbstractDialect {
  @Override public String id() { return "mysql"; }
  @Override public Set<String> aliases() { return Set.of("mariadb"); }
  @Override public PlaceholderStyle placeholderStyle() { return PlaceholderStyle.QUESTION; }

  @Override
  protected boolean isVendorUniqueViolation(SQLException e) {
    return e.getErrorCode() == MYSQL_DUPLICATE_ENTRY && "23000".equals(e.getSQLState());
  }
}
