package io.intellixity.strata.persistence.jdbc.postgres;

import io.intellixity.strata.persistence.sql.AbstractDialect;
import io.intellixity.strata.persistence.sql.PlaceholderStyle;
import org.postgresql.util.PSQLException;
import org.postgresql.util.PSQLState;

import java.sql.SQLException;
import java.util.Set;

/**
 * Postgres dialect.
 *
 * Placeholders render as {@code $1, $2}; a unique violation is SQLState 23505 as reported by
 * {@link PSQLException}.
 */
public final class PostgresDialect extends AbstractDialect {
  @Override public String id() { return "postgres"; }
  @Override public Set<String> aliases() { return Set.of("postgresql", "pgx"); }
  @Override public PlaceholderStyle placeholderStyle() { return PlaceholderStyle.DOLLAR; }

  @Override
  protected boolean isVendorUniqueViolation(SQLException e) {
    return e instanceof PSQLException && PSQLState.UNIQUE_VIOLATION.getState().equals(e.getSQLState());
  }
}
