package io.intellixity.strata.persistence.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** SQL text with {@code ?} placeholders and its positional arguments (which may contain nulls). */
public record SqlStatement(String sql, List<Object> args) {
  public SqlStatement {
    args = (args == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
  }
}
