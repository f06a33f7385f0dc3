package io.intellixity.strata.persistence.query;

import io.intellixity.strata.persistence.sql.SqlStatement;

import java.util.*;
import java.util.function.Consumer;

/**
 * Immutable SELECT builder over one table.
 * <p>
 * Every configuration call returns a new builder. Conditions are ANDed in the order they were
 * added, after the soft-delete filter ({@code deleted_at IS NULL}) unless deleted rows were asked
 * for. Arguments bind in the order WHERE arguments, then HAVING arguments.
 */
public final class QueryBuilder {
  public static final String SOFT_DELETE_FILTER = "deleted_at IS NULL";

  private final String table;
  private final List<String> columns;
  private final List<String> conditions;
  private final List<Object> args;
  private final List<String> orderBy;
  private final List<String> groupBy;
  private final List<String> having;
  private final List<Object> havingArgs;
  private final List<String> joins;
  private final int limit;
  private final int offset;
  private final boolean withDeleted;

  private QueryBuilder(Draft d) {
    this.table = d.table;
    this.columns = Collections.unmodifiableList(d.columns);
    this.conditions = Collections.unmodifiableList(d.conditions);
    this.args = Collections.unmodifiableList(d.args);
    this.orderBy = Collections.unmodifiableList(d.orderBy);
    this.groupBy = Collections.unmodifiableList(d.groupBy);
    this.having = Collections.unmodifiableList(d.having);
    this.havingArgs = Collections.unmodifiableList(d.havingArgs);
    this.joins = Collections.unmodifiableList(d.joins);
    this.limit = d.limit;
    this.offset = d.offset;
    this.withDeleted = d.withDeleted;
  }

  public static QueryBuilder forTable(String table) {
    Objects.requireNonNull(table, "table");
    Draft d = new Draft();
    d.table = table;
    return new QueryBuilder(d);
  }

  public QueryBuilder apply(QueryOption... options) {
    return apply(options == null ? List.of() : Arrays.asList(options));
  }

  public QueryBuilder apply(Collection<? extends QueryOption> options) {
    QueryBuilder qb = this;
    for (QueryOption o : options) {
      if (o != null) qb = o.applyTo(qb);
    }
    return qb;
  }

  public QueryBuilder where(String condition, Object... values) {
    return edit(d -> {
      d.conditions.add(condition);
      if (values != null) d.args.addAll(Arrays.asList(values));
    });
  }

  public QueryBuilder whereEq(String column, Object value) {
    return edit(d -> {
      d.conditions.add(column + " = ?");
      d.args.add(value);
    });
  }

  /** No-op when there are no values. */
  public QueryBuilder whereIn(String column, Collection<?> values) {
    if (values == null || values.isEmpty()) return this;
    return edit(d -> {
      d.conditions.add(column + " IN (" + String.join(", ", Collections.nCopies(values.size(), "?")) + ")");
      d.args.addAll(values);
    });
  }

  public QueryBuilder whereNull(String column) {
    return where(column + " IS NULL");
  }

  public QueryBuilder whereNotNull(String column) {
    return where(column + " IS NOT NULL");
  }

  public QueryBuilder whereLike(String column, String pattern) {
    return edit(d -> {
      d.conditions.add(column + " LIKE ?");
      d.args.add(pattern);
    });
  }

  public QueryBuilder whereBetween(String column, Object min, Object max) {
    return edit(d -> {
      d.conditions.add(column + " BETWEEN ? AND ?");
      d.args.add(min);
      d.args.add(max);
    });
  }

  /** Direction is ASC or DESC, case-insensitive; anything else sorts ascending. */
  public QueryBuilder orderBy(String column, String direction) {
    String dir = (direction == null) ? "" : direction.trim().toUpperCase(Locale.ROOT);
    if (!dir.equals("ASC") && !dir.equals("DESC")) dir = "ASC";
    String term = column + " " + dir;
    return edit(d -> d.orderBy.add(term));
  }

  public QueryBuilder groupBy(String... cols) {
    return edit(d -> d.groupBy.addAll(Arrays.asList(cols)));
  }

  public QueryBuilder having(String condition, Object... values) {
    return edit(d -> {
      d.having.add(condition);
      if (values != null) d.havingArgs.addAll(Arrays.asList(values));
    });
  }

  /** Ignored unless positive. */
  public QueryBuilder limit(int n) {
    if (n <= 0) return this;
    return edit(d -> d.limit = n);
  }

  /** Ignored when negative. */
  public QueryBuilder offset(int n) {
    if (n < 0) return this;
    return edit(d -> d.offset = n);
  }

  /**
   * 1-based page; page below 1 becomes 1, perPage below 1 becomes 10.
   *
   * @throws IllegalArgumentException when the page's offset does not fit in an {@code int}
   */
  public QueryBuilder paginate(int page, int perPage) {
    int p = Math.max(page, 1);
    int size = (perPage < 1) ? 10 : perPage;
    int start;
    try {
      start = Math.multiplyExact(p - 1, size);
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException("page " + page + " of size " + size + " is out of range", e);
    }
    return edit(d -> {
      d.limit = size;
      d.offset = start;
    });
  }

  public QueryBuilder withDeleted() {
    return edit(d -> d.withDeleted = true);
  }

  public QueryBuilder onlyDeleted() {
    return edit(d -> {
      d.withDeleted = true;
      d.conditions.add("deleted_at IS NOT NULL");
    });
  }

  public QueryBuilder select(String... cols) {
    return edit(d -> d.columns.addAll(Arrays.asList(cols)));
  }

  public QueryBuilder join(String clause) {
    return edit(d -> d.joins.add(clause));
  }

  public SqlStatement build() {
    return render(false);
  }

  /** {@code SELECT COUNT(*)} over the same filters; ordering and paging are dropped. */
  public SqlStatement buildCount() {
    return render(true);
  }

  private SqlStatement render(boolean count) {
    StringBuilder sql = new StringBuilder(64);
    List<Object> all = new ArrayList<>(args.size() + havingArgs.size());

    if (count) {
      sql.append("SELECT COUNT(*) FROM ");
    } else {
      sql.append("SELECT ").append(columns.isEmpty() ? "*" : String.join(", ", columns)).append(" FROM ");
    }
    sql.append(table);
    for (String j : joins) sql.append(' ').append(j);

    List<String> where = new ArrayList<>(conditions.size() + 1);
    if (!withDeleted) where.add(SOFT_DELETE_FILTER);
    where.addAll(conditions);
    if (!where.isEmpty()) sql.append(" WHERE ").append(String.join(" AND ", where));
    all.addAll(args);

    if (!groupBy.isEmpty()) sql.append(" GROUP BY ").append(String.join(", ", groupBy));
    if (!having.isEmpty()) {
      sql.append(" HAVING ").append(String.join(" AND ", having));
      all.addAll(havingArgs);
    }

    if (!count) {
      if (!orderBy.isEmpty()) sql.append(" ORDER BY ").append(String.join(", ", orderBy));
      if (limit > 0) sql.append(" LIMIT ").append(limit);
      else if (offset > 0) sql.append(" LIMIT -1");
      if (offset > 0) sql.append(" OFFSET ").append(offset);
    }
    return new SqlStatement(sql.toString(), all);
  }

  public String table() { return table; }

  /** User conditions, without the soft-delete filter. */
  public List<String> whereConditions() { return conditions; }

  public List<Object> whereArgs() { return args; }

  public int limit() { return limit; }
  public int offset() { return offset; }
  public boolean includesDeleted() { return withDeleted; }

  private QueryBuilder edit(Consumer<Draft> change) {
    Draft d = new Draft(this);
    change.accept(d);
    return new QueryBuilder(d);
  }

  @Override
  public String toString() {
    return build().sql();
  }

  private static final class Draft {
    String table;
    final List<String> columns;
    final List<String> conditions;
    final List<Object> args;
    final List<String> orderBy;
    final List<String> groupBy;
    final List<String> having;
    final List<Object> havingArgs;
    final List<String> joins;
    int limit;
    int offset;
    boolean withDeleted;

    Draft() {
      columns = new ArrayList<>();
      conditions = new ArrayList<>();
      args = new ArrayList<>();
      orderBy = new ArrayList<>();
      groupBy = new ArrayList<>();
      having = new ArrayList<>();
      havingArgs = new ArrayList<>();
      joins = new ArrayList<>();
    }

    Draft(QueryBuilder qb) {
      table = qb.table;
      columns = new ArrayList<>(qb.columns);
      conditions = new ArrayList<>(qb.conditions);
      args = new ArrayList<>(qb.args);
      orderBy = new ArrayList<>(qb.orderBy);
      groupBy = new ArrayList<>(qb.groupBy);
      having = new ArrayList<>(qb.having);
      havingArgs = new ArrayList<>(qb.havingArgs);
      joins = new ArrayList<>(qb.joins);
      limit = qb.limit;
      offset = qb.offset;
      withDeleted = qb.withDeleted;
    }
  }
}
