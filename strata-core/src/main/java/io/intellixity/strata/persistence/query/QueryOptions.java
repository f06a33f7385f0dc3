package io.intellixity.strata.persistence.query;

import java.util.Arrays;
import java.util.Collection;

/**
 * Static factories for query options, meant for static import:
 *
 * <pre>
 * repo.findAll(ctx, whereEq("name", "Whiskers"), orderByDesc("created_at"), limit(5));
 * </pre>
 */
public final class QueryOptions {
  private QueryOptions() {}

  public static QueryOption where(String condition, Object... args) { return qb -> qb.where(condition, args); }
  public static QueryOption whereEq(String column, Object value) { return qb -> qb.whereEq(column, value); }
  public static QueryOption whereIn(String column, Object... values) {
    return qb -> qb.whereIn(column, values == null ? null : Arrays.asList(values));
  }
  public static QueryOption whereIn(String column, Collection<?> values) { return qb -> qb.whereIn(column, values); }
  public static QueryOption whereNull(String column) { return qb -> qb.whereNull(column); }
  public static QueryOption whereNotNull(String column) { return qb -> qb.whereNotNull(column); }
  public static QueryOption whereLike(String column, String pattern) { return qb -> qb.whereLike(column, pattern); }
  public static QueryOption whereBetween(String column, Object min, Object max) { return qb -> qb.whereBetween(column, min, max); }

  public static QueryOption orderBy(String column, String direction) { return qb -> qb.orderBy(column, direction); }
  public static QueryOption orderByAsc(String column) { return orderBy(column, "ASC"); }
  public static QueryOption orderByDesc(String column) { return orderBy(column, "DESC"); }
  public static QueryOption groupBy(String... columns) { return qb -> qb.groupBy(columns); }
  public static QueryOption having(String condition, Object... args) { return qb -> qb.having(condition, args); }

  public static QueryOption limit(int n) { return qb -> qb.limit(n); }
  public static QueryOption offset(int n) { return qb -> qb.offset(n); }
  public static QueryOption paginate(int page, int perPage) { return qb -> qb.paginate(page, perPage); }

  public static QueryOption withDeleted() { return QueryBuilder::withDeleted; }
  public static QueryOption onlyDeleted() { return QueryBuilder::onlyDeleted; }

  public static QueryOption select(String... columns) { return qb -> qb.select(columns); }
  public static QueryOption join(String clause) { return qb -> qb.join(clause); }
}
