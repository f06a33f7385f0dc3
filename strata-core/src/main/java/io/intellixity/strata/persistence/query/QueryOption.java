package io.intellixity.strata.persistence.query;

/** One step of query configuration; see {@link QueryOptions} for the built-in steps. */
@FunctionalInterface
public interface QueryOption {
  QueryBuilder applyTo(QueryBuilder qb);
}
