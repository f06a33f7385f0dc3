package io.intellixity.strata.persistence.repository;

import io.intellixity.strata.persistence.model.Model;

@FunctionalInterface
public interface TransactionFunction<T extends Model, R> {
  R apply(TxRepository<T> tx) throws Exception;
}
