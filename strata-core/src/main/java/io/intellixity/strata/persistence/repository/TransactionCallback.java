package io.intellixity.strata.persistence.repository;

import io.intellixity.strata.persistence.model.Model;

/** Work run inside a transaction; throwing rolls it back. */
@FunctionalInterface
public interface TransactionCallback<T extends Model> {
  void run(TxRepository<T> tx) throws Exception;
}
