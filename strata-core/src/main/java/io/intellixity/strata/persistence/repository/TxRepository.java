package io.intellixity.strata.persistence.repository;

import io.intellixity.strata.persistence.exec.SqlExecutor;
import io.intellixity.strata.persistence.exec.TxHandle;
import io.intellixity.strata.persistence.model.Model;

import java.util.Objects;

/**
 * Repository bound to one open transaction. Records it returns stay bound to the transaction.
 * Not thread-safe; use it only from the callback that received it.
 */
public final class TxRepository<T extends Model> extends AbstractRepository<T> {
  private final Repository<T> parent;
  private final TxHandle tx;

  TxRepository(Repository<T> parent, TxHandle tx) {
    super(parent.mapping, parent.clock, parent.ids);
    this.parent = parent;
    this.tx = Objects.requireNonNull(tx, "tx");
  }

  @Override
  protected SqlExecutor executor() { return tx; }

  public TxHandle transaction() { return tx; }

  /** The pooled repository this transaction was opened from. */
  public Repository<T> parent() { return parent; }
}
