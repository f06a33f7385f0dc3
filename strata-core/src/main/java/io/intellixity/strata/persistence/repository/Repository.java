package io.intellixity.strata.persistence.repository;

import io.intellixity.strata.persistence.error.DataAccessErrors;
import io.intellixity.strata.persistence.error.DataAccessException;
import io.intellixity.strata.persistence.error.TransactionException;
import io.intellixity.strata.persistence.exec.ConnectionClient;
import io.intellixity.strata.persistence.exec.OperationContext;
import io.intellixity.strata.persistence.exec.SqlExecutor;
import io.intellixity.strata.persistence.exec.TxHandle;
import io.intellixity.strata.persistence.model.EntityMapping;
import io.intellixity.strata.persistence.model.IdGenerator;
import io.intellixity.strata.persistence.model.Model;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Entry point for one entity type over a pooled {@link ConnectionClient}.
 * Immutable and safe to share between threads.
 */
public final class Repository<T extends Model> extends AbstractRepository<T> {
  private static final Logger log = LoggerFactory.getLogger(Repository.class);

  private final ConnectionClient client;

  public Repository(ConnectionClient client, EntityMapping<T> mapping) {
    this(client, mapping, Clock.systemUTC(), IdGenerator.uuid());
  }

  public Repository(ConnectionClient client, EntityMapping<T> mapping, Clock clock, IdGenerator ids) {
    super(mapping, clock, ids);
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  protected SqlExecutor executor() { return client; }

  public ConnectionClient client() { return client; }

  /** Binds this repository to a transaction the caller manages. */
  public TxRepository<T> withTx(TxHandle tx) {
    return new TxRepository<>(this, tx);
  }

  /**
   * Runs the callback in a new transaction: commit when it returns, roll back when it throws.
   * The callback's exception is rethrown (checked ones wrapped in {@link DataAccessException}).
   */
  public void transaction(OperationContext ctx, TransactionCallback<T> callback) {
    Objects.requireNonNull(callback, "callback");
    inTransaction(ctx, tx -> {
      callback.run(tx);
      return null;
    });
  }

  public <R> R inTransaction(OperationContext ctx, TransactionFunction<T, R> work) {
    Objects.requireNonNull(work, "work");
    TxHandle tx;
    try {
      tx = client.beginTransaction(ctx);
    } catch (RuntimeException e) {
      throw DataAccessErrors.translate("begin transaction", e);
    }

    R result;
    try {
      result = work.apply(withTx(tx));
    } catch (Exception | Error failure) {
      try {
        tx.rollback();
      } catch (RuntimeException rollbackFailure) {
        log.warn("strata.tx rollback failed table={} error={}", tableName(), rollbackFailure.toString());
        TransactionException te = new TransactionException(
            "rollback failed: " + rollbackFailure.getMessage() + " (original error: " + failure.getMessage() + ")",
            failure);
        te.addSuppressed(rollbackFailure);
        throw te;
      }
      if (failure instanceof RuntimeException re) throw re;
      if (failure instanceof Error err) throw err;
      throw new DataAccessException("transaction failed: " + failure.getMessage(), failure);
    }

    try {
      tx.commit();
    } catch (RuntimeException e) {
      throw new TransactionException("commit failed: " + e.getMessage(), e);
    }
    return result;
  }
}
