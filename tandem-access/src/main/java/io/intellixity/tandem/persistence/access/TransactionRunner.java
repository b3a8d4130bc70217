package io.intellixity.tandem.persistence.access;

import io.intellixity.tandem.persistence.error.TransactionException;
import io.intellixity.tandem.persistence.exec.BackendKind;
import io.intellixity.tandem.persistence.exec.TransactionalBackendClient;
import io.intellixity.tandem.persistence.exec.TxHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * BEGIN, run, COMMIT; on any failure ROLLBACK and rethrow the original error.\n
 *
 * Only the relational (SECONDARY) backend takes part. A call made while this thread already has a
 * transaction open joins it instead of nesting.\n
 */
public final class TransactionRunner {
  private static final Logger log = LoggerFactory.getLogger(TransactionRunner.class);

  private final TransactionalBackendClient client;

  public TransactionRunner(TransactionalBackendClient client) {
    this.client = Objects.requireNonNull(client, "client");
    if (client.kind() != BackendKind.SECONDARY) {
      throw new IllegalArgumentException("Transactions run on the SECONDARY backend only, got " + client.kind());
    }
  }

  public <T> T run(TransactionWork<T> work) {
    Objects.requireNonNull(work, "work");
    if (client.inTransaction()) return work.run(client);

    TxHandle tx = client.begin();
    T result;
    try {
      result = work.run(client);
    } catch (RuntimeException | Error e) {
      rollbackAfter(tx, e);
      throw e;
    }
    try {
      client.commit(tx);
    } catch (TransactionException e) {
      rollbackAfter(tx, e);
      throw e;
    }
    return result;
  }

  private void rollbackAfter(TxHandle tx, Throwable original) {
    try {
      client.rollback(tx);
    } catch (RuntimeException rollbackFailure) {
      original.addSuppressed(rollbackFailure);
      log.error("tandem.tx op=ROLLBACK failed={} original={}",
          rollbackFailure.getMessage(), original.getClass().getSimpleName(), rollbackFailure);
    }
  }
}
