package io.intellixity.tandem.persistence.access;

import io.intellixity.tandem.persistence.exec.BackendClient;

/** Work run inside a transaction; every call on {@code client} joins it. */
@FunctionalInterface
public interface TransactionWork<T> {
  T run(BackendClient client);
}
