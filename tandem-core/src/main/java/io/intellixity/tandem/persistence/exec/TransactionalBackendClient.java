package io.intellixity.tandem.persistence.exec;

/**
 * Backend client with explicit transaction demarcation.\n
 *
 * {@link #begin()} binds the transaction to the calling thread; every operation issued on this client
 * from that thread joins it until {@link #commit(TxHandle)} or {@link #rollback(TxHandle)} releases it.\n
 */
public interface TransactionalBackendClient extends BackendClient {
  TxHandle begin();

  void commit(TxHandle tx);

  void rollback(TxHandle tx);

  boolean inTransaction();
}
