package io.intellixity.tandem.persistence.error;

import io.intellixity.tandem.persistence.exec.BackendKind;

/** A transaction could not be started or committed. */
public final class TransactionException extends DataAccessException {
  public enum Phase { BEGIN, COMMIT, ROLLBACK, UNSUPPORTED }

  private final Phase phase;

  public TransactionException(BackendKind backend, Phase phase, String message, Throwable cause) {
    super(backend, "transaction." + phase.name().toLowerCase(java.util.Locale.ROOT), message, cause);
    this.phase = phase;
  }

  public Phase phase() { return phase; }

  @Override public boolean isRecoverable() { return false; }
}
