package io.intellixity.tandem.persistence.error;

import io.intellixity.tandem.persistence.exec.BackendKind;

/** The caller cancelled the operation or its deadline passed. Never retried on another backend. */
public final class OperationCancelledException extends DataAccessException {
  public OperationCancelledException(BackendKind backend, String operation, String message, Throwable cause) {
    super(backend, operation, message, cause);
  }

  public OperationCancelledException(BackendKind backend, String operation, String message) {
    this(backend, operation, message, null);
  }

  @Override public boolean isRecoverable() { return false; }
}
