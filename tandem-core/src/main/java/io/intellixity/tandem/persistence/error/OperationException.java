package io.intellixity.tandem.persistence.error;

import io.intellixity.tandem.persistence.exec.BackendKind;

/** The backend was reached and rejected the operation (constraint, permission, bad statement). */
public class OperationException extends DataAccessException {
  public OperationException(BackendKind backend, String operation, String message, Throwable cause) {
    super(backend, operation, message, cause);
  }

  public OperationException(BackendKind backend, String operation, String message) {
    this(backend, operation, message, null);
  }

  @Override public final boolean isRecoverable() { return false; }
}
