package io.intellixity.tandem.persistence.error;

import io.intellixity.tandem.persistence.exec.BackendKind;

/** The request itself is invalid (bad options, bad value, malformed raw query). */
public final class ValidationException extends DataAccessException {
  public ValidationException(BackendKind backend, String operation, String message, Throwable cause) {
    super(backend, operation, message, cause);
  }

  public ValidationException(String operation, String message) {
    this(null, operation, message, null);
  }

  @Override public boolean isRecoverable() { return false; }
}
