package io.intellixity.tandem.persistence.error;

import io.intellixity.tandem.persistence.exec.BackendKind;

/**
 * Root of the data-access error taxonomy.\n
 *
 * Carries the backend that failed (null when no backend was involved) and the logical operation name.
 * {@link #isRecoverable()} decides whether the other backend may be tried.\n
 */
public abstract class DataAccessException extends RuntimeException {
  private final BackendKind backend;
  private final String operation;

  protected DataAccessException(BackendKind backend, String operation, String message, Throwable cause) {
    super(message, cause);
    this.backend = backend;
    this.operation = operation;
  }

  public BackendKind backend() { return backend; }
  public String operation() { return operation; }

  /** True when the failure says nothing about the request itself (connectivity, availability). */
  public abstract boolean isRecoverable();
}
