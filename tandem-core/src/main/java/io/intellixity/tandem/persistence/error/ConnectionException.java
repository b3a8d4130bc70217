package io.intellixity.tandem.persistence.error;

import io.intellixity.tandem.persistence.exec.BackendKind;

/** Backend unreachable, timed out at the transport level, or refused the connection. Recoverable. */
public class ConnectionException extends DataAccessException {
  public ConnectionException(BackendKind backend, String operation, String message, Throwable cause) {
    super(backend, operation, message, cause);
  }

  public ConnectionException(BackendKind backend, String operation, String message) {
    this(backend, operation, message, null);
  }

  @Override public final boolean isRecoverable() { return true; }
}
