package io.intellixity.tandem.persistence.error;

import io.intellixity.tandem.persistence.exec.BackendKind;

/** The requested backend has no client configured in this process. */
public final class NotConfiguredException extends ConnectionException {
  public NotConfiguredException(BackendKind backend, String operation, String message) {
    super(backend, operation, message, null);
  }
}
