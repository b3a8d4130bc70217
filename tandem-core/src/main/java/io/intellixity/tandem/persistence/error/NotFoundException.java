package io.intellixity.tandem.persistence.error;

import io.intellixity.tandem.persistence.exec.BackendKind;

public final class NotFoundException extends DataAccessException {
  private final String collection;
  private final Object id;

  public NotFoundException(BackendKind backend, String operation, String collection, Object id) {
    super(backend, operation, "No record with id=" + id + " in " + collection, null);
    this.collection = collection;
    this.id = id;
  }

  public String collection() { return collection; }
  public Object id() { return id; }

  @Override public boolean isRecoverable() { return false; }
}
