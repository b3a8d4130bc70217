package io.intellixity.tandem.persistence.error;

import io.intellixity.tandem.persistence.exec.BackendKind;
import io.intellixity.tandem.persistence.query.Operator;

/** A filter operator the executing backend cannot translate. */
public final class UnsupportedOperatorException extends DataAccessException {
  private final Operator operator;
  private final String backendId;

  public UnsupportedOperatorException(BackendKind backend, String backendId, Operator operator, String column) {
    super(backend, "translate",
        "Operator '" + operator.wireName() + "' on column '" + column + "' is not supported by backend '" + backendId + "'",
        null);
    this.operator = operator;
    this.backendId = backendId;
  }

  public Operator operator() { return operator; }
  public String backendId() { return backendId; }

  @Override public boolean isRecoverable() { return false; }
}
