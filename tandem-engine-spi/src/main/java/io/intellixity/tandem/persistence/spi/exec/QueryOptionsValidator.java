package io.intellixity.tandem.persistence.spi.exec;

import io.intellixity.tandem.persistence.exec.BackendKind;
import io.intellixity.tandem.persistence.query.QueryOptions;

/**
 * Pluggable validation for list/count options.\n
 *
 * Default implementation: {@link DefaultQueryOptionsValidator}.\n
 */
public interface QueryOptionsValidator {
  /** Throws {@link io.intellixity.tandem.persistence.error.ValidationException} when invalid. */
  void validate(BackendKind backend, String collection, QueryOptions options);
}
