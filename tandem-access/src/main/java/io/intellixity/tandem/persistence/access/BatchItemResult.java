package io.intellixity.tandem.persistence.access;

import io.intellixity.tandem.persistence.error.DataAccessException;
import io.intellixity.tandem.persistence.record.DataRecord;

/** Outcome of one batch item; {@code index} is the item's position in the input. */
public record BatchItemResult(int index, DataRecord record, DataAccessException error) {
  public static BatchItemResult success(int index, DataRecord record) {
    return new BatchItemResult(index, record, null);
  }

  public static BatchItemResult failure(int index, DataAccessException error) {
    return new BatchItemResult(index, null, error);
  }

  public boolean isSuccess() {
    return error == null;
  }
}
