package io.intellixity.tandem.persistence.access;

import java.util.Map;
import java.util.Objects;

public record BatchUpdate(Object id, Map<String, Object> partial) {
  public BatchUpdate {
    Objects.requireNonNull(id, "id");
    partial = (partial == null) ? Map.of() : partial;
  }

  public static BatchUpdate of(Object id, Map<String, Object> partial) {
    return new BatchUpdate(id, partial);
  }
}
