package io.intellixity.tandem.persistence.query;

import java.util.List;
import java.util.Objects;

/**
 * Relation hint: attach rows of {@code table} whose {@code primaryKey} equals this row's {@code foreignKey}.\n
 *
 * Included fields are exposed as {@code "<table>.<field>"} on the result record.\n
 */
public record Include(String table, String foreignKey, String primaryKey, List<String> fields) {
  public Include {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(foreignKey, "foreignKey");
    primaryKey = (primaryKey == null || primaryKey.isBlank()) ? "id" : primaryKey;
    fields = (fields == null) ? List.of() : List.copyOf(fields);
  }

  public static Include of(String table, String foreignKey, String... fields) {
    return new Include(table, foreignKey, "id", List.of(fields));
  }
}
