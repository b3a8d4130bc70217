package io.intellixity.tandem.persistence.spi.exec;

import io.intellixity.tandem.persistence.error.ValidationException;
import io.intellixity.tandem.persistence.exec.BackendKind;
import io.intellixity.tandem.persistence.query.*;
import io.intellixity.tandem.persistence.record.DataRecord;

import java.util.Collection;
import java.util.regex.Pattern;

/**
 * Default, backend-agnostic options validation.\n
 *
 * Validates:\n
 * - collection, filter, sort, select and include names are plain identifiers (dot paths allowed)\n
 * - filter values have the shape their operator expects\n
 * - cursor pages carry no sort other than {@code id} ascending\n
 */
public final class DefaultQueryOptionsValidator implements QueryOptionsValidator {
  private static final Pattern IDENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

  @Override
  public void validate(BackendKind backend, String collection, QueryOptions options) {
    requireIdentifier(backend, "collection", collection);
    if (options == null) return;

    for (FilterCondition c : options.filters()) {
      requireIdentifier(backend, "filter column", c.column());
      validateValue(backend, c);
    }
    for (SortField sf : options.sort()) requireIdentifier(backend, "sort column", sf.column());
    requireCursorOrder(backend, options);
    for (String s : options.select()) requireIdentifier(backend, "select column", s);
    for (Include inc : options.include()) {
      requireIdentifier(backend, "include table", inc.table());
      requireIdentifier(backend, "include foreignKey", inc.foreignKey());
      requireIdentifier(backend, "include primaryKey", inc.primaryKey());
      for (String f : inc.fields()) requireIdentifier(backend, "include field", f);
    }
  }

  public static void requireIdentifier(BackendKind backend, String what, String name) {
    if (name == null || !IDENT.matcher(name).matches()) {
      throw new ValidationException(backend, "validate", "Invalid " + what + ": '" + name + "'", null);
    }
  }

  /**
   * A cursor is the last seen {@code id}, so the keyset predicate {@code id > cursor} only pages
   * correctly when rows are ordered by id ascending. Other orderings need offset pages.\n
   */
  public static void requireCursorOrder(BackendKind backend, QueryOptions options) {
    if (!(options.page() instanceof CursorPage)) return;
    for (SortField sf : options.sort()) {
      if (!DataRecord.ID.equals(sf.column()) || !sf.ascending()) {
        throw new ValidationException(backend, "validate",
            "Cursor pages are ordered by id ascending; sort by '" + sf.column() + "' needs an offset page", null);
      }
    }
  }

  private static void validateValue(BackendKind backend, FilterCondition c) {
    Object v = c.value();
    String problem = switch (c.operator()) {
      case EQ, NEQ -> null;
      case GT, GTE, LT, LTE -> (v == null) ? "requires a non-null value" : null;
      case LIKE, ILIKE -> (v instanceof String) ? null : "requires a string pattern";
      case IN, CONTAINS, CONTAINED_BY, OVERLAPS -> (v instanceof Collection<?>) ? null : "requires a list of values";
      case IS -> (v == null || v instanceof Boolean) ? null : "accepts only null, true or false";
      case TEXT_SEARCH, RANGE_GT, RANGE_LT, RANGE_GTE, RANGE_LTE, RANGE_ADJACENT ->
          (v instanceof String s && !s.isBlank()) ? null : "requires a non-blank string";
    };
    if (problem != null) {
      throw new ValidationException(backend, "validate",
          "Operator '" + c.operator().wireName() + "' on column '" + c.column() + "' " + problem, null);
    }
  }
}
