package io.intellixity.tandem.persistence.query;

import java.util.Objects;

/** One filter predicate: {@code column <operator> value}. Conditions in a query are AND-combined. */
public record FilterCondition(String column, Operator operator, Object value) {
  public FilterCondition {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(operator, "operator");
    if (column.isBlank()) throw new IllegalArgumentException("column must not be blank");
  }

  public static FilterCondition of(String column, Operator operator, Object value) {
    return new FilterCondition(column, operator, value);
  }
}
