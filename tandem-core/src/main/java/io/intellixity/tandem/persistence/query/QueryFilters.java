package io.intellixity.tandem.persistence.query;

import java.util.Collection;
import java.util.List;

public final class QueryFilters {
  private QueryFilters() {}

  public static FilterCondition eq(String column, Object value) { return FilterCondition.of(column, Operator.EQ, value); }
  public static FilterCondition neq(String column, Object value) { return FilterCondition.of(column, Operator.NEQ, value); }
  public static FilterCondition gt(String column, Object value) { return FilterCondition.of(column, Operator.GT, value); }
  public static FilterCondition gte(String column, Object value) { return FilterCondition.of(column, Operator.GTE, value); }
  public static FilterCondition lt(String column, Object value) { return FilterCondition.of(column, Operator.LT, value); }
  public static FilterCondition lte(String column, Object value) { return FilterCondition.of(column, Operator.LTE, value); }

  public static FilterCondition like(String column, String pattern) { return FilterCondition.of(column, Operator.LIKE, pattern); }
  public static FilterCondition ilike(String column, String pattern) { return FilterCondition.of(column, Operator.ILIKE, pattern); }

  public static FilterCondition in(String column, Collection<?> values) {
    return FilterCondition.of(column, Operator.IN, values == null ? List.of() : List.copyOf(values));
  }

  /** Identity check: value must be null, true or false. */
  public static FilterCondition is(String column, Boolean value) { return FilterCondition.of(column, Operator.IS, value); }

  /** Column (array) contains every given value. */
  public static FilterCondition contains(String column, Collection<?> values) {
    return FilterCondition.of(column, Operator.CONTAINS, values == null ? List.of() : List.copyOf(values));
  }

  /** Every element of the column (array) is one of the given values. */
  public static FilterCondition containedBy(String column, Collection<?> values) {
    return FilterCondition.of(column, Operator.CONTAINED_BY, values == null ? List.of() : List.copyOf(values));
  }

  /** Column (array) shares at least one element with the given values. */
  public static FilterCondition overlaps(String column, Collection<?> values) {
    return FilterCondition.of(column, Operator.OVERLAPS, values == null ? List.of() : List.copyOf(values));
  }

  public static FilterCondition textSearch(String column, String query) { return FilterCondition.of(column, Operator.TEXT_SEARCH, query); }

  /** Range operators take a range literal such as {@code "[2024-01-01,2024-02-01)"}. */
  public static FilterCondition rangeGt(String column, String range) { return FilterCondition.of(column, Operator.RANGE_GT, range); }
  public static FilterCondition rangeLt(String column, String range) { return FilterCondition.of(column, Operator.RANGE_LT, range); }
  public static FilterCondition rangeGte(String column, String range) { return FilterCondition.of(column, Operator.RANGE_GTE, range); }
  public static FilterCondition rangeLte(String column, String range) { return FilterCondition.of(column, Operator.RANGE_LTE, range); }
  public static FilterCondition rangeAdjacent(String column, String range) { return FilterCondition.of(column, Operator.RANGE_ADJACENT, range); }
}
