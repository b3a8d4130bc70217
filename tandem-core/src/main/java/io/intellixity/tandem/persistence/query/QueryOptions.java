package io.intellixity.tandem.persistence.query;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.*;

/**
 * Backend-neutral list query: AND-combined filters, one page, ordered sort, projection and relation hints.\n
 *
 * Mutable builder in the {@code withX} style; use {@link #copy()} before changing a shared instance.\n
 */
@JsonSerialize(using = QueryOptionsJsonSerializer.class)
public final class QueryOptions {
  private List<FilterCondition> filters = new ArrayList<>();
  private Page page;
  private List<SortField> sort = new ArrayList<>();
  private List<String> select = new ArrayList<>();
  private List<Include> include = new ArrayList<>();
  private boolean count;
  private UnsupportedOperatorPolicy unsupportedOperators = UnsupportedOperatorPolicy.ABORT;

  public QueryOptions() {}

  public List<FilterCondition> filters() { return filters; }
  public Page page() { return page; }
  public List<SortField> sort() { return sort; }
  public List<String> select() { return select; }
  public List<Include> include() { return include; }
  /** When set, paged reads also compute the total number of matching records. */
  public boolean count() { return count; }
  public UnsupportedOperatorPolicy unsupportedOperators() { return unsupportedOperators; }

  public QueryOptions withFilters(List<FilterCondition> filters) { this.filters = new ArrayList<>(filters == null ? List.of() : filters); return this; }
  public QueryOptions withFilter(FilterCondition filter) { this.filters.add(Objects.requireNonNull(filter, "filter")); return this; }
  public QueryOptions where(String column, Operator operator, Object value) { return withFilter(FilterCondition.of(column, operator, value)); }
  public QueryOptions withPage(Page page) { this.page = page; return this; }
  public QueryOptions withSort(List<SortField> sort) { this.sort = new ArrayList<>(sort == null ? List.of() : sort); return this; }
  public QueryOptions orderBy(String column, boolean ascending) { this.sort.add(new SortField(column, ascending)); return this; }
  public QueryOptions withSelect(List<String> select) { this.select = new ArrayList<>(select == null ? List.of() : select); return this; }
  public QueryOptions withInclude(List<Include> include) { this.include = new ArrayList<>(include == null ? List.of() : include); return this; }
  public QueryOptions include(Include include) { this.include.add(Objects.requireNonNull(include, "include")); return this; }
  public QueryOptions withCount(boolean count) { this.count = count; return this; }
  public QueryOptions withUnsupportedOperators(UnsupportedOperatorPolicy policy) {
    this.unsupportedOperators = (policy == null) ? UnsupportedOperatorPolicy.ABORT : policy;
    return this;
  }

  /** Free-text search shortcut; rendered as a {@link Operator#TEXT_SEARCH} condition. */
  public QueryOptions withSearch(String column, String query) {
    if (query == null || query.isBlank()) return this;
    return withFilter(QueryFilters.textSearch(column, query.trim()));
  }

  public QueryOptions copy() {
    return new QueryOptions()
        .withFilters(filters)
        .withPage(page)
        .withSort(sort)
        .withSelect(select)
        .withInclude(include)
        .withCount(count)
        .withUnsupportedOperators(unsupportedOperators);
  }

  public static QueryOptions of(FilterCondition... filters) {
    return new QueryOptions().withFilters(List.of(filters));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof QueryOptions q)) return false;
    return count == q.count
        && filters.equals(q.filters)
        && Objects.equals(page, q.page)
        && sort.equals(q.sort)
        && select.equals(q.select)
        && include.equals(q.include)
        && unsupportedOperators == q.unsupportedOperators;
  }

  @Override
  public int hashCode() {
    return Objects.hash(filters, page, sort, select, include, count, unsupportedOperators);
  }

  @Override
  public String toString() {
    return "QueryOptions{filters=" + filters + ", page=" + page + ", sort=" + sort
        + ", select=" + select + ", include=" + include + ", count=" + count + "}";
  }
}
