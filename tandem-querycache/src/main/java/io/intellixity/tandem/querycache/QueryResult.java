package io.intellixity.tandem.querycache;

import java.util.Map;

/**
 * Outcome of {@link QueryResultCache#execute}: either data or an error message, never both.\n
 *
 * @param fromCache true when {@code data} came from a fresh cached row
 */
public record QueryResult(boolean success, String query, Map<String, Object> variables,
                          Map<String, Object> data, String error, boolean fromCache) {
  public QueryResult {
    variables = (variables == null) ? Map.of() : variables;
  }

  public static QueryResult success(String query, Map<String, Object> variables, Map<String, Object> data,
                                    boolean fromCache) {
    return new QueryResult(true, query, variables, data, null, fromCache);
  }

  public static QueryResult failure(String query, Map<String, Object> variables, String error) {
    return new QueryResult(false, query, variables, null, error, false);
  }
}
