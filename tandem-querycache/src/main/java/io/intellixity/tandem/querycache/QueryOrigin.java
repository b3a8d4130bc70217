package io.intellixity.tandem.querycache;

import java.util.Map;

/** The real query endpoint behind the cache. */
@FunctionalInterface
public interface QueryOrigin {
  /**
   * @return the response {@code data} object
   * @throws QueryOriginException when the endpoint is unreachable or answers with errors
   */
  Map<String, Object> fetch(String query, Map<String, Object> variables);
}
