package io.intellixity.tandem.examples.web;

import io.intellixity.tandem.querycache.QueryResult;
import io.intellixity.tandem.querycache.QueryResultCache;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/** Cached GraphQL queries; failures come back as {@code success=false} bodies. */
@RestController
@RequestMapping("/api/graphql")
public final class QueryController {
  private final ObjectProvider<QueryResultCache> cache;

  public QueryController(ObjectProvider<QueryResultCache> cache) {
    this.cache = cache;
  }

  public record QueryRequest(String query, Map<String, Object> variables, Boolean cache) {}

  @PostMapping("/query")
  public QueryResult query(@RequestBody QueryRequest req) {
    QueryResultCache c = cache.getIfAvailable();
    if (c == null) return QueryResult.failure(req.query(), req.variables(), "tandem.query-cache.endpoint is not set");
    if (req.query() == null || req.query().isBlank()) return QueryResult.failure(null, req.variables(), "query is required");
    boolean useCache = req.cache() == null || req.cache();
    return c.execute(req.query(), req.variables(), useCache);
  }
}
