package io.intellixity.tandem.querycache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.tandem.persistence.error.CacheException;
import io.intellixity.tandem.persistence.exec.BackendClient;
import io.intellixity.tandem.persistence.record.DataRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Content-addressed cache in front of a {@link QueryOrigin}, persisted as rows in a relational table.\n
 *
 * Flow of {@link #execute(String, Map, boolean)}:\n
 * - id = {@link QueryHasher#id}\n
 * - with caching on, a fresh row (younger than the TTL) is returned without calling the origin\n
 * - otherwise the origin is called; with caching on the row is upserted and the response text is
 *   handed to the {@link SemanticStore}\n
 *
 * Origin failures come back as {@link QueryResult#failure}. Cache reads and writes and the semantic
 * store never fail the call: their errors are logged and a failed read counts as a miss.\n
 */
public final class QueryResultCache {
  private static final Logger log = LoggerFactory.getLogger(QueryResultCache.class);
  private static final ObjectMapper JSON = new ObjectMapper();

  public static final String DEFAULT_TABLE = "gql_cache";
  public static final Duration DEFAULT_TTL = Duration.ofMinutes(60);

  private final BackendClient store;
  private final QueryOrigin origin;
  private final SemanticStore semantic;
  private final String table;
  private final Duration ttl;
  private final Clock clock;

  public QueryResultCache(BackendClient store, QueryOrigin origin, SemanticStore semantic,
                          String table, Duration ttl, Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.origin = Objects.requireNonNull(origin, "origin");
    this.semantic = (semantic == null) ? SemanticStore.none() : semantic;
    this.table = (table == null || table.isBlank()) ? DEFAULT_TABLE : table;
    this.ttl = (ttl == null) ? DEFAULT_TTL : ttl;
    if (this.ttl.isNegative() || this.ttl.isZero()) throw new IllegalArgumentException("ttl must be > 0");
    this.clock = (clock == null) ? Clock.systemUTC() : clock;
  }

  public QueryResultCache(BackendClient store, QueryOrigin origin, SemanticStore semantic) {
    this(store, origin, semantic, DEFAULT_TABLE, DEFAULT_TTL, null);
  }

  public String table() { return table; }
  public Duration ttl() { return ttl; }

  public QueryResult execute(String query, Map<String, Object> variables) {
    return execute(query, variables, true);
  }

  public QueryResult execute(String query, Map<String, Object> variables, boolean useCache) {
    Objects.requireNonNull(query, "query");
    Map<String, Object> vars = (variables == null) ? Map.of() : variables;

    String id;
    try {
      id = QueryHasher.id(query, vars);
    } catch (IllegalArgumentException e) {
      return QueryResult.failure(query, vars, e.getMessage());
    }

    if (useCache) {
      Optional<CachedQueryResult> hit = read(id);
      if (hit.isPresent() && hit.get().isFresh(clock.instant(), ttl)) {
        log.debug("tandem.querycache op=HIT id={}", id);
        return QueryResult.success(query, vars, hit.get().response(), true);
      }
      log.debug("tandem.querycache op={} id={}", hit.isPresent() ? "STALE" : "MISS", id);
    }

    Map<String, Object> data;
    try {
      data = origin.fetch(query, vars);
    } catch (RuntimeException e) {
      log.warn("tandem.querycache op=ORIGIN id={} error={}", id, e.getMessage());
      return QueryResult.failure(query, vars, e.getMessage());
    }

    if (useCache) {
      Instant now = clock.instant();
      write(new CachedQueryResult(id, query, vars, data, now));
      index(id, data);
    }
    return QueryResult.success(query, vars, data, false);
  }

  private Optional<CachedQueryResult> read(String id) {
    try {
      return store.get(table, id).map(CachedQueryResult::fromRecord);
    } catch (RuntimeException e) {
      logFailure(new CacheException("read", "Query cache read failed for id " + id, e));
      return Optional.empty();
    }
  }

  private void write(CachedQueryResult row) {
    try {
      DataRecord stored = store.upsert(table, row.toRecord());
      log.debug("tandem.querycache op=UPSERT id={} table={}", stored.id(), table);
    } catch (RuntimeException e) {
      logFailure(new CacheException("write", "Query cache write failed for id " + row.id(), e));
    }
  }

  private void index(String id, Map<String, Object> data) {
    try {
      semantic.store(JSON.writeValueAsString(data));
    } catch (JsonProcessingException | RuntimeException e) {
      log.warn("tandem.querycache op=SEMANTIC id={} error={}", id, e.getMessage());
    }
  }

  private static void logFailure(CacheException e) {
    log.warn("tandem.querycache op={} error={}", e.operation(), e.getMessage(), e);
  }
}
