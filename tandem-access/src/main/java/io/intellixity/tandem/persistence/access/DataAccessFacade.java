package io.intellixity.tandem.persistence.access;

import io.intellixity.tandem.persistence.access.cache.CacheKeys;
import io.intellixity.tandem.persistence.access.cache.CacheLookup;
import io.intellixity.tandem.persistence.access.cache.CacheStore;
import io.intellixity.tandem.persistence.access.cache.TtlPolicy;
import io.intellixity.tandem.persistence.error.CacheException;
import io.intellixity.tandem.persistence.exec.CallOptions;
import io.intellixity.tandem.persistence.query.PageResult;
import io.intellixity.tandem.persistence.query.QueryOptions;
import io.intellixity.tandem.persistence.record.DataRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * CRUD/query facade for one collection.\n
 *
 * Reads go through the shared cache (stale entries are served and revalidated in the background);
 * writes go through the fallback coordinator and invalidate the collection's cached lists and the
 * touched item. Batch operations and transactions clear the whole cache afterwards.\n
 *
 * Cache keys do not include the backend: a cached read may have been answered by either backend,
 * including one a per-call {@link CallOptions#backend()} override did not pick. Options that cannot
 * be turned into a key, and every call inside an open transaction, read through uncached.\n
 */
public final class DataAccessFacade {
  private static final Logger log = LoggerFactory.getLogger(DataAccessFacade.class);

  private final String collection;
  private final DataAccess access;
  private final CacheStore cache;
  private final TtlPolicy ttl;
  private final FallbackCoordinator coordinator;

  DataAccessFacade(String collection, DataAccess access) {
    this.collection = Objects.requireNonNull(collection, "collection");
    this.access = access;
    this.cache = access.cache();
    this.ttl = access.ttl();
    this.coordinator = access.coordinator();
  }

  public String collection() { return collection; }

  // --- Reads ---

  public List<DataRecord> getAll() {
    return getAll(null, CallOptions.defaults());
  }

  public List<DataRecord> getAll(QueryOptions options) {
    return getAll(options, CallOptions.defaults());
  }

  public List<DataRecord> getAll(QueryOptions options, CallOptions call) {
    QueryOptions q = (options == null) ? new QueryOptions() : options;
    return cachedRead("getAll", () -> CacheKeys.list(collection, q),
        () -> List.copyOf(coordinator.execute("getAll", call, c -> c.list(collection, q))),
        rows -> ttl.forList(rows.size()));
  }

  public PageResult getPage(QueryOptions options) {
    return getPage(options, CallOptions.defaults());
  }

  /** One page plus, when {@code options.count()} is set, the total count across pages. */
  public PageResult getPage(QueryOptions options, CallOptions call) {
    Objects.requireNonNull(options, "options");
    return cachedRead("getPage", () -> CacheKeys.page(collection, options),
        () -> coordinator.execute("getPage", call, c -> {
          List<DataRecord> items = c.list(collection, options);
          Long total = options.count() ? c.count(collection, options) : null;
          return PageResult.of(items, options.page(), total);
        }),
        page -> ttl.forList(page.items().size()));
  }

  public Optional<DataRecord> getById(Object id) {
    return getById(id, CallOptions.defaults());
  }

  /** Absent records come back empty (never cached), not as an error. */
  public Optional<DataRecord> getById(Object id, CallOptions call) {
    Objects.requireNonNull(id, "id");
    return Optional.ofNullable(cachedRead("getById", () -> CacheKeys.item(collection, id),
        () -> coordinator.execute("getById", call, c -> c.get(collection, id)).orElse(null),
        r -> ttl.forItem()));
  }

  public long count() {
    return count(null, CallOptions.defaults());
  }

  public long count(QueryOptions options) {
    return count(options, CallOptions.defaults());
  }

  public long count(QueryOptions options, CallOptions call) {
    return coordinator.execute("count", call, c -> c.count(collection, options));
  }

  // --- Writes ---

  public DataRecord create(Map<String, ?> data) {
    return create(data, CallOptions.defaults());
  }

  public DataRecord create(Map<String, ?> data, CallOptions call) {
    DataRecord input = DataRecord.of(Objects.requireNonNull(data, "data"));
    DataRecord stored = coordinator.execute("create", call, c -> c.insert(collection, input));
    invalidate(stored.id());
    remember(stored.id(), stored);
    return stored;
  }

  public DataRecord update(Object id, Map<String, Object> partial) {
    return update(id, partial, CallOptions.defaults());
  }

  public DataRecord update(Object id, Map<String, Object> partial, CallOptions call) {
    Objects.requireNonNull(id, "id");
    DataRecord stored = coordinator.execute("update", call, c -> c.update(collection, id, partial));
    invalidate(id);
    remember(id, stored);
    return stored;
  }

  public boolean remove(Object id) {
    return remove(id, CallOptions.defaults());
  }

  public boolean remove(Object id, CallOptions call) {
    Objects.requireNonNull(id, "id");
    boolean removed = coordinator.execute("remove", call, c -> c.delete(collection, id));
    invalidate(id);
    return removed;
  }

  // --- Batches ---

  public List<BatchItemResult> batchCreate(List<? extends Map<String, ?>> items) {
    return batchCreate(items, CallOptions.defaults());
  }

  public List<BatchItemResult> batchCreate(List<? extends Map<String, ?>> items, CallOptions call) {
    List<DataRecord> records = new ArrayList<>(items.size());
    for (Map<String, ?> m : items) records.add(DataRecord.of(m));
    try {
      return access.batch().run("batchCreate", records, call, (c, r) -> c.insert(collection, r));
    } finally {
      cache.clear();
    }
  }

  public List<BatchItemResult> batchUpdate(List<BatchUpdate> updates) {
    return batchUpdate(updates, CallOptions.defaults());
  }

  public List<BatchItemResult> batchUpdate(List<BatchUpdate> updates, CallOptions call) {
    try {
      return access.batch().run("batchUpdate", updates, call, (c, u) -> c.update(collection, u.id(), u.partial()));
    } finally {
      cache.clear();
    }
  }

  public boolean batchRemove(List<?> ids) {
    return batchRemove(ids, CallOptions.defaults());
  }

  /** @return true when every chunk was deleted without error */
  public boolean batchRemove(List<?> ids, CallOptions call) {
    try {
      return access.batch().removeAll(collection, ids, call);
    } finally {
      cache.clear();
    }
  }

  // --- Backend-native ---

  public List<DataRecord> executeRawQuery(String query) {
    return executeRawQuery(query, List.of(), CallOptions.defaults());
  }

  public List<DataRecord> executeRawQuery(String query, List<?> params) {
    return executeRawQuery(query, params, CallOptions.defaults());
  }

  /** Runs on the preferred backend only: SQL and database commands are not portable across backends. */
  public List<DataRecord> executeRawQuery(String query, List<?> params, CallOptions call) {
    return coordinator.executePinned("executeRawQuery", call, c -> c.rawQuery(query, params));
  }

  public <T> T withTransaction(TransactionWork<T> work) {
    return access.withTransaction(work);
  }

  public CacheStore cache() {
    return cache;
  }

  // --- Internals ---

  private void invalidate(Object id) {
    cache.removeByPrefix(CacheKeys.listPrefix(collection));
    cache.removeByPrefix(CacheKeys.pagePrefix(collection));
    if (id != null) cache.remove(CacheKeys.item(collection, id));
  }

  /** A null result is returned as is and not cached. */
  private <T> T cachedRead(String operation, Supplier<String> keyOf, Supplier<T> load,
                           Function<? super T, Duration> ttlFor) {
    String key = cacheKey(operation, keyOf);
    if (key == null) return load.get();

    CacheLookup hit = cache.get(key);
    if (hit.found()) {
      if (hit.revalidate()) revalidate(key, load, ttlFor);
      return hit.valueAs();
    }
    T value = load.get();
    if (value != null) cache.set(key, value, ttlFor.apply(value));
    return value;
  }

  /** @return the key, or null when this read must bypass the cache */
  private String cacheKey(String operation, Supplier<String> keyOf) {
    if (coordinator.inTransaction()) return null;
    try {
      return keyOf.get();
    } catch (CacheException e) {
      log.warn("tandem.cache op=KEY collection={} operation={} bypass=true error={}",
          collection, operation, e.getMessage());
      return null;
    }
  }

  private void remember(Object id, DataRecord stored) {
    if (coordinator.inTransaction()) return;
    cache.set(CacheKeys.item(collection, id), stored, ttl.forItem());
  }

  private <T> void revalidate(String key, Supplier<T> load, Function<? super T, Duration> ttlFor) {
    try {
      access.revalidation().execute(() -> cache.refresh(key, load, ttlFor));
    } catch (RejectedExecutionException e) {
      log.warn("tandem.cache op=REVALIDATE key={} rejected={}", key, e.getMessage());
    }
  }
}
