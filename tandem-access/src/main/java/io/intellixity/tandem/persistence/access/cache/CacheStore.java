package io.intellixity.tandem.persistence.access.cache;

import io.intellixity.tandem.persistence.error.CacheException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Process-wide LRU cache with per-entry TTL and stale serving.\n
 *
 * - Eviction bounded by {@code maxSize}: least recently read with {@code updateAgeOnGet}, oldest write without\n
 * - TTL: per entry, counted from the write; reads never extend it. An expired entry is still served
 *   as stale until it is refreshed or evicted\n
 * - A refresh only lands on the entry it was started for; an entry removed or replaced meanwhile wins\n
 * - One lock guards the map; counters are atomics so {@link #stats()} never blocks readers for long\n
 *
 * Cache failures are logged and never thrown: a failed read is a miss, a failed write is a no-op.\n
 */
public final class CacheStore {
  private static final Logger log = LoggerFactory.getLogger(CacheStore.class);

  public static final int DEFAULT_MAX_SIZE = 500;
  public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

  private final int maxSize;
  private final long defaultTtlMillis;
  private final LongSupplier nowMillis;

  private final Object lock = new Object();
  private final LinkedHashMap<String, Entry> map;

  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();
  private final AtomicLong staleHits = new AtomicLong();
  private final AtomicLong sets = new AtomicLong();
  private final AtomicLong evictions = new AtomicLong();
  private final AtomicLong refreshes = new AtomicLong();

  private static final class Entry {
    final Object value;
    final long ttlMillis;
    final long insertedAt;
    boolean refreshPending;

    Entry(Object value, long ttlMillis, long now) {
      this.value = value;
      this.ttlMillis = ttlMillis;
      this.insertedAt = now;
    }

    boolean isStale(long now) {
      return now - insertedAt >= ttlMillis;
    }
  }

  public CacheStore() {
    this(DEFAULT_MAX_SIZE, DEFAULT_TTL, true, System::currentTimeMillis);
  }

  public CacheStore(int maxSize, Duration defaultTtl) {
    this(maxSize, defaultTtl, true, System::currentTimeMillis);
  }

  public CacheStore(int maxSize, Duration defaultTtl, boolean updateAgeOnGet, LongSupplier nowMillis) {
    if (maxSize <= 0) throw new IllegalArgumentException("maxSize must be > 0");
    Objects.requireNonNull(defaultTtl, "defaultTtl");
    if (defaultTtl.isNegative() || defaultTtl.isZero()) throw new IllegalArgumentException("defaultTtl must be > 0");
    this.maxSize = maxSize;
    this.defaultTtlMillis = defaultTtl.toMillis();
    this.map = new LinkedHashMap<>(16, 0.75f, updateAgeOnGet);
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
  }

  public CacheLookup get(String key) {
    try {
      Objects.requireNonNull(key, "key");
      CacheLookup lookup;
      synchronized (lock) {
        long now = nowMillis.getAsLong();
        Entry e = map.get(key);
        if (e == null) {
          lookup = CacheLookup.miss();
        } else if (e.isStale(now)) {
          boolean revalidate = !e.refreshPending;
          e.refreshPending = true;
          lookup = CacheLookup.stale(e.value, revalidate);
        } else {
          lookup = CacheLookup.fresh(e.value);
        }
      }
      countLookup(key, lookup);
      return lookup;
    } catch (RuntimeException e) {
      logFailure(new CacheException("get", "Cache read failed for key " + key, e));
      misses.incrementAndGet();
      return CacheLookup.miss();
    }
  }

  private void countLookup(String key, CacheLookup lookup) {
    if (!lookup.found()) {
      misses.incrementAndGet();
      log.debug("tandem.cache op=MISS key={}", key);
    } else if (lookup.stale()) {
      staleHits.incrementAndGet();
      log.debug("tandem.cache op=STALE_HIT key={} revalidate={}", key, lookup.revalidate());
    } else {
      hits.incrementAndGet();
      log.debug("tandem.cache op=HIT key={}", key);
    }
  }

  public void set(String key, Object value) {
    set(key, value, null);
  }

  /** Store {@code value}; a null {@code ttl} means the default TTL. Null values are not cached. */
  public void set(String key, Object value, Duration ttl) {
    try {
      Objects.requireNonNull(key, "key");
      if (value == null) return;
      long ttlMillis = (ttl == null) ? defaultTtlMillis : ttl.toMillis();
      if (ttlMillis <= 0) throw new IllegalArgumentException("ttl must be > 0");
      synchronized (lock) {
        map.put(key, new Entry(value, ttlMillis, nowMillis.getAsLong()));
        evictIfNeeded();
      }
      sets.incrementAndGet();
      log.debug("tandem.cache op=SET key={} ttlMs={}", key, ttlMillis);
    } catch (RuntimeException e) {
      logFailure(new CacheException("set", "Cache write failed for key " + key, e));
    }
  }

  public boolean remove(String key) {
    if (key == null) return false;
    boolean removed;
    synchronized (lock) {
      removed = map.remove(key) != null;
    }
    if (removed) log.debug("tandem.cache op=DELETE key={}", key);
    return removed;
  }

  /** @return number of removed entries */
  public int removeByPrefix(String prefix) {
    if (prefix == null || prefix.isEmpty()) return 0;
    int n = 0;
    synchronized (lock) {
      Iterator<String> it = map.keySet().iterator();
      while (it.hasNext()) {
        if (it.next().startsWith(prefix)) {
          it.remove();
          n++;
        }
      }
    }
    if (n > 0) log.debug("tandem.cache op=DELETE_PREFIX prefix={} removed={}", prefix, n);
    return n;
  }

  /** Drop every entry and reset the counters. */
  public void clear() {
    synchronized (lock) {
      map.clear();
    }
    hits.set(0);
    misses.set(0);
    staleHits.set(0);
    sets.set(0);
    evictions.set(0);
    refreshes.set(0);
    log.debug("tandem.cache op=CLEAR");
  }

  /**
   * Re-fetch the value for {@code key} and store it, keeping the entry's TTL (default TTL when absent).\n
   *
   * @see #refresh(String, Supplier, Function)
   */
  public <T> Optional<T> refresh(String key, Supplier<T> fetcher) {
    return refresh(key, fetcher, null);
  }

  /**
   * Re-fetch the value for {@code key} and store it with the TTL {@code ttlFor} picks for the new
   * value (the entry's current TTL when {@code ttlFor} is null).\n
   *
   * The fetcher runs outside the lock. The result is dropped when the entry was removed or replaced
   * while the fetcher ran, so a write's invalidation is never undone by an older read. A failing
   * fetcher leaves the current entry in place and allows the next stale read to schedule another
   * refresh; a null result removes the entry.\n
   */
  public <T> Optional<T> refresh(String key, Supplier<T> fetcher, Function<? super T, Duration> ttlFor) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(fetcher, "fetcher");
    Entry started;
    synchronized (lock) {
      started = map.get(key);
    }
    if (started == null) {
      log.debug("tandem.cache op=REFRESH key={} skipped=absent", key);
      return Optional.empty();
    }

    T fresh;
    try {
      fresh = fetcher.get();
    } catch (RuntimeException e) {
      synchronized (lock) {
        if (map.get(key) == started) started.refreshPending = false;
      }
      logFailure(new CacheException("refresh", "Refresh failed for key " + key, e));
      return Optional.empty();
    }

    long ttlMillis = started.ttlMillis;
    if (fresh != null && ttlFor != null) {
      try {
        Duration d = ttlFor.apply(fresh);
        if (d != null && d.toMillis() > 0) ttlMillis = d.toMillis();
      } catch (RuntimeException e) {
        logFailure(new CacheException("refresh", "TTL selection failed for key " + key, e));
      }
    }

    synchronized (lock) {
      if (map.get(key) != started) {
        log.debug("tandem.cache op=REFRESH key={} skipped=superseded", key);
        return Optional.empty();
      }
      if (fresh == null) {
        // the source no longer has it
        map.remove(key);
      } else {
        map.put(key, new Entry(fresh, ttlMillis, nowMillis.getAsLong()));
        evictIfNeeded();
      }
    }
    if (fresh == null) return Optional.empty();
    refreshes.incrementAndGet();
    log.debug("tandem.cache op=REFRESH key={} ttlMs={}", key, ttlMillis);
    return Optional.of(fresh);
  }

  public CacheStats stats() {
    int size;
    synchronized (lock) {
      size = map.size();
    }
    return CacheStats.of(hits.get(), misses.get(), staleHits.get(), sets.get(), evictions.get(), refreshes.get(),
        size, maxSize);
  }

  public int size() {
    synchronized (lock) {
      return map.size();
    }
  }

  private void evictIfNeeded() {
    while (map.size() > maxSize) {
      Iterator<Map.Entry<String, Entry>> it = map.entrySet().iterator();
      if (!it.hasNext()) return;
      it.next();
      it.remove();
      evictions.incrementAndGet();
    }
  }

  private static void logFailure(CacheException e) {
    log.warn("tandem.cache op={} error={}", e.operation(), e.getMessage(), e);
  }
}
