package io.intellixity.tandem.persistence.access.cache;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

final class CacheStoreTest {
  private final AtomicLong now = new AtomicLong(0);

  private CacheStore store(int maxSize, boolean updateAgeOnGet) {
    return new CacheStore(maxSize, Duration.ofSeconds(300), updateAgeOnGet, now::get);
  }

  @Test
  void entryIsFreshUntilTtlThenServedStale() {
    CacheStore c = store(10, false);
    c.set("agents_getById_1", "v1", Duration.ofMillis(1000));

    now.set(999);
    CacheLookup fresh = c.get("agents_getById_1");
    assertTrue(fresh.found());
    assertFalse(fresh.stale());

    now.set(1000);
    CacheLookup stale = c.get("agents_getById_1");
    assertTrue(stale.found());
    assertTrue(stale.stale());
    assertEquals("v1", stale.valueAs());

    CacheStats s = c.stats();
    assertEquals(1, s.hits());
    assertEquals(1, s.staleHits());
    assertEquals(0.5, s.staleHitRate());
  }

  @Test
  void onlyFirstStaleReaderRevalidates() {
    CacheStore c = store(10, false);
    c.set("k", "v", Duration.ofMillis(10));
    now.set(50);
    assertTrue(c.get("k").revalidate());
    assertFalse(c.get("k").revalidate());
    assertFalse(c.get("k").revalidate());
  }

  @Test
  void hotKeyStillGoesStaleAfterItsTtl() {
    CacheStore c = store(10, true);
    c.set("k", "v", Duration.ofMillis(1000));
    now.set(500);
    assertFalse(c.get("k").stale());
    now.set(999);
    assertFalse(c.get("k").stale());
    now.set(1000);
    assertTrue(c.get("k").stale());
  }

  @Test
  void leastRecentlyUsedEntryIsEvicted() {
    CacheStore c = store(2, true);
    c.set("a", 1);
    c.set("b", 2);
    c.get("a");
    c.set("c", 3);

    assertTrue(c.get("a").found());
    assertFalse(c.get("b").found());
    assertTrue(c.get("c").found());
    assertEquals(1, c.stats().evictions());
    assertEquals(2, c.stats().size());
    assertEquals(2, c.stats().maxSize());
  }

  @Test
  void withoutAgeOnGetTheOldestWriteIsEvicted() {
    CacheStore c = store(2, false);
    c.set("a", 1);
    c.set("b", 2);
    c.get("a");
    c.set("c", 3);

    assertFalse(c.get("a").found());
    assertTrue(c.get("b").found());
    assertTrue(c.get("c").found());
  }

  @Test
  void hitRateAndClearResetsCounters() {
    CacheStore c = store(10, false);
    c.set("a", 1);
    c.get("a");
    c.get("a");
    c.get("a");
    c.get("missing");
    CacheStats s = c.stats();
    assertEquals(3, s.hits());
    assertEquals(1, s.misses());
    assertEquals(1, s.sets());
    assertEquals(0.75, s.hitRate());

    c.clear();
    CacheStats cleared = c.stats();
    assertEquals(0, cleared.size());
    assertEquals(0, cleared.hits());
    assertEquals(0, cleared.misses());
    assertEquals(0.0, cleared.hitRate());
  }

  @Test
  void refreshReplacesValueAndKeepsTtl() {
    CacheStore c = store(10, false);
    c.set("k", "old", Duration.ofMillis(100));
    now.set(150);
    assertTrue(c.get("k").revalidate());

    assertEquals(Optional.of("new"), c.refresh("k", () -> "new"));
    CacheLookup after = c.get("k");
    assertFalse(after.stale());
    assertEquals("new", after.valueAs());
    assertEquals(1, c.stats().refreshes());

    now.set(250);
    assertTrue(c.get("k").stale());
  }

  @Test
  void failedRefreshKeepsStaleValueAndAllowsAnotherAttempt() {
    CacheStore c = store(10, false);
    c.set("k", "old", Duration.ofMillis(100));
    now.set(150);
    assertTrue(c.get("k").revalidate());

    Optional<Object> r = c.refresh("k", () -> { throw new IllegalStateException("origin down"); });
    assertTrue(r.isEmpty());

    CacheLookup again = c.get("k");
    assertEquals("old", again.valueAs());
    assertTrue(again.revalidate());
    assertEquals(0, c.stats().refreshes());
  }

  @Test
  void refreshWithNoValueDropsEntry() {
    CacheStore c = store(10, false);
    c.set("k", "old");
    assertTrue(c.refresh("k", () -> null).isEmpty());
    assertFalse(c.get("k").found());
  }

  @Test
  void refreshIsDroppedWhenTheEntryIsRemovedMeanwhile() {
    CacheStore c = store(10, false);
    c.set("agents_getAll_{}", List.of("a1"), Duration.ofMillis(100));
    now.set(150);
    assertTrue(c.get("agents_getAll_{}").revalidate());

    Optional<List<String>> r = c.refresh("agents_getAll_{}", () -> {
      c.removeByPrefix("agents_getAll_");
      return List.of("a1");
    });

    assertTrue(r.isEmpty());
    assertFalse(c.get("agents_getAll_{}").found());
    assertEquals(0, c.stats().refreshes());
  }

  @Test
  void refreshIsDroppedWhenTheEntryIsReplacedMeanwhile() {
    CacheStore c = store(10, false);
    c.set("k", "old", Duration.ofMillis(100));
    now.set(150);
    c.get("k");

    c.refresh("k", () -> {
      c.set("k", "written", Duration.ofMillis(100));
      return "old";
    });

    assertEquals("written", c.get("k").valueAs());
  }

  @Test
  void refreshOfAnAbsentKeyStoresNothing() {
    CacheStore c = store(10, false);
    assertTrue(c.refresh("k", () -> "v").isEmpty());
    assertEquals(0, c.size());
  }

  @Test
  void refreshCanPickTheTtlFromTheNewValue() {
    CacheStore c = store(10, false);
    c.set("k", List.of(), Duration.ofMillis(1000));
    now.set(1000);
    c.get("k");

    c.refresh("k", () -> List.of(1, 2, 3), v -> Duration.ofMillis(10L * v.size()));
    now.set(1029);
    assertFalse(c.get("k").stale());
    now.set(1030);
    assertTrue(c.get("k").stale());
  }

  @Test
  void concurrentUseKeepsSizeBoundAndCounters() throws Exception {
    CacheStore c = new CacheStore(8, Duration.ofMillis(50), true, System::currentTimeMillis);
    int threads = 8;
    int rounds = 5_000;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    AtomicLong gets = new AtomicLong();
    try {
      List<Future<?>> done = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        int seed = t;
        done.add(pool.submit(() -> {
          start.await();
          for (int i = 0; i < rounds; i++) {
            String key = "k" + ((seed * 31 + i) % 20);
            switch (i % 5) {
              case 0, 1 -> {
                c.get(key);
                gets.incrementAndGet();
              }
              case 2 -> c.set(key, i);
              case 3 -> c.remove(key);
              default -> c.removeByPrefix("k1");
            }
            assertTrue(c.size() <= 8);
          }
          return null;
        }));
      }
      start.countDown();
      for (Future<?> f : done) f.get(30, TimeUnit.SECONDS);
    } finally {
      pool.shutdownNow();
    }

    CacheStats s = c.stats();
    assertTrue(s.size() <= 8);
    assertEquals(gets.get(), s.hits() + s.misses() + s.staleHits());
    assertEquals(threads * rounds / 5, s.sets());
  }

  @Test
  void removeByPrefixOnlyTouchesMatchingKeys() {
    CacheStore c = store(10, false);
    c.set("agents_getAll_{}", List.of());
    c.set("agents_getAll_{\"filters\":[]}", List.of());
    c.set("agents_getById_1", "a");
    c.set("tools_getAll_{}", List.of());

    assertEquals(2, c.removeByPrefix("agents_getAll_"));
    assertFalse(c.get("agents_getAll_{}").found());
    assertTrue(c.get("agents_getById_1").found());
    assertTrue(c.get("tools_getAll_{}").found());
    assertTrue(c.remove("agents_getById_1"));
    assertFalse(c.remove("agents_getById_1"));
  }

  @Test
  void badWritesAreIgnoredNotThrown() {
    CacheStore c = store(10, false);
    c.set("k", null);
    c.set("k2", "v", Duration.ofMillis(-5));
    assertEquals(0, c.size());
    assertEquals(0, c.stats().sets());
  }
}
