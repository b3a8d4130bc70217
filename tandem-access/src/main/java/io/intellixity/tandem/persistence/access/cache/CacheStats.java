package io.intellixity.tandem.persistence.access.cache;

/**
 * Point-in-time cache counters.\n
 *
 * {@code hitRate = hits / (hits + misses)}; {@code staleHitRate = staleHits / (hits + staleHits)}; both 0 when undefined.\n
 */
public record CacheStats(long hits, long misses, long staleHits, long sets, long evictions, long refreshes,
                         int size, int maxSize, double hitRate, double staleHitRate) {

  static CacheStats of(long hits, long misses, long staleHits, long sets, long evictions, long refreshes,
                       int size, int maxSize) {
    return new CacheStats(hits, misses, staleHits, sets, evictions, refreshes, size, maxSize,
        ratio(hits, hits + misses), ratio(staleHits, hits + staleHits));
  }

  private static double ratio(long part, long total) {
    return total == 0 ? 0.0 : (double) part / total;
  }
}
