package io.intellixity.tandem.persistence.access.cache;

/**
 * Result of {@link CacheStore#get(String)}.\n
 *
 * {@code revalidate} is true for exactly one reader per stale period: that reader schedules the refresh.\n
 */
public record CacheLookup(Object value, boolean found, boolean stale, boolean revalidate) {
  private static final CacheLookup MISS = new CacheLookup(null, false, false, false);

  public static CacheLookup miss() { return MISS; }

  static CacheLookup fresh(Object value) { return new CacheLookup(value, true, false, false); }

  static CacheLookup stale(Object value, boolean revalidate) { return new CacheLookup(value, true, true, revalidate); }

  @SuppressWarnings("unchecked")
  public <T> T valueAs() {
    return (T) value;
  }
}
