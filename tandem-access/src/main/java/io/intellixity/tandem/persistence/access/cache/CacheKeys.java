package io.intellixity.tandem.persistence.access.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.intellixity.tandem.persistence.error.CacheException;
import io.intellixity.tandem.persistence.query.QueryOptions;

/**
 * Cache key layout per collection:\n
 * - {@code <collection>_getAll_<canonical options json>}\n
 * - {@code <collection>_getPage_<canonical options json>}\n
 * - {@code <collection>_getById_<id>}\n
 */
public final class CacheKeys {
  private CacheKeys() {}

  private static final ObjectMapper CANONICAL = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
      .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

  public static String list(String collection, QueryOptions options) {
    return listPrefix(collection) + canonical(options);
  }

  public static String page(String collection, QueryOptions options) {
    return pagePrefix(collection) + canonical(options);
  }

  public static String item(String collection, Object id) {
    return collection + "_getById_" + id;
  }

  public static String listPrefix(String collection) {
    return collection + "_getAll_";
  }

  public static String pagePrefix(String collection) {
    return collection + "_getPage_";
  }

  /**
   * Stable JSON for options: fixed field order, map entries sorted by key, java.time values as ISO-8601.\n
   *
   * @throws CacheException when a filter value has no JSON form; callers read through uncached
   */
  public static String canonical(QueryOptions options) {
    try {
      return CANONICAL.writeValueAsString(options == null ? new QueryOptions() : options);
    } catch (JsonProcessingException e) {
      throw new CacheException("key", "Query options are not serializable: " + e.getOriginalMessage(), e);
    }
  }
}
