package io.intellixity.tandem.persistence.access.cache;

import io.intellixity.tandem.persistence.error.CacheException;
import io.intellixity.tandem.persistence.query.OffsetPage;
import io.intellixity.tandem.persistence.query.QueryFilters;
import io.intellixity.tandem.persistence.query.QueryOptions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class CacheKeysTest {
  @Test
  void equivalentOptionsShareAKey() {
    Map<String, Object> a = new LinkedHashMap<>();
    a.put("x", 1);
    a.put("y", 2);
    Map<String, Object> b = new LinkedHashMap<>();
    b.put("y", 2);
    b.put("x", 1);

    QueryOptions q1 = QueryOptions.of(QueryFilters.eq("meta", a)).withPage(OffsetPage.of(1, 10));
    QueryOptions q2 = QueryOptions.of(QueryFilters.eq("meta", b)).withPage(OffsetPage.of(1, 10));
    assertEquals(CacheKeys.list("agents", q1), CacheKeys.list("agents", q2));
  }

  @Test
  void keysAreScopedByCollectionAndKind() {
    QueryOptions q = QueryOptions.of(QueryFilters.eq("status", "active"));
    assertTrue(CacheKeys.list("agents", q).startsWith(CacheKeys.listPrefix("agents")));
    assertTrue(CacheKeys.page("agents", q).startsWith(CacheKeys.pagePrefix("agents")));
    assertNotEquals(CacheKeys.list("agents", q), CacheKeys.list("tools", q));
    assertEquals("agents_getById_42", CacheKeys.item("agents", 42));
    assertEquals(CacheKeys.list("agents", new QueryOptions()), CacheKeys.list("agents", null));
  }

  @Test
  void javaTimeValuesRenderAsIsoText() {
    QueryOptions q = QueryOptions.of(QueryFilters.eq("created_at", Instant.EPOCH));
    assertTrue(CacheKeys.canonical(q).contains("\"value\":\"1970-01-01T00:00:00Z\""), CacheKeys.canonical(q));
  }

  @Test
  void valuesWithoutJsonFormFailAsCacheErrors() {
    QueryOptions q = QueryOptions.of(QueryFilters.eq("owner", new Object()));
    CacheException e = assertThrows(CacheException.class, () -> CacheKeys.list("agents", q));
    assertEquals("key", e.operation());
  }

  @Test
  void jacksonModulesComeFromOneRelease() {
    assertEquals(com.fasterxml.jackson.databind.cfg.PackageVersion.VERSION,
        com.fasterxml.jackson.core.json.PackageVersion.VERSION);
    assertEquals(com.fasterxml.jackson.databind.cfg.PackageVersion.VERSION,
        com.fasterxml.jackson.datatype.jsr310.PackageVersion.VERSION);
  }

  @Test
  void ttlPolicyShortensForBigLists() {
    TtlPolicy p = TtlPolicy.defaults();
    assertEquals(Duration.ofSeconds(60), p.forList(101));
    assertEquals(Duration.ofSeconds(180), p.forList(100));
    assertEquals(Duration.ofSeconds(180), p.forList(51));
    assertEquals(Duration.ofSeconds(300), p.forList(50));
    assertEquals(Duration.ofSeconds(600), p.forItem());
  }
}
