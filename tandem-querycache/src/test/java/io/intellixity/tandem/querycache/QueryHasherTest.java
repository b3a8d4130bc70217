package io.intellixity.tandem.querycache;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class QueryHasherTest {
  @Test
  void idIsHexSha256() {
    String id = QueryHasher.id("{ ping }", null);
    assertEquals(64, id.length());
    assertTrue(id.matches("[0-9a-f]+"));
    assertEquals(id, QueryHasher.id("{ ping }", Map.of()));
  }

  @Test
  void variableOrderDoesNotMatter() {
    Map<String, Object> ab = new LinkedHashMap<>();
    ab.put("a", 1);
    ab.put("b", Map.of("y", 2, "x", 1));
    Map<String, Object> ba = new LinkedHashMap<>();
    ba.put("b", Map.of("x", 1, "y", 2));
    ba.put("a", 1);
    assertEquals(QueryHasher.id("q", ab), QueryHasher.id("q", ba));
    assertNotEquals(QueryHasher.id("q", ab), QueryHasher.id("q2", ab));
  }
}
