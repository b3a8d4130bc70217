package io.intellixity.tandem.persistence.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class QueryOptionsJsonTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void writesCanonicalFieldOrder_andWireOperatorNames() throws Exception {
    QueryOptions q = new QueryOptions()
        .orderBy("createdAt", false)
        .withPage(OffsetPage.of(2, 20))
        .withFilter(QueryFilters.containedBy("tags", List.of("a", "b")))
        .withFilter(QueryFilters.eq("status", "active"));

    String s = JSON.writeValueAsString(q);

    assertEquals(
        "{\"filters\":[{\"column\":\"tags\",\"operator\":\"containedBy\",\"value\":[\"a\",\"b\"]},"
            + "{\"column\":\"status\",\"operator\":\"eq\",\"value\":\"active\"}],"
            + "\"page\":{\"type\":\"offset\",\"offset\":20,\"limit\":20},"
            + "\"sort\":[{\"column\":\"createdAt\",\"dir\":\"DESC\"}]}",
        s);
  }

  @Test
  void emptyOptionsSerializeToEmptyObject() throws Exception {
    assertEquals("{}", JSON.writeValueAsString(new QueryOptions()));
  }

  @Test
  void equalOptionsBuiltInDifferentCallOrderProduceSameText() throws Exception {
    QueryOptions a = new QueryOptions().withCount(true).withSelect(List.of("id", "name")).withFilter(QueryFilters.gt("n", 1));
    QueryOptions b = new QueryOptions().withFilter(QueryFilters.gt("n", 1)).withSelect(List.of("id", "name")).withCount(true);
    assertEquals(JSON.writeValueAsString(a), JSON.writeValueAsString(b));
    assertEquals(a, b);
  }

  @Test
  void cursorPageAndDropPolicyAreIncluded() throws Exception {
    QueryOptions q = new QueryOptions()
        .withPage(CursorPage.first(5).after("r-9"))
        .withUnsupportedOperators(UnsupportedOperatorPolicy.DROP);
    String s = JSON.writeValueAsString(q);
    assertTrue(s.contains("\"page\":{\"type\":\"cursor\",\"cursor\":\"r-9\",\"limit\":5}"), s);
    assertTrue(s.contains("\"unsupportedOperators\":\"DROP\""), s);
  }
}
