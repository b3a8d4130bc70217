package io.intellixity.tandem.querycache;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class GraphQlHttpOriginTest {
  @Test
  void dataObjectIsReturned() {
    Map<String, Object> data = GraphQlHttpOrigin.parse(200, "{\"data\":{\"agents\":[{\"id\":\"a1\"}]}}");
    assertTrue(data.containsKey("agents"));
  }

  @Test
  void graphQlErrorsFailTheCall() {
    QueryOriginException e = assertThrows(QueryOriginException.class,
        () -> GraphQlHttpOrigin.parse(200, "{\"data\":null,\"errors\":[{\"message\":\"Unknown field\"}]}"));
    assertEquals("GraphQL errors: Unknown field", e.getMessage());
    assertEquals(200, e.status());
  }

  @Test
  void httpErrorsAndGarbageFailTheCall() {
    assertEquals(502, assertThrows(QueryOriginException.class,
        () -> GraphQlHttpOrigin.parse(502, "{}")).status());
    assertThrows(QueryOriginException.class, () -> GraphQlHttpOrigin.parse(200, "<html>"));
  }

  @Test
  void requestBodyCarriesQueryAndVariables() {
    assertEquals("{\"query\":\"{ ping }\",\"variables\":{}}", GraphQlHttpOrigin.requestBody("{ ping }", null));
  }
}
