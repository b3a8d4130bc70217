package io.intellixity.tandem.persistence.jdbc.postgres;

import io.intellixity.tandem.persistence.error.ValidationException;
import io.intellixity.tandem.persistence.jdbc.Bind;
import io.intellixity.tandem.persistence.jdbc.SqlStatement;
import io.intellixity.tandem.persistence.query.*;
import io.intellixity.tandem.persistence.record.DataRecord;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class PostgresDialectTest {
  private final PostgresDialect d = new PostgresDialect();

  private static List<Object> values(SqlStatement ss) {
    return ss.binds().stream().map(Bind::value).toList();
  }

  @Test
  void supportsEveryOperator() {
    for (Operator op : Operator.values()) assertTrue(d.supports(op), op.name());
  }

  @Test
  void filtersAreAndCombined_withOffsetPaging() {
    QueryOptions q = QueryOptions.of(QueryFilters.eq("status", "active"), QueryFilters.gte("version", 2))
        .orderBy("created_at", false)
        .withPage(OffsetPage.of(3, 20));
    SqlStatement ss = d.translateList("agents", q);
    assertEquals("SELECT * FROM \"agents\" WHERE \"status\" = :b1 AND \"version\" >= :b2"
        + " ORDER BY \"created_at\" DESC LIMIT 20 OFFSET 40", ss.sql());
    assertEquals(List.of("active", 2), values(ss));
    assertEquals(SqlStatement.ExecKind.QUERY, ss.execKind());
  }

  @Test
  void nullEqualityAndIsRenderWithoutBinds() {
    QueryOptions q = QueryOptions.of(QueryFilters.eq("deleted_at", null), QueryFilters.is("enabled", true),
        FilterCondition.of("owner", Operator.NEQ, null));
    SqlStatement ss = d.translateList("tools", q);
    assertEquals("SELECT * FROM \"tools\" WHERE \"deleted_at\" IS NULL AND \"enabled\" IS TRUE"
        + " AND \"owner\" IS NOT NULL", ss.sql());
    assertTrue(ss.binds().isEmpty());
  }

  @Test
  void emptyInListMatchesNothing() {
    SqlStatement ss = d.translateList("models", QueryOptions.of(QueryFilters.in("id", List.of())));
    assertEquals("SELECT * FROM \"models\" WHERE FALSE", ss.sql());
  }

  @Test
  void arrayOperatorsBindOneArrayParam() {
    QueryOptions q = QueryOptions.of(
        QueryFilters.contains("tags", List.of("nlp", "vision")),
        QueryFilters.containedBy("tags", List.of("nlp")),
        QueryFilters.overlaps("tags", List.of("audio")));
    SqlStatement ss = d.translateList("agents", q);
    assertEquals("SELECT * FROM \"agents\" WHERE \"tags\" @> :b1 AND \"tags\" <@ :b2 AND \"tags\" && :b3", ss.sql());
    assertTrue(ss.binds().stream().allMatch(b -> b.kind() == Bind.Kind.ARRAY));
    assertEquals(List.of("nlp", "vision"), ss.binds().get(0).value());
  }

  @Test
  void textSearchIlikeAndRanges() {
    QueryOptions q = QueryOptions.of(
        QueryFilters.ilike("name", "%gpt%"),
        QueryFilters.textSearch("description", "fast reasoning"),
        QueryFilters.rangeAdjacent("active_window", "[2024-01-01,2024-02-01)"),
        QueryFilters.rangeGt("active_window", "[2023-01-01,2023-06-01)"));
    SqlStatement ss = d.translateList("models", q);
    assertEquals("SELECT * FROM \"models\" WHERE \"name\" ILIKE :b1"
        + " AND to_tsvector(\"description\") @@ websearch_to_tsquery(:b2)"
        + " AND \"active_window\" -|- :b3 AND \"active_window\" >> :b4", ss.sql());
    assertEquals(Bind.Kind.OTHER, ss.binds().get(2).kind());
  }

  @Test
  void cursorPageAddsKeysetPredicateAndIdOrder() {
    QueryOptions q = new QueryOptions().orderBy("id", true).withPage(CursorPage.first(10).after("a-42"));
    SqlStatement ss = d.translateList("agents", q);
    assertEquals("SELECT * FROM \"agents\" WHERE \"id\" > :b1 ORDER BY \"id\" ASC LIMIT 10", ss.sql());
    assertEquals(List.of("a-42"), values(ss));
  }

  @Test
  void cursorPageRejectsOrderingOtherThanIdAscending() {
    QueryOptions byName = new QueryOptions().orderBy("name", true).withPage(CursorPage.first(10).after("a-42"));
    ValidationException e = assertThrows(ValidationException.class, () -> d.translateList("agents", byName));
    assertTrue(e.getMessage().contains("'name'"), e.getMessage());

    QueryOptions idDesc = new QueryOptions().orderBy("id", false).withPage(CursorPage.first(10));
    assertThrows(ValidationException.class, () -> d.translateList("agents", idDesc));

    QueryOptions offset = new QueryOptions().orderBy("name", true).withPage(OffsetPage.of(2, 10));
    assertTrue(d.translateList("agents", offset).sql().contains("ORDER BY \"name\" ASC"));
  }

  @Test
  void includeRendersLeftJoinWithQualifiedColumns() {
    QueryOptions q = new QueryOptions()
        .withSelect(List.of("id", "name"))
        .include(Include.of("models", "model_id", "name", "provider"))
        .where("models.provider", Operator.EQ, "acme");
    SqlStatement ss = d.translateList("agents", q);
    assertEquals("SELECT \"agents\".\"id\", \"agents\".\"name\", \"models\".\"name\" AS \"models.name\","
        + " \"models\".\"provider\" AS \"models.provider\""
        + " FROM \"agents\" LEFT JOIN \"models\" ON \"models\".\"id\" = \"agents\".\"model_id\""
        + " WHERE \"models\".\"provider\" = :b1", ss.sql());
  }

  @Test
  void includeWithoutFieldsIsRejected() {
    QueryOptions q = new QueryOptions().include(Include.of("models", "model_id"));
    assertThrows(ValidationException.class, () -> d.translateList("agents", q));
  }

  @Test
  void countWrapsFilteredSelect() {
    QueryOptions q = QueryOptions.of(QueryFilters.eq("status", "active")).withPage(OffsetPage.of(2, 5)).orderBy("name", true);
    SqlStatement ss = d.translateCount("agents", q);
    assertEquals("SELECT COUNT(1) FROM (SELECT 1 FROM \"agents\" WHERE \"status\" = :b1) tandem_count", ss.sql());
  }

  @Test
  void insertAndUpdateReturnTheRow() {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("id", "t1");
    fields.put("name", "search");
    fields.put("config", Map.of("depth", 2));
    SqlStatement ins = d.renderInsert("tools", DataRecord.of(fields));
    assertEquals("INSERT INTO \"tools\" (\"id\", \"name\", \"config\") VALUES (:b1, :b2, :b3) RETURNING *", ins.sql());
    assertEquals(Bind.Kind.JSON, ins.binds().get(2).kind());
    assertEquals(SqlStatement.ExecKind.QUERY, ins.execKind());

    SqlStatement upd = d.renderUpdate("tools", "t1", Map.of("name", "web-search"));
    assertEquals("UPDATE \"tools\" SET \"name\" = :b1 WHERE \"id\" = :b2 RETURNING *", upd.sql());
    assertEquals(List.of("web-search", "t1"), values(upd));
  }

  @Test
  void emptyUpdateFallsBackToLookup() {
    SqlStatement upd = d.renderUpdate("tools", "t1", Map.of("id", "ignored"));
    assertEquals("SELECT * FROM \"tools\" WHERE \"id\" = :b1", upd.sql());
  }

  @Test
  void upsertUpdatesNonIdColumnsOnConflict() {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("id", "q1");
    fields.put("response", Map.of("data", 1));
    SqlStatement ss = d.renderUpsert("gql_cache", DataRecord.of(fields));
    assertEquals("INSERT INTO \"gql_cache\" (\"id\", \"response\") VALUES (:b1, :b2)"
        + " ON CONFLICT (\"id\") DO UPDATE SET \"response\" = EXCLUDED.\"response\" RETURNING *", ss.sql());
  }

  @Test
  void deleteManyUsesInList() {
    SqlStatement ss = d.renderDeleteMany("agents", List.of("a", "b"));
    assertEquals("DELETE FROM \"agents\" WHERE \"id\" IN (:b1, :b2)", ss.sql());
    assertEquals(SqlStatement.ExecKind.UPDATE, ss.execKind());
  }

  @Test
  void identifiersAreQuoted() {
    SqlStatement ss = d.renderGet("we\"ird", 1);
    assertEquals("SELECT * FROM \"we\"\"ird\" WHERE \"id\" = :b1", ss.sql());
  }
}
