package io.intellixity.tandem.persistence.spi.exec;

import io.intellixity.tandem.persistence.error.*;
import io.intellixity.tandem.persistence.exec.*;
import io.intellixity.tandem.persistence.query.*;
import io.intellixity.tandem.persistence.record.DataRecord;
import io.intellixity.tandem.persistence.spi.sql.FilterTranslator;
import io.intellixity.tandem.persistence.spi.sql.NativeStatement;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class AbstractBackendClientTest {

  private record Stmt(QueryOptions options) implements NativeStatement {}

  private record Handle() implements BackendHandle<Object> {
    @Override public String id() { return "fake"; }
    @Override public Object client() { return new Object(); }
    @Override public String namespace() { return "ns"; }
    @Override public BackendKind kind() { return BackendKind.PRIMARY; }
  }

  /** Supports everything except text search and range operators. */
  private static final class NoTextSearchTranslator implements FilterTranslator<Stmt> {
    @Override public String id() { return "fake"; }
    @Override public boolean supports(Operator op) { return op != Operator.TEXT_SEARCH && !op.isRange(); }
    @Override public Stmt translateList(String collection, QueryOptions options) { return new Stmt(options); }
    @Override public Stmt translateCount(String collection, QueryOptions options) { return new Stmt(options); }
  }

  private static final class CapturingClient extends AbstractBackendClient<Stmt, Handle> {
    Stmt lastStmt;
    DataRecord lastInserted;
    final AtomicInteger executions = new AtomicInteger();
    RuntimeException failWith;

    CapturingClient() {
      super(new Handle(), new NoTextSearchTranslator());
    }

    private void touch() {
      executions.incrementAndGet();
      if (failWith != null) throw failWith;
    }

    @Override
    protected DataAccessException translateFailure(String operation, RuntimeException failure) {
      return new ConnectionException(kind(), operation, "translated: " + failure.getMessage(), failure);
    }

    @Override protected Optional<DataRecord> executeGet(String collection, Object id) { touch(); return Optional.empty(); }
    @Override protected List<DataRecord> executeList(String collection, QueryOptions options, Stmt stmt) { touch(); lastStmt = stmt; return List.of(); }
    @Override protected long executeCount(String collection, QueryOptions options, Stmt stmt) { touch(); lastStmt = stmt; return 0; }
    @Override protected DataRecord executeInsert(String collection, DataRecord record) { touch(); lastInserted = record; return record; }
    @Override protected Optional<DataRecord> executeUpdate(String collection, Object id, Map<String, Object> partial) { touch(); return Optional.empty(); }
    @Override protected DataRecord executeUpsert(String collection, DataRecord record) { touch(); return record; }
    @Override protected boolean executeDelete(String collection, Object id) { touch(); return true; }
    @Override protected long executeDeleteMany(String collection, List<?> ids) { touch(); return ids.size(); }
    @Override protected List<DataRecord> executeRawQuery(String query, List<?> params) { touch(); return List.of(); }
  }

  @Test
  void unsupportedOperatorAbortsByDefault_withoutTouchingBackend() {
    CapturingClient c = new CapturingClient();
    UnsupportedOperatorException e = assertThrows(UnsupportedOperatorException.class,
        () -> c.list("agents", QueryOptions.of(QueryFilters.textSearch("name", "gpt"))));
    assertEquals(Operator.TEXT_SEARCH, e.operator());
    assertEquals("fake", e.backendId());
    assertFalse(e.isRecoverable());
    assertEquals(0, c.executions.get());
  }

  @Test
  void dropPolicyRemovesOnlyUnsupportedConditions() {
    CapturingClient c = new CapturingClient();
    QueryOptions q = QueryOptions.of(QueryFilters.eq("status", "active"), QueryFilters.rangeGt("window", "[1,5)"))
        .withUnsupportedOperators(UnsupportedOperatorPolicy.DROP);
    c.list("agents", q);
    assertEquals(List.of(QueryFilters.eq("status", "active")), c.lastStmt.options().filters());
    // caller's options untouched
    assertEquals(2, q.filters().size());
  }

  @Test
  void invalidValueShapeIsValidationError() {
    CapturingClient c = new CapturingClient();
    assertThrows(ValidationException.class, () -> c.count("agents", QueryOptions.of(FilterCondition.of("id", Operator.IN, "not-a-list"))));
    assertThrows(ValidationException.class, () -> c.list("agents", QueryOptions.of(FilterCondition.of("flag", Operator.IS, "yes"))));
    assertThrows(ValidationException.class, () -> c.list("agents; drop table x", null));
  }

  @Test
  void insertGeneratesIdWhenMissing() {
    CapturingClient c = new CapturingClient();
    DataRecord stored = c.insert("agents", DataRecord.of(Map.of("name", "a")));
    assertNotNull(stored.id());
    assertEquals(stored, c.lastInserted);
  }

  @Test
  void updateOfMissingRecordIsNotFound() {
    CapturingClient c = new CapturingClient();
    NotFoundException e = assertThrows(NotFoundException.class, () -> c.update("agents", "x", Map.of("a", 1)));
    assertEquals("x", e.id());
  }

  @Test
  void nativeRuntimeFailuresAreTranslated() {
    CapturingClient c = new CapturingClient();
    c.failWith = new IllegalStateException("socket closed");
    ConnectionException e = assertThrows(ConnectionException.class, () -> c.get("agents", "1"));
    assertEquals("get", e.operation());
    assertTrue(e.isRecoverable());
  }

  @Test
  void cancelledScopeFailsBeforeBackendIsTouched() {
    CapturingClient c = new CapturingClient();
    CancellationToken token = new CancellationToken();
    token.cancel();
    assertThrows(OperationCancelledException.class,
        () -> CallScope.with(CallOptions.defaults().withCancellation(token), () -> c.delete("agents", "1")));
    assertEquals(0, c.executions.get());
  }

  @Test
  void deleteManyWithNoIdsIsNoop() {
    CapturingClient c = new CapturingClient();
    assertEquals(0, c.deleteMany("agents", List.of()));
    assertEquals(0, c.executions.get());
  }
}
