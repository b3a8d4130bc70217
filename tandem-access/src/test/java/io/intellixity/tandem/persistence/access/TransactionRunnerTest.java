package io.intellixity.tandem.persistence.access;

import io.intellixity.tandem.persistence.error.ConnectionException;
import io.intellixity.tandem.persistence.error.TransactionException;
import io.intellixity.tandem.persistence.exec.BackendKind;
import io.intellixity.tandem.persistence.record.DataRecord;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class TransactionRunnerTest {
  private final InMemoryBackendClient db = InMemoryBackendClient.secondary();
  private final TransactionRunner runner = new TransactionRunner(db);

  @Test
  void commitsSuccessfulWork() {
    DataRecord r = runner.run(c -> c.insert("agents", DataRecord.of(Map.of("name", "a"))));
    assertEquals("S-1", r.id());
    assertEquals(1, db.calls("begin"));
    assertEquals(1, db.calls("commit"));
    assertEquals(0, db.calls("rollback"));
    assertFalse(db.inTransaction());
    assertEquals(1, db.list("agents", null).size());
  }

  @Test
  void failingWorkRollsBackAndRethrowsTheOriginalError() {
    IllegalStateException boom = new IllegalStateException("boom");
    IllegalStateException e = assertThrows(IllegalStateException.class, () -> runner.run(c -> {
      c.insert("agents", DataRecord.of(Map.of("name", "a")));
      throw boom;
    }));
    assertSame(boom, e);
    assertEquals(1, db.calls("rollback"));
    assertEquals(0, db.calls("commit"));
    assertTrue(db.list("agents", null).isEmpty());
  }

  @Test
  void rollbackFailureIsSuppressedOnTheOriginal() {
    db.failRollback = new TransactionException(BackendKind.SECONDARY, TransactionException.Phase.ROLLBACK, "gone", null);
    ConnectionException original = new ConnectionException(BackendKind.SECONDARY, "insert", "reset");
    ConnectionException e = assertThrows(ConnectionException.class, () -> runner.run(c -> {
      throw original;
    }));
    assertSame(original, e);
    assertEquals(1, e.getSuppressed().length);
    assertSame(db.failRollback, e.getSuppressed()[0]);
  }

  @Test
  void beginFailureNeverRunsWork() {
    db.failBegin = new TransactionException(BackendKind.SECONDARY, TransactionException.Phase.BEGIN, "pool exhausted", null);
    boolean[] ran = {false};
    TransactionException e = assertThrows(TransactionException.class, () -> runner.run(c -> ran[0] = true));
    assertEquals(TransactionException.Phase.BEGIN, e.phase());
    assertFalse(ran[0]);
    assertEquals(0, db.calls("rollback"));
  }

  @Test
  void commitFailureRollsBack() {
    db.failCommit = new TransactionException(BackendKind.SECONDARY, TransactionException.Phase.COMMIT, "serialization", null);
    TransactionException e = assertThrows(TransactionException.class,
        () -> runner.run(c -> c.insert("agents", DataRecord.of(Map.of("name", "a")))));
    assertEquals(TransactionException.Phase.COMMIT, e.phase());
    assertEquals(1, db.calls("rollback"));
    assertFalse(db.inTransaction());
    assertTrue(db.list("agents", null).isEmpty());
  }

  @Test
  void nestedRunJoinsTheOpenTransaction() {
    int n = runner.run(outer -> runner.run(inner -> {
      assertSame(outer, inner);
      return 7;
    }));
    assertEquals(7, n);
    assertEquals(1, db.calls("begin"));
    assertEquals(1, db.calls("commit"));
  }

  @Test
  void primaryBackendIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new TransactionRunner(InMemoryBackendClient.primary()));
  }
}
