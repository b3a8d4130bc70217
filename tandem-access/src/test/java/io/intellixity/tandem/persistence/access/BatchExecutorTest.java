package io.intellixity.tandem.persistence.access;

import io.intellixity.tandem.persistence.error.OperationCancelledException;
import io.intellixity.tandem.persistence.error.OperationException;
import io.intellixity.tandem.persistence.exec.BackendKind;
import io.intellixity.tandem.persistence.exec.CallOptions;
import io.intellixity.tandem.persistence.exec.CancellationToken;
import io.intellixity.tandem.persistence.record.DataRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

final class BatchExecutorTest {
  private final InMemoryBackendClient primary = InMemoryBackendClient.primary();
  private final FallbackCoordinator coordinator =
      new FallbackCoordinator(Backends.resolve(primary, null, BackendKind.PRIMARY));

  private static List<DataRecord> named(int n) {
    List<DataRecord> out = new ArrayList<>();
    for (int i = 0; i < n; i++) out.add(DataRecord.of(Map.of("name", "item-" + i)));
    return out;
  }

  @Test
  void resultsFollowInputOrderWithPerItemFailures() {
    primary.poisonedNames.add("item-3");
    primary.poisonedNames.add("item-17");
    BatchExecutor b = new BatchExecutor(coordinator, 10);

    List<BatchItemResult> out = b.run("batchCreate", named(25), null, (c, r) -> c.insert("agents", r));

    assertEquals(25, out.size());
    for (int i = 0; i < 25; i++) {
      BatchItemResult r = out.get(i);
      assertEquals(i, r.index());
      if (i == 3 || i == 17) {
        assertFalse(r.isSuccess());
        assertInstanceOf(OperationException.class, r.error());
      } else {
        assertTrue(r.isSuccess());
        assertEquals("item-" + i, r.record().get("name"));
      }
    }
    assertEquals(25, primary.calls("insert"));
  }

  @Test
  void removeDeletesOneChunkAtATime() {
    BatchExecutor b = new BatchExecutor(coordinator, 10);
    List<Object> ids = IntStream.range(0, 23).mapToObj(i -> (Object) ("id-" + i)).toList();
    assertTrue(b.removeAll("agents", ids, null));
    assertEquals(3, primary.calls("deleteMany"));
  }

  @Test
  void removeReportsFalseWhenAnyChunkFailsButTriesTheRest() {
    int[] n = {0};
    primary.failures.put("deleteMany", op -> ++n[0] == 2 ? new OperationException(BackendKind.PRIMARY, op, "locked") : null);
    BatchExecutor b = new BatchExecutor(coordinator, 2);
    assertFalse(b.removeAll("agents", List.of("a", "b", "c", "d", "e"), null));
    assertEquals(3, primary.calls("deleteMany"));
  }

  @Test
  void cancellationStopsRemainingItems() {
    CancellationToken token = new CancellationToken();
    BatchExecutor b = new BatchExecutor(coordinator, 10);
    List<BatchItemResult> out = b.run("batchCreate", named(5), CallOptions.defaults().withCancellation(token), (c, r) -> {
      DataRecord stored = c.insert("agents", r);
      if ("item-1".equals(r.get("name"))) token.cancel();
      return stored;
    });

    assertTrue(out.get(0).isSuccess());
    assertTrue(out.get(1).isSuccess());
    for (int i = 2; i < 5; i++) assertInstanceOf(OperationCancelledException.class, out.get(i).error());
    assertEquals(2, primary.list("agents", null).size());
  }

  @Test
  void chunkSizeMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new BatchExecutor(coordinator, 0));
  }
}
