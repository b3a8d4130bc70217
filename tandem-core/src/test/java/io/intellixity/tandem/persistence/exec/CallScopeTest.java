package io.intellixity.tandem.persistence.exec;

import io.intellixity.tandem.persistence.error.OperationCancelledException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class CallScopeTest {

  @Test
  void unboundScopeHasDefaults() {
    assertNull(CallScope.currentOrNull());
    assertNull(CallScope.remaining());
    assertFalse(CallScope.isCancelled());
    assertEquals(0, CallScope.remainingSecondsOrZero());
  }

  @Test
  void cancellationIsVisibleInsideScope_andScopeIsClearedAfter() {
    CancellationToken token = new CancellationToken();
    CallScope.with(CallOptions.defaults().withCancellation(token), () -> {
      assertFalse(CallScope.isCancelled());
      token.cancel();
      assertTrue(CallScope.isCancelled());
      assertThrows(OperationCancelledException.class, () -> CallScope.throwIfCancelled(BackendKind.PRIMARY, "get"));
      return null;
    });
    assertNull(CallScope.currentOrNull());
  }

  @Test
  void nestedScopeKeepsTighterDeadline() {
    CallScope.with(CallOptions.defaults().withTimeout(Duration.ofSeconds(2)), () ->
        CallScope.with(CallOptions.on(BackendKind.SECONDARY).withTimeout(Duration.ofMinutes(5)), () -> {
          assertEquals(BackendKind.SECONDARY, CallScope.options().backend());
          assertTrue(CallScope.remaining().compareTo(Duration.ofSeconds(2)) <= 0);
          assertTrue(CallScope.remainingSecondsOrZero() >= 1);
          return null;
        }));
  }

  @Test
  void sharedNoneTokenCannotBeCancelled() {
    assertThrows(IllegalStateException.class, () -> CancellationToken.none().cancel());
  }
}
