package io.intellixity.tandem.persistence.access;

import io.intellixity.tandem.persistence.error.DataAccessException;
import io.intellixity.tandem.persistence.error.OperationCancelledException;
import io.intellixity.tandem.persistence.error.OperationException;
import io.intellixity.tandem.persistence.exec.BackendClient;
import io.intellixity.tandem.persistence.exec.BackendKind;
import io.intellixity.tandem.persistence.exec.CallOptions;
import io.intellixity.tandem.persistence.exec.CallScope;
import io.intellixity.tandem.persistence.exec.TransactionalBackendClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Runs an operation on the preferred backend and, on a recoverable failure, exactly once on the other.\n
 *
 * Rules:\n
 * - Only {@link DataAccessException#isRecoverable()} failures fall back (connection-level)\n
 * - No fallback once the call is cancelled or past its deadline\n
 * - No fallback when the other backend is not configured (the original error propagates)\n
 * - When both attempts fail, the fallback error propagates with the first one suppressed\n
 * - Runtime failures outside the taxonomy are wrapped into {@link OperationException}\n
 * - While this thread has a relational transaction open, calls go to SECONDARY (unless overridden)
 *   and never fall back, so no write escapes the transaction\n
 */
public final class FallbackCoordinator {
  private static final Logger log = LoggerFactory.getLogger(FallbackCoordinator.class);

  private final Backends backends;
  private final FallbackListener listener;
  private final Clock clock;

  public FallbackCoordinator(Backends backends, FallbackListener listener, Clock clock) {
    this.backends = Objects.requireNonNull(backends, "backends");
    this.listener = (listener == null) ? FallbackListener.logging() : listener;
    this.clock = (clock == null) ? Clock.systemUTC() : clock;
  }

  public FallbackCoordinator(Backends backends) {
    this(backends, null, null);
  }

  public Backends backends() {
    return backends;
  }

  public BackendKind preferred(CallOptions options) {
    if (options != null && options.backend() != null) return options.backend();
    return inTransaction() ? BackendKind.SECONDARY : backends.defaultKind();
  }

  /** True when the calling thread has a transaction open on the SECONDARY client. */
  public boolean inTransaction() {
    return backends.transactional().map(TransactionalBackendClient::inTransaction).orElse(false);
  }

  public <T> T execute(String operation, CallOptions options, Function<BackendClient, T> work) {
    Objects.requireNonNull(work, "work");
    CallOptions call = (options == null) ? CallOptions.defaults() : options;
    BackendKind first = preferred(call);
    if (inTransaction()) {
      return CallScope.with(call, () -> attempt(operation, first, work));
    }

    return CallScope.with(call, () -> {
      try {
        return attempt(operation, first, work);
      } catch (DataAccessException e) {
        if (!e.isRecoverable()) throw e;
        if (CallScope.isCancelled() || CallScope.isExpired()) {
          OperationCancelledException cancelled = new OperationCancelledException(first, operation,
              "Fallback skipped: call cancelled or deadline exceeded", e);
          throw cancelled;
        }
        BackendKind second = first.other();
        Optional<BackendClient> fallback = backends.find(second);
        if (fallback.isEmpty()) throw e;

        listener.onFallback(new FallbackEvent(operation, first, second,
            e.getClass().getSimpleName(), e.getMessage(), clock.instant()));
        try {
          return attempt(operation, second, work);
        } catch (DataAccessException e2) {
          e2.addSuppressed(e);
          throw e2;
        }
      }
    });
  }

  /** Run on the preferred backend only (backend-native operations such as raw queries). */
  public <T> T executePinned(String operation, CallOptions options, Function<BackendClient, T> work) {
    Objects.requireNonNull(work, "work");
    CallOptions call = (options == null) ? CallOptions.defaults() : options;
    BackendKind kind = preferred(call);
    return CallScope.with(call, () -> attempt(operation, kind, work));
  }

  private <T> T attempt(String operation, BackendKind kind, Function<BackendClient, T> work) {
    BackendClient client = backends.client(kind);
    try {
      return work.apply(client);
    } catch (DataAccessException e) {
      throw e;
    } catch (RuntimeException e) {
      log.debug("tandem.fallback op={} backend={} unclassified={}", operation, kind, e.getClass().getName());
      throw new OperationException(kind, operation, "Unexpected failure: " + e.getMessage(), e);
    }
  }
}
