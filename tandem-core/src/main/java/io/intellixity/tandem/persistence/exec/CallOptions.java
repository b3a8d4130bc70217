package io.intellixity.tandem.persistence.exec;

import java.time.Duration;

/**
 * Per-call overrides.\n
 *
 * @param backend preferred backend for this call; null means the process default
 * @param timeout upper bound for the whole call including fallback; null means none
 * @param cancellation caller-owned cancellation flag
 */
public record CallOptions(BackendKind backend, Duration timeout, CancellationToken cancellation) {
  private static final CallOptions DEFAULTS = new CallOptions(null, null, CancellationToken.none());

  public CallOptions {
    if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
      throw new IllegalArgumentException("timeout must be > 0");
    }
    cancellation = (cancellation == null) ? CancellationToken.none() : cancellation;
  }

  public static CallOptions defaults() { return DEFAULTS; }

  public static CallOptions on(BackendKind backend) { return new CallOptions(backend, null, null); }

  public CallOptions withBackend(BackendKind backend) { return new CallOptions(backend, timeout, cancellation); }
  public CallOptions withTimeout(Duration timeout) { return new CallOptions(backend, timeout, cancellation); }
  public CallOptions withCancellation(CancellationToken token) { return new CallOptions(backend, timeout, token); }
}
