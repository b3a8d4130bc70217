package io.intellixity.tandem.persistence.exec;

import java.util.concurrent.atomic.AtomicBoolean;

/** Caller-owned cancellation flag, checked between backend attempts. */
public final class CancellationToken {
  private static final CancellationToken NONE = new CancellationToken();

  private final AtomicBoolean cancelled = new AtomicBoolean();

  public static CancellationToken none() { return NONE; }

  public void cancel() {
    if (this == NONE) throw new IllegalStateException("The shared none() token cannot be cancelled");
    cancelled.set(true);
  }

  public boolean isCancelled() { return cancelled.get(); }
}
