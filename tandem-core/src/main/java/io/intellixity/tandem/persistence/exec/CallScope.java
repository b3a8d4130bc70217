package io.intellixity.tandem.persistence.exec;

import io.intellixity.tandem.persistence.error.OperationCancelledException;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Thread-bound call context: deadline and cancellation for the operation running on this thread.\n
 *
 * Backend clients read it to apply statement timeouts; the fallback coordinator reads it to decide
 * whether a second attempt is still allowed.\n
 */
public final class CallScope {
  private CallScope() {}

  private static final ThreadLocal<Context> CTX = new ThreadLocal<>();

  public record Context(CallOptions options, long deadlineNanos) {
    public boolean hasDeadline() { return deadlineNanos != Long.MAX_VALUE; }
  }

  /** Execute work with the given options bound; nested calls keep the tighter deadline. */
  public static <T> T with(CallOptions options, Supplier<T> work) {
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(work, "work");
    Context outer = CTX.get();
    long deadline = (options.timeout() == null) ? Long.MAX_VALUE : System.nanoTime() + options.timeout().toNanos();
    if (outer != null && outer.deadlineNanos() - deadline < 0) deadline = outer.deadlineNanos();
    CTX.set(new Context(options, deadline));
    try {
      return work.get();
    } finally {
      if (outer == null) CTX.remove();
      else CTX.set(outer);
    }
  }

  public static Context currentOrNull() {
    return CTX.get();
  }

  public static CallOptions options() {
    Context c = CTX.get();
    return c == null ? CallOptions.defaults() : c.options();
  }

  /** Remaining time until the deadline, or null when the call has none. Never negative. */
  public static Duration remaining() {
    Context c = CTX.get();
    if (c == null || !c.hasDeadline()) return null;
    long left = c.deadlineNanos() - System.nanoTime();
    return Duration.ofNanos(Math.max(0, left));
  }

  public static boolean isCancelled() {
    Context c = CTX.get();
    return c != null && c.options().cancellation().isCancelled();
  }

  public static boolean isExpired() {
    Context c = CTX.get();
    return c != null && c.hasDeadline() && c.deadlineNanos() - System.nanoTime() <= 0;
  }

  public static void throwIfCancelled(BackendKind backend, String operation) {
    if (isCancelled()) throw new OperationCancelledException(backend, operation, "Operation cancelled by caller");
    if (isExpired()) throw new OperationCancelledException(backend, operation, "Operation deadline exceeded");
  }

  /** Remaining time in whole seconds for APIs that take seconds (at least 1), or 0 for no limit. */
  public static int remainingSecondsOrZero() {
    Duration d = remaining();
    if (d == null) return 0;
    long ms = d.toMillis();
    return (int) Math.max(1, (ms + 999) / 1000);
  }
}
