package io.intellixity.tandem.persistence.access;

import io.intellixity.tandem.persistence.access.cache.CacheStore;
import io.intellixity.tandem.persistence.access.cache.TtlPolicy;
import io.intellixity.tandem.persistence.error.TransactionException;
import io.intellixity.tandem.persistence.spi.exec.DefaultQueryOptionsValidator;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Process-wide entry point: one set of backends, one cache, one facade per collection.\n
 *
 * Build it once at startup with {@link #builder(Backends)} and share it.\n
 */
public final class DataAccess {
  private final Backends backends;
  private final CacheStore cache;
  private final TtlPolicy ttl;
  private final FallbackCoordinator coordinator;
  private final BatchExecutor batch;
  private final TransactionRunner transactions;
  private final Executor revalidation;
  private final Map<String, DataAccessFacade> facades = new ConcurrentHashMap<>();

  private DataAccess(Builder b) {
    this.backends = b.backends;
    this.cache = (b.cache == null) ? new CacheStore() : b.cache;
    this.ttl = (b.ttl == null) ? TtlPolicy.defaults() : b.ttl;
    this.coordinator = new FallbackCoordinator(backends, b.listener, b.clock);
    this.batch = new BatchExecutor(coordinator, b.chunkSize);
    this.transactions = backends.transactional().map(TransactionRunner::new).orElse(null);
    this.revalidation = (b.revalidation == null) ? Runnable::run : b.revalidation;
  }

  public static Builder builder(Backends backends) {
    return new Builder(backends);
  }

  /** Facade for one table/collection. */
  public DataAccessFacade collection(String name) {
    DefaultQueryOptionsValidator.requireIdentifier(null, "collection", name);
    return facades.computeIfAbsent(name, n -> new DataAccessFacade(n, this));
  }

  public Backends backends() { return backends; }
  public CacheStore cache() { return cache; }
  public TtlPolicy ttl() { return ttl; }

  FallbackCoordinator coordinator() { return coordinator; }
  BatchExecutor batch() { return batch; }
  Executor revalidation() { return revalidation; }

  /**
   * Run {@code work} in a relational transaction; the cache is cleared once it commits or rolls back.\n
   *
   * Facade calls made inside {@code work} join the transaction: they run on SECONDARY without
   * fallback and bypass the cache.\n
   *
   * @throws TransactionException when no transactional SECONDARY backend is configured
   */
  public <T> T withTransaction(TransactionWork<T> work) {
    if (transactions == null) {
      throw new TransactionException(backends.defaultKind(), TransactionException.Phase.UNSUPPORTED,
          "Transactions require a transactional SECONDARY backend", null);
    }
    try {
      return transactions.run(work);
    } finally {
      cache.clear();
    }
  }

  public static final class Builder {
    private final Backends backends;
    private CacheStore cache;
    private TtlPolicy ttl;
    private int chunkSize = BatchExecutor.DEFAULT_CHUNK_SIZE;
    private FallbackListener listener;
    private Executor revalidation;
    private Clock clock;

    private Builder(Backends backends) {
      this.backends = Objects.requireNonNull(backends, "backends");
    }

    public Builder cache(CacheStore cache) { this.cache = cache; return this; }
    public Builder ttlPolicy(TtlPolicy ttl) { this.ttl = ttl; return this; }
    public Builder chunkSize(int chunkSize) { this.chunkSize = chunkSize; return this; }
    public Builder fallbackListener(FallbackListener listener) { this.listener = listener; return this; }
    /** Executor for stale-entry revalidation; defaults to running on the reading thread. */
    public Builder revalidationExecutor(Executor executor) { this.revalidation = executor; return this; }
    public Builder clock(Clock clock) { this.clock = clock; return this; }

    public DataAccess build() {
      return new DataAccess(this);
    }
  }
}
