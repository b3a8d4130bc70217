package io.intellixity.tandem.persistence.access;

import io.intellixity.tandem.persistence.error.DataAccessException;
import io.intellixity.tandem.persistence.error.OperationCancelledException;
import io.intellixity.tandem.persistence.exec.BackendClient;
import io.intellixity.tandem.persistence.exec.CallOptions;
import io.intellixity.tandem.persistence.record.DataRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Chunked batch execution.\n
 *
 * Items run sequentially chunk by chunk, each as its own fallback-coordinated operation, so one failing
 * item never hides the others. Results line up with the input order. After a cancellation the remaining
 * items are reported as cancelled without being attempted.\n
 */
public final class BatchExecutor {
  private static final Logger log = LoggerFactory.getLogger(BatchExecutor.class);

  public static final int DEFAULT_CHUNK_SIZE = 10;

  private final FallbackCoordinator coordinator;
  private final int chunkSize;

  public BatchExecutor(FallbackCoordinator coordinator, int chunkSize) {
    this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
    if (chunkSize <= 0) throw new IllegalArgumentException("chunkSize must be > 0");
    this.chunkSize = chunkSize;
  }

  public int chunkSize() {
    return chunkSize;
  }

  public <I> List<BatchItemResult> run(String operation, List<I> items, CallOptions options,
                                       BiFunction<BackendClient, I, DataRecord> work) {
    List<BatchItemResult> out = new ArrayList<>(items.size());
    OperationCancelledException cancelled = null;
    for (List<I> chunk : chunks(items)) {
      for (I item : chunk) {
        int index = out.size();
        if (cancelled != null) {
          out.add(BatchItemResult.failure(index, cancelled));
          continue;
        }
        try {
          out.add(BatchItemResult.success(index, coordinator.execute(operation, options, c -> work.apply(c, item))));
        } catch (OperationCancelledException e) {
          cancelled = e;
          out.add(BatchItemResult.failure(index, e));
        } catch (DataAccessException e) {
          log.debug("tandem.batch op={} index={} failed={}", operation, index, e.getClass().getSimpleName());
          out.add(BatchItemResult.failure(index, e));
        }
      }
    }
    if (log.isDebugEnabled()) {
      long failed = out.stream().filter(r -> !r.isSuccess()).count();
      log.debug("tandem.batch op={} items={} chunkSize={} failed={}", operation, items.size(), chunkSize, failed);
    }
    return out;
  }

  /** Delete by id a chunk at a time. @return true when every chunk succeeded */
  public boolean removeAll(String collection, List<?> ids, CallOptions options) {
    boolean ok = true;
    int chunkNo = 0;
    for (List<?> chunk : chunks(ids)) {
      chunkNo++;
      try {
        coordinator.execute("batchRemove", options, c -> c.deleteMany(collection, chunk));
      } catch (DataAccessException e) {
        ok = false;
        log.warn("tandem.batch op=batchRemove collection={} chunk={} size={} error={}",
            collection, chunkNo, chunk.size(), e.getMessage());
      }
    }
    return ok;
  }

  private <I> List<List<I>> chunks(List<I> items) {
    List<List<I>> out = new ArrayList<>();
    for (int i = 0; i < items.size(); i += chunkSize) {
      out.add(items.subList(i, Math.min(items.size(), i + chunkSize)));
    }
    return out;
  }
}
