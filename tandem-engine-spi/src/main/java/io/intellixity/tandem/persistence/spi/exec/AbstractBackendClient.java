package io.intellixity.tandem.persistence.spi.exec;

import io.intellixity.tandem.persistence.error.DataAccessException;
import io.intellixity.tandem.persistence.error.NotFoundException;
import io.intellixity.tandem.persistence.error.UnsupportedOperatorException;
import io.intellixity.tandem.persistence.error.ValidationException;
import io.intellixity.tandem.persistence.exec.BackendClient;
import io.intellixity.tandem.persistence.exec.BackendHandle;
import io.intellixity.tandem.persistence.exec.BackendKind;
import io.intellixity.tandem.persistence.exec.CallScope;
import io.intellixity.tandem.persistence.query.FilterCondition;
import io.intellixity.tandem.persistence.query.QueryOptions;
import io.intellixity.tandem.persistence.query.UnsupportedOperatorPolicy;
import io.intellixity.tandem.persistence.record.DataRecord;
import io.intellixity.tandem.persistence.spi.sql.FilterTranslator;
import io.intellixity.tandem.persistence.spi.sql.NativeStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Template-method orchestrator for backend operations.\n
 *
 * Responsibilities:\n
 * - Validate {@link QueryOptions} via {@link QueryOptionsValidator}\n
 * - Apply the unsupported-operator policy before translation\n
 * - Build native statements using {@link FilterTranslator}\n
 * - Check cancellation/deadline before touching the backend\n
 * - Map native failures to the data-access error taxonomy via {@link #translateFailure}\n
 * - Delegate execution to backend-specific hooks\n
 */
public abstract class AbstractBackendClient<S extends NativeStatement, H extends BackendHandle<?>> implements BackendClient {
  private static final Logger log = LoggerFactory.getLogger(AbstractBackendClient.class);

  private final H handle;
  private final FilterTranslator<S> translator;
  private final QueryOptionsValidator validator;

  protected AbstractBackendClient(H handle, FilterTranslator<S> translator, QueryOptionsValidator validator) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.translator = Objects.requireNonNull(translator, "translator");
    this.validator = (validator == null) ? new DefaultQueryOptionsValidator() : validator;
  }

  protected AbstractBackendClient(H handle, FilterTranslator<S> translator) {
    this(handle, translator, new DefaultQueryOptionsValidator());
  }

  @Override public final BackendKind kind() { return handle.kind(); }
  @Override public final H handle() { return handle; }
  protected final FilterTranslator<S> translator() { return translator; }

  // --- Reads ---

  @Override
  public final Optional<DataRecord> get(String collection, Object id) {
    requireCollection(collection);
    requireId(id, "get");
    return run("get", () -> executeGet(collection, id));
  }

  @Override
  public final List<DataRecord> list(String collection, QueryOptions options) {
    return run("list", () -> {
      QueryOptions effective = prepare(collection, options);
      S stmt = translator.translateList(collection, effective);
      return executeList(collection, effective, stmt);
    });
  }

  @Override
  public final long count(String collection, QueryOptions options) {
    return run("count", () -> {
      QueryOptions effective = prepare(collection, options);
      S stmt = translator.translateCount(collection, effective);
      return executeCount(collection, effective, stmt);
    });
  }

  // --- Writes ---

  @Override
  public final DataRecord insert(String collection, DataRecord record) {
    requireCollection(collection);
    Objects.requireNonNull(record, "record");
    DataRecord withId = record.hasId() ? record : record.withId(newId());
    return run("insert", () -> executeInsert(collection, withId));
  }

  @Override
  public final DataRecord update(String collection, Object id, Map<String, Object> partial) {
    requireCollection(collection);
    requireId(id, "update");
    Map<String, Object> p = (partial == null) ? Map.of() : partial;
    return run("update", () -> executeUpdate(collection, id, p)
        .orElseThrow(() -> new NotFoundException(kind(), "update", collection, id)));
  }

  @Override
  public final DataRecord upsert(String collection, DataRecord record) {
    requireCollection(collection);
    Objects.requireNonNull(record, "record");
    DataRecord withId = record.hasId() ? record : record.withId(newId());
    return run("upsert", () -> executeUpsert(collection, withId));
  }

  @Override
  public final boolean delete(String collection, Object id) {
    requireCollection(collection);
    requireId(id, "delete");
    return run("delete", () -> executeDelete(collection, id));
  }

  @Override
  public final long deleteMany(String collection, List<?> ids) {
    requireCollection(collection);
    if (ids == null || ids.isEmpty()) return 0;
    for (Object id : ids) requireId(id, "deleteMany");
    return run("deleteMany", () -> executeDeleteMany(collection, List.copyOf(ids)));
  }

  @Override
  public final List<DataRecord> rawQuery(String query, List<?> params) {
    if (query == null || query.isBlank()) {
      throw new ValidationException(kind(), "rawQuery", "query is required", null);
    }
    List<?> p = (params == null) ? List.of() : params;
    return run("rawQuery", () -> executeRawQuery(query, p));
  }

  /**
   * Run one backend operation: fail fast when the call was cancelled, pass taxonomy errors through and
   * translate everything else.\n
   */
  protected final <T> T run(String operation, Supplier<T> work) {
    CallScope.throwIfCancelled(kind(), operation);
    try {
      return work.get();
    } catch (DataAccessException e) {
      throw e;
    } catch (RuntimeException e) {
      throw translateFailure(operation, e);
    }
  }

  /** Validate options and apply the unsupported-operator policy. */
  protected final QueryOptions prepare(String collection, QueryOptions options) {
    QueryOptions effective = (options == null) ? new QueryOptions() : options;
    validator.validate(kind(), collection, effective);

    List<FilterCondition> kept = new ArrayList<>(effective.filters().size());
    for (FilterCondition c : effective.filters()) {
      if (translator.supports(c.operator())) {
        kept.add(c);
        continue;
      }
      if (effective.unsupportedOperators() == UnsupportedOperatorPolicy.ABORT) {
        throw new UnsupportedOperatorException(kind(), translator.id(), c.operator(), c.column());
      }
      log.warn("tandem.query dropped_filter backend={} collection={} column={} operator={}",
          translator.id(), collection, c.column(), c.operator().wireName());
    }
    if (kept.size() == effective.filters().size()) return effective;
    return effective.copy().withFilters(kept);
  }

  /** Id for records inserted without one. */
  protected Object newId() {
    return UUID.randomUUID().toString();
  }

  private void requireCollection(String collection) {
    DefaultQueryOptionsValidator.requireIdentifier(kind(), "collection", collection);
  }

  private void requireId(Object id, String operation) {
    if (id == null || (id instanceof String s && s.isBlank())) {
      throw new ValidationException(kind(), operation, "id is required", null);
    }
  }

  // --- Backend-specific hooks ---

  /** Map a native runtime failure to the taxonomy (connection vs operation vs validation). */
  protected abstract DataAccessException translateFailure(String operation, RuntimeException failure);

  protected abstract Optional<DataRecord> executeGet(String collection, Object id);

  protected abstract List<DataRecord> executeList(String collection, QueryOptions options, S stmt);

  protected abstract long executeCount(String collection, QueryOptions options, S stmt);

  protected abstract DataRecord executeInsert(String collection, DataRecord record);

  /** @return the updated record, or empty when no record has {@code id} */
  protected abstract Optional<DataRecord> executeUpdate(String collection, Object id, Map<String, Object> partial);

  protected abstract DataRecord executeUpsert(String collection, DataRecord record);

  protected abstract boolean executeDelete(String collection, Object id);

  protected abstract long executeDeleteMany(String collection, List<?> ids);

  protected abstract List<DataRecord> executeRawQuery(String query, List<?> params);
}
