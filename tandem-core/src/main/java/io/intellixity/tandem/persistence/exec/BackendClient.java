package io.intellixity.tandem.persistence.exec;

import io.intellixity.tandem.persistence.query.QueryOptions;
import io.intellixity.tandem.persistence.record.DataRecord;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * CRUD/query contract shared by both backends.\n
 *
 * All failures surface as {@link io.intellixity.tandem.persistence.error.DataAccessException} subtypes.
 * Timeouts and cancellation are read from {@link CallScope}.\n
 */
public interface BackendClient {
  BackendKind kind();

  BackendHandle<?> handle();

  Optional<DataRecord> get(String collection, Object id);

  List<DataRecord> list(String collection, QueryOptions options);

  long count(String collection, QueryOptions options);

  /** Insert; an id is generated when the record has none. Returns the stored record. */
  DataRecord insert(String collection, DataRecord record);

  /** Apply {@code partial} to the record with {@code id}; throws NotFoundException when absent. */
  DataRecord update(String collection, Object id, Map<String, Object> partial);

  /** Insert or replace by id. */
  DataRecord upsert(String collection, DataRecord record);

  /** @return true when a record was deleted */
  boolean delete(String collection, Object id);

  /** @return number of deleted records */
  long deleteMany(String collection, List<?> ids);

  /** Backend-native query (SQL with positional params, or a JSON database command). */
  List<DataRecord> rawQuery(String query, List<?> params);
}
