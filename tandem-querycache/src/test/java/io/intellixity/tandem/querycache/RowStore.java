package io.intellixity.tandem.querycache;

import io.intellixity.tandem.persistence.error.ConnectionException;
import io.intellixity.tandem.persistence.exec.BackendClient;
import io.intellixity.tandem.persistence.exec.BackendHandle;
import io.intellixity.tandem.persistence.exec.BackendKind;
import io.intellixity.tandem.persistence.query.QueryOptions;
import io.intellixity.tandem.persistence.record.DataRecord;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Relational-store stand-in holding rows by table and id; only get and upsert are used. */
final class RowStore implements BackendClient {
  final Map<String, Map<Object, DataRecord>> tables = new HashMap<>();
  boolean failReads;
  boolean failWrites;
  int upserts;

  Map<Object, DataRecord> table(String name) {
    return tables.computeIfAbsent(name, k -> new HashMap<>());
  }

  @Override public BackendKind kind() { return BackendKind.SECONDARY; }

  @Override
  public BackendHandle<?> handle() {
    return new BackendHandle<>() {
      @Override public String id() { return "rows"; }
      @Override public Object client() { return tables; }
      @Override public String namespace() { return "public"; }
      @Override public BackendKind kind() { return BackendKind.SECONDARY; }
    };
  }

  @Override
  public Optional<DataRecord> get(String collection, Object id) {
    if (failReads) throw new ConnectionException(BackendKind.SECONDARY, "get", "connection refused");
    return Optional.ofNullable(table(collection).get(id));
  }

  @Override
  public DataRecord upsert(String collection, DataRecord record) {
    if (failWrites) throw new ConnectionException(BackendKind.SECONDARY, "upsert", "connection refused");
    upserts++;
    table(collection).put(record.id(), record);
    return record;
  }

  @Override public List<DataRecord> list(String collection, QueryOptions options) { throw new UnsupportedOperationException(); }
  @Override public long count(String collection, QueryOptions options) { throw new UnsupportedOperationException(); }
  @Override public DataRecord insert(String collection, DataRecord record) { throw new UnsupportedOperationException(); }
  @Override public DataRecord update(String collection, Object id, Map<String, Object> partial) { throw new UnsupportedOperationException(); }
  @Override public boolean delete(String collection, Object id) { throw new UnsupportedOperationException(); }
  @Override public long deleteMany(String collection, List<?> ids) { throw new UnsupportedOperationException(); }
  @Override public List<DataRecord> rawQuery(String query, List<?> params) { throw new UnsupportedOperationException(); }
}
