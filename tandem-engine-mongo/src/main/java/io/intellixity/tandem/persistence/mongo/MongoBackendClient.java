package io.intellixity.tandem.persistence.mongo;

import com.mongodb.client.AggregateIterable;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.CountOptions;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.ReturnDocument;
import com.mongodb.client.result.DeleteResult;
import io.intellixity.tandem.persistence.error.DataAccessException;
import io.intellixity.tandem.persistence.error.ValidationException;
import io.intellixity.tandem.persistence.exec.CallScope;
import io.intellixity.tandem.persistence.query.QueryOptions;
import io.intellixity.tandem.persistence.record.DataRecord;
import io.intellixity.tandem.persistence.spi.exec.AbstractBackendClient;
import io.intellixity.tandem.persistence.spi.exec.QueryOptionsValidator;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * Primary backend over the official MongoDB Java sync driver.\n
 *
 * Reads honor the call deadline through {@code maxTime}. Raw queries are JSON database commands
 * ({@code runCommand}); cursor results are unwrapped from {@code cursor.firstBatch}.\n
 */
public final class MongoBackendClient extends AbstractBackendClient<MongoStatement, MongoHandle> {
  private static final Logger log = LoggerFactory.getLogger(MongoBackendClient.class);

  private final MongoDatabase db;

  public MongoBackendClient(MongoHandle handle, MongoFilterTranslator translator, QueryOptionsValidator validator) {
    super(Objects.requireNonNull(handle, "handle"), translator, validator);
    this.db = handle.client().getDatabase(handle.database());
  }

  public MongoBackendClient(MongoHandle handle) {
    this(handle, new MongoFilterTranslator(), null);
  }

  @Override
  protected DataAccessException translateFailure(String operation, RuntimeException failure) {
    return MongoFailures.translate(kind(), operation, failure);
  }

  @Override
  protected Optional<DataRecord> executeGet(String collection, Object id) {
    long start = System.nanoTime();
    FindIterable<Document> find = withMaxTime(col(collection).find(Filters.eq("_id", id)));
    Document d = find.first();
    debugDone("GET", collection, d == null ? 0 : 1, System.nanoTime() - start);
    return Optional.ofNullable(d).map(DataRecordDocuments::fromDocument);
  }

  @Override
  protected List<DataRecord> executeList(String collection, QueryOptions options, MongoStatement st) {
    long start = System.nanoTime();
    debugStatement("FIND", st);
    MongoCollection<Document> col = col(st.collection());

    Iterable<Document> docs;
    if (st.kind() == MongoStatement.Kind.AGGREGATE) {
      AggregateIterable<Document> agg = col.aggregate(st.pipeline());
      Duration left = CallScope.remaining();
      if (left != null) agg = agg.maxTime(Math.max(1, left.toMillis()), TimeUnit.MILLISECONDS);
      docs = agg;
    } else {
      FindIterable<Document> find = withMaxTime(col.find(st.filter()));
      if (st.projection() != null) find = find.projection(st.projection());
      if (st.sort() != null && !st.sort().isEmpty()) find = find.sort(st.sort());
      if (st.skip() != null) find = find.skip(st.skip());
      if (st.limit() != null) find = find.limit(st.limit());
      docs = find;
    }

    List<DataRecord> out = new ArrayList<>();
    for (Document d : docs) out.add(DataRecordDocuments.fromDocument(d, options.include()));
    debugDone("FIND", st.collection(), out.size(), System.nanoTime() - start);
    return out;
  }

  @Override
  protected long executeCount(String collection, QueryOptions options, MongoStatement st) {
    long start = System.nanoTime();
    debugStatement("COUNT", st);
    CountOptions opts = new CountOptions();
    Duration left = CallScope.remaining();
    if (left != null) opts.maxTime(Math.max(1, left.toMillis()), TimeUnit.MILLISECONDS);
    long n = col(st.collection()).countDocuments(st.filter(), opts);
    debugDone("COUNT", st.collection(), n, System.nanoTime() - start);
    return n;
  }

  @Override
  protected DataRecord executeInsert(String collection, DataRecord record) {
    long start = System.nanoTime();
    Document doc = DataRecordDocuments.toDocument(record);
    col(collection).insertOne(doc);
    debugDone("INSERT", collection, 1, System.nanoTime() - start);
    return DataRecordDocuments.fromDocument(doc);
  }

  @Override
  protected Optional<DataRecord> executeUpdate(String collection, Object id, Map<String, Object> partial) {
    long start = System.nanoTime();
    Document set = DataRecordDocuments.toSet(partial);
    Document d;
    if (set.isEmpty()) {
      d = col(collection).find(Filters.eq("_id", id)).first();
    } else {
      d = col(collection).findOneAndUpdate(Filters.eq("_id", id), new Document("$set", set),
          new FindOneAndUpdateOptions().returnDocument(ReturnDocument.AFTER));
    }
    debugDone("UPDATE", collection, d == null ? 0 : 1, System.nanoTime() - start);
    return Optional.ofNullable(d).map(DataRecordDocuments::fromDocument);
  }

  @Override
  protected DataRecord executeUpsert(String collection, DataRecord record) {
    long start = System.nanoTime();
    Document doc = DataRecordDocuments.toDocument(record);
    col(collection).replaceOne(Filters.eq("_id", doc.get("_id")), doc, new ReplaceOptions().upsert(true));
    debugDone("UPSERT", collection, 1, System.nanoTime() - start);
    return DataRecordDocuments.fromDocument(doc);
  }

  @Override
  protected boolean executeDelete(String collection, Object id) {
    long start = System.nanoTime();
    DeleteResult r = col(collection).deleteOne(Filters.eq("_id", id));
    debugDone("DELETE", collection, r.getDeletedCount(), System.nanoTime() - start);
    return r.getDeletedCount() > 0;
  }

  @Override
  protected long executeDeleteMany(String collection, List<?> ids) {
    long start = System.nanoTime();
    DeleteResult r = col(collection).deleteMany(Filters.in("_id", ids));
    debugDone("DELETE_MANY", collection, r.getDeletedCount(), System.nanoTime() - start);
    return r.getDeletedCount();
  }

  @Override
  protected List<DataRecord> executeRawQuery(String query, List<?> params) {
    if (!params.isEmpty()) {
      throw new ValidationException(kind(), "rawQuery", "MongoDB commands take no positional parameters", null);
    }
    long start = System.nanoTime();
    Document command = Document.parse(query);
    Document result = db.runCommand(command);

    List<DataRecord> out = new ArrayList<>();
    Object cursor = result.get("cursor");
    if (cursor instanceof Document c && c.get("firstBatch") instanceof List<?> batch) {
      for (Object o : batch) {
        if (o instanceof Document d) out.add(DataRecordDocuments.fromDocument(d));
      }
    } else {
      out.add(DataRecordDocuments.fromDocument(result));
    }
    debugDone("COMMAND", command.keySet().isEmpty() ? "?" : command.keySet().iterator().next(), out.size(), System.nanoTime() - start);
    return out;
  }

  private MongoCollection<Document> col(String collection) {
    return db.getCollection(collection);
  }

  private static FindIterable<Document> withMaxTime(FindIterable<Document> find) {
    Duration left = CallScope.remaining();
    if (left == null) return find;
    return find.maxTime(Math.max(1, left.toMillis()), TimeUnit.MILLISECONDS);
  }

  private void debugStatement(String op, MongoStatement st) {
    if (!log.isDebugEnabled()) return;
    log.debug("tandem.mongo op={} kind={} handleId={} database={} collection={} filterKeys={} stages={}",
        op, st.kind(), handle().id(), handle().database(), st.collection(),
        st.filter().keySet(), st.pipeline().size());
  }

  private void debugDone(String op, String collection, long result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("tandem.mongo_done op={} collection={} durationMs={} result={}",
        op, collection, durationNanos / 1_000_000.0, result);
  }
}
