package io.intellixity.tandem.persistence.mongo;

import io.intellixity.tandem.persistence.query.Include;
import io.intellixity.tandem.persistence.record.DataRecord;
import org.bson.BsonValue;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.util.*;

/** Conversions between {@link DataRecord} and BSON documents ({@code id} <-> {@code _id}). */
final class DataRecordDocuments {
  static final String ID = DataRecord.ID;

  private DataRecordDocuments() {}

  static Document toDocument(DataRecord record) {
    Document d = new Document();
    for (var e : record.fields().entrySet()) {
      String key = ID.equals(e.getKey()) ? "_id" : e.getKey();
      d.append(key, e.getValue());
    }
    return d;
  }

  /** {@code $set} body for a partial update; {@code id} is never written. */
  static Document toSet(Map<String, Object> partial) {
    Document d = new Document();
    for (var e : partial.entrySet()) {
      if (ID.equals(e.getKey()) || "_id".equals(e.getKey())) continue;
      d.append(e.getKey(), e.getValue());
    }
    return d;
  }

  static DataRecord fromDocument(Document doc) {
    return fromDocument(doc, List.of());
  }

  /**
   * Included relations arrive as embedded documents under the related table name and are flattened to
   * {@code "<table>.<field>"} keys.\n
   */
  static DataRecord fromDocument(Document doc, List<Include> include) {
    Map<String, Include> byTable = new HashMap<>();
    for (Include inc : include) byTable.put(inc.table(), inc);

    Map<String, Object> out = new LinkedHashMap<>();
    Object id = doc.get("_id");
    if (doc.containsKey("_id")) out.put(ID, toJava(id));
    for (var e : doc.entrySet()) {
      String key = e.getKey();
      if ("_id".equals(key)) continue;
      Include inc = byTable.get(key);
      if (inc != null) {
        flattenInclude(inc, e.getValue(), out);
        continue;
      }
      out.put(key, toJava(e.getValue()));
    }
    return DataRecord.of(out);
  }

  private static void flattenInclude(Include inc, Object related, Map<String, Object> out) {
    Document rd = (related instanceof Document d) ? d : null;
    if (inc.fields().isEmpty()) {
      if (rd == null) return;
      for (var e : rd.entrySet()) {
        String f = "_id".equals(e.getKey()) ? ID : e.getKey();
        out.put(inc.table() + "." + f, toJava(e.getValue()));
      }
      return;
    }
    for (String f : inc.fields()) {
      Object v = (rd == null) ? null : rd.get(ID.equals(f) ? "_id" : f);
      out.put(inc.table() + "." + f, toJava(v));
    }
  }

  static Object toJava(Object v) {
    if (v == null) return null;
    if (v instanceof ObjectId oid) return oid.toHexString();
    if (v instanceof Decimal128 d) return d.bigDecimalValue();
    if (v instanceof Date date) return date.toInstant();
    if (v instanceof BsonValue bv) return bsonToJava(bv);
    if (v instanceof Document d) {
      Map<String, Object> m = new LinkedHashMap<>();
      for (var e : d.entrySet()) m.put(e.getKey(), toJava(e.getValue()));
      return m;
    }
    if (v instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object o : l) out.add(toJava(o));
      return out;
    }
    return v;
  }

  private static Object bsonToJava(BsonValue v) {
    if (v.isNull()) return null;
    if (v.isString()) return v.asString().getValue();
    if (v.isInt32()) return v.asInt32().getValue();
    if (v.isInt64()) return v.asInt64().getValue();
    if (v.isDouble()) return v.asDouble().getValue();
    if (v.isBoolean()) return v.asBoolean().getValue();
    if (v.isObjectId()) return v.asObjectId().getValue().toHexString();
    return v.toString();
  }
}
