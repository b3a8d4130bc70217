package io.intellixity.tandem.persistence.record;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Generic entity: an {@code id} plus arbitrary fields, in insertion order.\n
 *
 * Immutable; {@link #with(String, Object)} and {@link #merge(Map)} return copies.\n
 */
public final class DataRecord {
  public static final String ID = "id";

  private final Map<String, Object> fields;

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public DataRecord(Map<String, ?> fields) {
    this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields == null ? Map.of() : fields));
  }

  public static DataRecord of(Map<String, ?> fields) {
    return new DataRecord(fields);
  }

  public static DataRecord empty() {
    return new DataRecord(Map.of());
  }

  /** Identity: string or number, null before the backend assigned one. */
  public Object id() { return fields.get(ID); }

  public boolean hasId() { return fields.get(ID) != null; }

  public Object get(String field) { return fields.get(field); }

  public boolean has(String field) { return fields.containsKey(field); }

  public String getString(String field) {
    Object v = fields.get(field);
    return v == null ? null : String.valueOf(v);
  }

  @JsonValue
  public Map<String, Object> fields() { return fields; }

  public DataRecord with(String field, Object value) {
    Objects.requireNonNull(field, "field");
    Map<String, Object> m = new LinkedHashMap<>(fields);
    m.put(field, value);
    return new DataRecord(m);
  }

  public DataRecord withId(Object id) {
    // keep id as the first field
    Map<String, Object> m = new LinkedHashMap<>();
    m.put(ID, id);
    for (var e : fields.entrySet()) {
      if (!ID.equals(e.getKey())) m.put(e.getKey(), e.getValue());
    }
    return new DataRecord(m);
  }

  public DataRecord without(String field) {
    Map<String, Object> m = new LinkedHashMap<>(fields);
    m.remove(field);
    return new DataRecord(m);
  }

  /** Apply a partial update; {@code id} in the partial is ignored. */
  public DataRecord merge(Map<String, ?> partial) {
    if (partial == null || partial.isEmpty()) return this;
    Map<String, Object> m = new LinkedHashMap<>(fields);
    for (var e : partial.entrySet()) {
      if (ID.equals(e.getKey())) continue;
      m.put(e.getKey(), e.getValue());
    }
    return new DataRecord(m);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    return (o instanceof DataRecord r) && fields.equals(r.fields);
  }

  @Override
  public int hashCode() { return fields.hashCode(); }

  @Override
  public String toString() { return "DataRecord" + fields; }
}
