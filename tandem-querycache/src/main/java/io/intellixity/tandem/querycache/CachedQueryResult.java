package io.intellixity.tandem.querycache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.tandem.persistence.record.DataRecord;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One cached origin response, stored as a row {@code (id, query, variables, response, created_at)}.\n
 */
public record CachedQueryResult(String id, String query, Map<String, Object> variables,
                                Map<String, Object> response, Instant createdAt) {
  public static final String QUERY = "query";
  public static final String VARIABLES = "variables";
  public static final String RESPONSE = "response";
  public static final String CREATED_AT = "created_at";

  private static final ObjectMapper JSON = new ObjectMapper();
  private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};

  public CachedQueryResult {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(createdAt, "createdAt");
    variables = (variables == null) ? Map.of() : variables;
    response = (response == null) ? Map.of() : response;
  }

  /** Fresh while {@code now - createdAt < ttl}. */
  public boolean isFresh(Instant now, Duration ttl) {
    return Duration.between(createdAt, now).compareTo(ttl) < 0;
  }

  public DataRecord toRecord() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put(DataRecord.ID, id);
    m.put(QUERY, query);
    m.put(VARIABLES, variables);
    m.put(RESPONSE, response);
    m.put(CREATED_AT, createdAt);
    return DataRecord.of(m);
  }

  /** Relational rows give parsed JSON and Instants; other stores may hand back text and dates. */
  public static CachedQueryResult fromRecord(DataRecord r) {
    return new CachedQueryResult(
        String.valueOf(r.id()),
        r.getString(QUERY),
        jsonObject(r.get(VARIABLES)),
        jsonObject(r.get(RESPONSE)),
        instant(r.get(CREATED_AT)));
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> jsonObject(Object raw) {
    if (raw == null) return Map.of();
    if (raw instanceof Map<?, ?> m) return (Map<String, Object>) m;
    if (raw instanceof String s) {
      try {
        return JSON.readValue(s, MAP);
      } catch (JsonProcessingException e) {
        throw new IllegalStateException("Cached row holds invalid JSON: " + e.getOriginalMessage(), e);
      }
    }
    throw new IllegalStateException("Unexpected JSON column type: " + raw.getClass().getName());
  }

  private static Instant instant(Object raw) {
    if (raw instanceof Instant i) return i;
    if (raw instanceof OffsetDateTime odt) return odt.toInstant();
    if (raw instanceof Date d) return d.toInstant();
    if (raw instanceof String s) return Instant.parse(s);
    throw new IllegalStateException("Unexpected created_at value: " + raw);
  }
}
