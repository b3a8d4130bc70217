package io.intellixity.tandem.persistence.jdbc;

import java.util.Collection;
import java.util.Map;

/** One positional parameter value plus how the dialect should bind it. */
public record Bind(Object value, Kind kind) {
  public enum Kind {
    /** Plain JDBC value via setObject. */
    SCALAR,
    /** SQL array (java.sql.Array built from the collection). */
    ARRAY,
    /** JSON document (serialized; dialects may bind a native JSON type). */
    JSON,
    /** Driver-typed literal (e.g. Postgres range text) bound as Types.OTHER. */
    OTHER
  }

  public Bind {
    kind = (kind == null) ? Kind.SCALAR : kind;
  }

  public static Bind scalar(Object value) { return new Bind(value, Kind.SCALAR); }

  /** Infer the bind kind for a record field value: maps become JSON, collections arrays. */
  public static Bind infer(Object value) {
    if (value instanceof Map<?, ?>) return new Bind(value, Kind.JSON);
    if (value instanceof Collection<?>) return new Bind(value, Kind.ARRAY);
    return new Bind(value, Kind.SCALAR);
  }
}
