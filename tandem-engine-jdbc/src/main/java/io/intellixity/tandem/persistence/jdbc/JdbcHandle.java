package io.intellixity.tandem.persistence.jdbc;

import io.intellixity.tandem.persistence.exec.BackendHandle;
import io.intellixity.tandem.persistence.exec.BackendKind;

import javax.sql.DataSource;
import java.util.Objects;

/**
 * Pooled JDBC data source plus the schema every connection is switched to.
 *
 * @param schema applied with {@code Connection.setSchema}; null keeps the pool's default
 */
public record JdbcHandle(String id, DataSource client, String schema, BackendKind kind)
    implements BackendHandle<DataSource> {
  public JdbcHandle {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(client, "client");
    Objects.requireNonNull(kind, "kind");
  }

  public JdbcHandle(String id, DataSource client, String schema) {
    this(id, client, schema, BackendKind.SECONDARY);
  }

  @Override public String namespace() { return schema; }
}
