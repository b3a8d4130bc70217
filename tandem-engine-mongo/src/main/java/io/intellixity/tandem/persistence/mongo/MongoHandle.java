package io.intellixity.tandem.persistence.mongo;

import com.mongodb.client.MongoClient;
import io.intellixity.tandem.persistence.exec.BackendHandle;
import io.intellixity.tandem.persistence.exec.BackendKind;

import java.util.Objects;

/** Shared MongoClient bound to one database; collections are resolved per call. */
public record MongoHandle(String id, MongoClient client, String database, BackendKind kind)
    implements BackendHandle<MongoClient> {
  public MongoHandle {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(client, "client");
    Objects.requireNonNull(database, "database");
    Objects.requireNonNull(kind, "kind");
  }

  public MongoHandle(String id, MongoClient client, String database) {
    this(id, client, database, BackendKind.PRIMARY);
  }

  @Override public String namespace() { return database; }
}
