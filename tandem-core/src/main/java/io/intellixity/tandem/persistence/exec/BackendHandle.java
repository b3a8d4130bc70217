package io.intellixity.tandem.persistence.exec;

/**
 * Resolved runtime handle for one backend.\n
 *
 * Example:\n
 * - JDBC: client() is javax.sql.DataSource, namespace() is schema\n
 * - Mongo: client() is MongoClient, namespace() is database\n
 */
public interface BackendHandle<TClient> {
  /** Unique identifier for this handle (useful for logging). */
  String id();

  /** Native client used by a backend client (DataSource, MongoClient, etc.). */
  TClient client();

  /** Namespace (schema/database) for this handle. */
  String namespace();

  BackendKind kind();
}
