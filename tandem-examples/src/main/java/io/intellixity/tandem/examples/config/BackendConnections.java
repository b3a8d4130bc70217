package io.intellixity.tandem.examples.config;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.tandem.persistence.access.Backends;
import io.intellixity.tandem.persistence.jdbc.JdbcBackendClient;
import io.intellixity.tandem.persistence.jdbc.JdbcHandle;
import io.intellixity.tandem.persistence.jdbc.postgres.PostgresDialect;
import io.intellixity.tandem.persistence.mongo.MongoBackendClient;
import io.intellixity.tandem.persistence.mongo.MongoHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens the configured physical connections once at startup and owns them until shutdown.\n
 *
 * PRIMARY is the Mongo document store, SECONDARY the Postgres pool. An unset URI leaves the slot empty;
 * {@link #backends(String)} then fails if nothing usable is left.\n
 */
public final class BackendConnections implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(BackendConnections.class);

  private final MongoClient mongo;
  private final HikariDataSource pool;
  private final MongoBackendClient primary;
  private final JdbcBackendClient secondary;

  private BackendConnections(MongoClient mongo, HikariDataSource pool,
                             MongoBackendClient primary, JdbcBackendClient secondary) {
    this.mongo = mongo;
    this.pool = pool;
    this.primary = primary;
    this.secondary = secondary;
  }

  public static BackendConnections open(TandemProperties props) {
    MongoClient mongo = null;
    MongoBackendClient primary = null;
    TandemProperties.Mongo m = props.getMongo();
    if (m.isConfigured()) {
      mongo = MongoClients.create(m.getUri());
      primary = new MongoBackendClient(new MongoHandle("mongo:" + m.getDatabase(), mongo, m.getDatabase()));
    }

    HikariDataSource pool = null;
    JdbcBackendClient secondary = null;
    TandemProperties.Jdbc j = props.getJdbc();
    if (j.isConfigured()) {
      HikariConfig hc = new HikariConfig();
      hc.setPoolName("tandem-jdbc");
      hc.setJdbcUrl(j.getUrl());
      hc.setUsername(j.getUsername());
      hc.setPassword(j.getPassword());
      hc.setMaximumPoolSize(j.getMaximumPoolSize());
      pool = new HikariDataSource(hc);
      secondary = new JdbcBackendClient(new JdbcHandle("jdbc:" + j.getSchema(), pool, j.getSchema()), new PostgresDialect());
    }
    return new BackendConnections(mongo, pool, primary, secondary);
  }

  public Backends backends(String defaultBackend) {
    return Backends.resolve(primary, secondary, defaultBackend);
  }

  @Override
  public void close() {
    if (mongo != null) mongo.close();
    if (pool != null) pool.close();
    log.info("tandem.backends op=CLOSE mongo={} jdbc={}", mongo != null, pool != null);
  }
}
