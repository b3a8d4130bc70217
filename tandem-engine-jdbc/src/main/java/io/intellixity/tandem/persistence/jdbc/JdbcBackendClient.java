package io.intellixity.tandem.persistence.jdbc;

import io.intellixity.tandem.persistence.error.DataAccessException;
import io.intellixity.tandem.persistence.error.TransactionException;
import io.intellixity.tandem.persistence.error.TransactionException.Phase;
import io.intellixity.tandem.persistence.exec.CallScope;
import io.intellixity.tandem.persistence.exec.TransactionalBackendClient;
import io.intellixity.tandem.persistence.exec.TxHandle;
import io.intellixity.tandem.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.tandem.persistence.query.QueryOptions;
import io.intellixity.tandem.persistence.record.DataRecord;
import io.intellixity.tandem.persistence.spi.exec.AbstractBackendClient;
import io.intellixity.tandem.persistence.spi.exec.QueryOptionsValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.*;

/**
 * Secondary backend over plain JDBC.\n
 *
 * Outside a transaction each call borrows a pooled connection; inside one, every call on the owning
 * thread reuses the transaction's connection. Statement timeouts come from the {@link CallScope}
 * deadline.\n
 */
public final class JdbcBackendClient extends AbstractBackendClient<SqlStatement, JdbcHandle>
    implements TransactionalBackendClient {
  private static final Logger log = LoggerFactory.getLogger(JdbcBackendClient.class);

  private final DataSource ds;
  private final JdbcDialect dialect;
  private final ThreadLocal<JdbcTxHandle> currentTx = new ThreadLocal<>();

  public JdbcBackendClient(JdbcHandle handle, JdbcDialect dialect, QueryOptionsValidator validator) {
    super(Objects.requireNonNull(handle, "handle"), Objects.requireNonNull(dialect, "dialect"), validator);
    this.ds = handle.client();
    this.dialect = dialect;
  }

  public JdbcBackendClient(JdbcHandle handle, JdbcDialect dialect) {
    this(handle, dialect, null);
  }

  public record JdbcTxHandle(Connection conn) implements TxHandle {}

  // --- Transactions ---

  @Override
  public TxHandle begin() {
    if (currentTx.get() != null) {
      throw new TransactionException(kind(), Phase.BEGIN, "A transaction is already active on this thread", null);
    }
    Connection c = null;
    try {
      c = ds.getConnection();
      applySchema(c);
      c.setAutoCommit(false);
      JdbcTxHandle tx = new JdbcTxHandle(c);
      currentTx.set(tx);
      log.debug("tandem.jdbc tx=BEGIN handleId={}", handle().id());
      return tx;
    } catch (SQLException e) {
      if (c != null) {
        try {
          c.close();
        } catch (SQLException closeFailure) {
          e.addSuppressed(closeFailure);
        }
      }
      throw new TransactionException(kind(), Phase.BEGIN, "Could not start transaction: " + e.getMessage(),
          JdbcFailures.translate(kind(), "transaction.begin", e));
    }
  }

  @Override
  public void commit(TxHandle tx) {
    JdbcTxHandle j = requireCurrent(tx, Phase.COMMIT);
    try {
      j.conn().commit();
    } catch (SQLException e) {
      // stays bound so the caller can still roll back
      throw new TransactionException(kind(), Phase.COMMIT, "Commit failed: " + e.getMessage(),
          JdbcFailures.translate(kind(), "transaction.commit", e));
    }
    currentTx.remove();
    log.debug("tandem.jdbc tx=COMMIT handleId={}", handle().id());
    try {
      j.conn().close();
    } catch (SQLException e) {
      log.warn("tandem.jdbc tx=release_failed handleId={} sqlState={}", handle().id(), e.getSQLState(), e);
    }
  }

  @Override
  public void rollback(TxHandle tx) {
    JdbcTxHandle j = requireCurrent(tx, Phase.ROLLBACK);
    currentTx.remove();
    try (Connection c = j.conn()) {
      c.rollback();
      log.debug("tandem.jdbc tx=ROLLBACK handleId={}", handle().id());
    } catch (SQLException e) {
      throw new TransactionException(kind(), Phase.ROLLBACK, "Rollback failed: " + e.getMessage(),
          JdbcFailures.translate(kind(), "transaction.rollback", e));
    }
  }

  @Override
  public boolean inTransaction() {
    return currentTx.get() != null;
  }

  private JdbcTxHandle requireCurrent(TxHandle tx, Phase phase) {
    JdbcTxHandle cur = currentTx.get();
    if (cur == null || cur != tx) {
      throw new TransactionException(kind(), phase, "Transaction is not active on this thread", null);
    }
    return cur;
  }

  // --- Operations ---

  @Override
  protected DataAccessException translateFailure(String operation, RuntimeException failure) {
    return JdbcFailures.translate(kind(), operation, failure);
  }

  @Override
  protected Optional<DataRecord> executeGet(String collection, Object id) {
    SqlStatement ss = dialect.renderGet(collection, id);
    return withConnection("get", c -> first(query(c, "GET", ss, compiled(ss))));
  }

  @Override
  protected List<DataRecord> executeList(String collection, QueryOptions options, SqlStatement ss) {
    return withConnection("list", c -> query(c, "SELECT", ss, compiled(ss)));
  }

  @Override
  protected long executeCount(String collection, QueryOptions options, SqlStatement ss) {
    return withConnection("count", c -> {
      String jdbcSql = compiled(ss);
      long start = System.nanoTime();
      debugSql("COUNT", ss, jdbcSql);
      try (PreparedStatement ps = prepare(c, jdbcSql, ss); ResultSet rs = ps.executeQuery()) {
        long n = rs.next() ? rs.getLong(1) : 0;
        debugDone("COUNT", ss, n, System.nanoTime() - start);
        return n;
      }
    });
  }

  @Override
  protected DataRecord executeInsert(String collection, DataRecord record) {
    SqlStatement ss = dialect.renderInsert(collection, record);
    return withConnection("insert", c -> writeAndRead(c, "INSERT", collection, record.id(), ss).orElse(record));
  }

  @Override
  protected Optional<DataRecord> executeUpdate(String collection, Object id, Map<String, Object> partial) {
    SqlStatement ss = dialect.renderUpdate(collection, id, partial);
    return withConnection("update", c -> writeAndRead(c, "UPDATE", collection, id, ss));
  }

  @Override
  protected DataRecord executeUpsert(String collection, DataRecord record) {
    SqlStatement ss = dialect.renderUpsert(collection, record);
    return withConnection("upsert", c -> writeAndRead(c, "UPSERT", collection, record.id(), ss).orElse(record));
  }

  @Override
  protected boolean executeDelete(String collection, Object id) {
    SqlStatement ss = dialect.renderDelete(collection, id);
    return withConnection("delete", c -> update(c, "DELETE", ss) > 0);
  }

  @Override
  protected long executeDeleteMany(String collection, List<?> ids) {
    SqlStatement ss = dialect.renderDeleteMany(collection, ids);
    return withConnection("deleteMany", c -> update(c, "DELETE", ss));
  }

  @Override
  protected List<DataRecord> executeRawQuery(String query, List<?> params) {
    SqlStatement ss = SqlParamCompiler.compilePositional(query, params);
    return withConnection("rawQuery", c -> {
      long start = System.nanoTime();
      debugSql("RAW", ss, ss.sql());
      try (PreparedStatement ps = prepare(c, ss.sql(), ss)) {
        if (ps.execute()) {
          try (ResultSet rs = ps.getResultSet()) {
            List<DataRecord> out = JdbcRecordReader.readAll(rs, dialect);
            debugDone("RAW", ss, out.size(), System.nanoTime() - start);
            return out;
          }
        }
        int n = ps.getUpdateCount();
        debugDone("RAW", ss, n, System.nanoTime() - start);
        return List.of(DataRecord.of(Map.of("affectedRows", n)));
      }
    });
  }

  // --- Plumbing ---

  @FunctionalInterface
  private interface SqlWork<T> {
    T apply(Connection c) throws SQLException;
  }

  private <T> T withConnection(String operation, SqlWork<T> work) {
    JdbcTxHandle tx = currentTx.get();
    try {
      if (tx != null) return work.apply(tx.conn());
      try (Connection c = ds.getConnection()) {
        applySchema(c);
        return work.apply(c);
      }
    } catch (SQLException e) {
      throw JdbcFailures.translate(kind(), operation, e);
    }
  }

  /** Run a DML statement; read the written row back when the dialect cannot return it. */
  private Optional<DataRecord> writeAndRead(Connection c, String op, String collection, Object id, SqlStatement ss)
      throws SQLException {
    if (ss.execKind() == SqlStatement.ExecKind.QUERY) return first(query(c, op, ss, compiled(ss)));
    if (update(c, op, ss) == 0) return Optional.empty();
    SqlStatement get = dialect.renderGet(collection, id);
    return first(query(c, "GET", get, compiled(get)));
  }

  private List<DataRecord> query(Connection c, String op, SqlStatement ss, String jdbcSql) throws SQLException {
    long start = System.nanoTime();
    debugSql(op, ss, jdbcSql);
    try (PreparedStatement ps = prepare(c, jdbcSql, ss); ResultSet rs = ps.executeQuery()) {
      List<DataRecord> out = JdbcRecordReader.readAll(rs, dialect);
      debugDone(op, ss, out.size(), System.nanoTime() - start);
      return out;
    }
  }

  private long update(Connection c, String op, SqlStatement ss) throws SQLException {
    String jdbcSql = compiled(ss);
    long start = System.nanoTime();
    debugSql(op, ss, jdbcSql);
    try (PreparedStatement ps = prepare(c, jdbcSql, ss)) {
      long n = ps.executeUpdate();
      debugDone(op, ss, n, System.nanoTime() - start);
      return n;
    }
  }

  private PreparedStatement prepare(Connection c, String jdbcSql, SqlStatement ss) throws SQLException {
    PreparedStatement ps = c.prepareStatement(jdbcSql);
    try {
      int timeout = CallScope.remainingSecondsOrZero();
      if (timeout > 0) ps.setQueryTimeout(timeout);
      for (int i = 0; i < ss.binds().size(); i++) dialect.bind(ps, i + 1, ss.binds().get(i));
      return ps;
    } catch (SQLException | RuntimeException e) {
      try {
        ps.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
  }

  private void applySchema(Connection c) throws SQLException {
    String schema = handle().schema();
    if (schema != null) c.setSchema(schema);
  }

  private static String compiled(SqlStatement ss) {
    return SqlParamCompiler.toJdbcSql(ss.sql());
  }

  private static Optional<DataRecord> first(List<DataRecord> rows) {
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  private void debugSql(String op, SqlStatement ss, String jdbcSql) {
    if (!log.isDebugEnabled()) return;
    log.debug("tandem.jdbc op={} execKind={} bindCount={} handleId={} schema={} tx={} sql={}",
        op, ss.execKind(), ss.binds().size(), handle().id(), handle().schema(), inTransaction(), jdbcSql);

    // TRACE: bind summary only (no raw values)
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Bind b : ss.binds()) {
        Object v = b.value();
        log.trace("tandem.jdbc bind index={} kind={} valueType={} valueLen={}",
            idx++, b.kind(), v == null ? "null" : v.getClass().getName(),
            (v instanceof CharSequence cs) ? cs.length() : -1);
      }
    }
  }

  private void debugDone(String op, SqlStatement ss, long result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("tandem.jdbc_done op={} execKind={} durationMs={} result={}",
        op, ss.execKind(), durationNanos / 1_000_000.0, result);
  }
}
