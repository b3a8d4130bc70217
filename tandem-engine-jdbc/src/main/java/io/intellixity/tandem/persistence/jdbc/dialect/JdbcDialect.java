package io.intellixity.tandem.persistence.jdbc.dialect;

import io.intellixity.tandem.persistence.jdbc.Bind;
import io.intellixity.tandem.persistence.jdbc.SqlStatement;
import io.intellixity.tandem.persistence.record.DataRecord;
import io.intellixity.tandem.persistence.spi.sql.FilterTranslator;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/** JDBC SQL dialect: query translation plus single-table DML and value binding. */
public interface JdbcDialect extends FilterTranslator<SqlStatement> {
  SqlStatement renderGet(String table, Object id);

  SqlStatement renderInsert(String table, DataRecord record);

  /** Empty {@code partial} renders a plain lookup so the caller still gets the current row. */
  SqlStatement renderUpdate(String table, Object id, Map<String, Object> partial);

  SqlStatement renderUpsert(String table, DataRecord record);

  SqlStatement renderDelete(String table, Object id);

  SqlStatement renderDeleteMany(String table, List<?> ids);

  void bind(PreparedStatement ps, int position, Bind bind) throws SQLException;

  /** Convert a driver-specific column value (e.g. JSON objects) into a plain Java value. */
  default Object readValue(Object raw) {
    return raw;
  }
}
