package io.intellixity.tandem.persistence.jdbc;

import io.intellixity.tandem.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.tandem.persistence.record.DataRecord;

import java.sql.*;
import java.util.*;

/** Reads result rows into {@link DataRecord}s keyed by column label. */
final class JdbcRecordReader {
  private JdbcRecordReader() {}

  static List<DataRecord> readAll(ResultSet rs, JdbcDialect dialect) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    String[] labels = new String[n];
    for (int i = 0; i < n; i++) labels[i] = md.getColumnLabel(i + 1);

    List<DataRecord> out = new ArrayList<>();
    while (rs.next()) {
      Map<String, Object> row = new LinkedHashMap<>();
      for (int i = 0; i < n; i++) {
        row.put(labels[i], readValue(rs.getObject(i + 1), dialect));
      }
      out.add(DataRecord.of(row));
    }
    return out;
  }

  static Object readValue(Object raw, JdbcDialect dialect) throws SQLException {
    if (raw == null) return null;
    if (raw instanceof Timestamp ts) return ts.toInstant();
    if (raw instanceof java.sql.Date d) return d.toLocalDate();
    if (raw instanceof Array a) {
      try {
        Object arr = a.getArray();
        List<Object> list = new ArrayList<>();
        if (arr instanceof Object[] objs) {
          for (Object o : objs) list.add(readValue(o, dialect));
        }
        return list;
      } finally {
        a.free();
      }
    }
    if (raw instanceof Clob c) return c.getSubString(1, (int) c.length());
    return dialect.readValue(raw);
  }
}
