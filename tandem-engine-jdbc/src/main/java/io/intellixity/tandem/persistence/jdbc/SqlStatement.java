package io.intellixity.tandem.persistence.jdbc;

import io.intellixity.tandem.persistence.spi.sql.NativeStatement;

import java.util.List;

/**
 * SQL with named placeholders ({@code :b1}, {@code :b2}, ...) and their binds in order.\n
 *
 * {@link SqlParamCompiler#toJdbcSql(String)} rewrites the placeholders to {@code ?} right before execution.\n
 */
public record SqlStatement(String sql, List<Bind> binds, ExecKind execKind) implements NativeStatement {
  public enum ExecKind {
    /** Execute via PreparedStatement.executeQuery() and read all rows (SELECT, DML ... RETURNING). */
    QUERY,
    /** Execute via PreparedStatement.executeUpdate() and read the update count. */
    UPDATE
  }

  public SqlStatement {
    binds = binds == null ? List.of() : List.copyOf(binds);
    execKind = (execKind == null) ? ExecKind.QUERY : execKind;
  }

  public SqlStatement(String sql, List<Bind> binds) {
    this(sql, binds, ExecKind.QUERY);
  }
}
