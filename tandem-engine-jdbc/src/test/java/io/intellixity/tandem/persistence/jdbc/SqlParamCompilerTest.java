package io.intellixity.tandem.persistence.jdbc;

import io.intellixity.tandem.persistence.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class SqlParamCompilerTest {
  @Test
  void namedParamsBecomeQuestionMarks_castsAndLiteralsUntouched() {
    String sql = "SELECT * FROM t WHERE a = :b1 AND b::text = :b2 AND c = ':b3' AND d = 'it''s :x'";
    assertEquals("SELECT * FROM t WHERE a = ? AND b::text = ? AND c = ':b3' AND d = 'it''s :x'",
        SqlParamCompiler.toJdbcSql(sql));
  }

  @Test
  void dollarParamsAreReorderedByIndex() {
    SqlStatement ss = SqlParamCompiler.compilePositional(
        "SELECT * FROM agents WHERE owner = $2 AND status = $1 OR creator = $2", List.of("active", "u1"));
    assertEquals("SELECT * FROM agents WHERE owner = ? AND status = ? OR creator = ?", ss.sql());
    assertEquals(List.of("u1", "active", "u1"), ss.binds().stream().map(Bind::value).toList());
  }

  @Test
  void questionMarkSqlKeepsParamOrder_andInfersBindKinds() {
    SqlStatement ss = SqlParamCompiler.compilePositional(
        "INSERT INTO t (a, b, c) VALUES (?, ?, ?)", List.of("x", List.of("t1"), Map.of("k", 1)));
    assertEquals("INSERT INTO t (a, b, c) VALUES (?, ?, ?)", ss.sql());
    assertEquals(List.of(Bind.Kind.SCALAR, Bind.Kind.ARRAY, Bind.Kind.JSON),
        ss.binds().stream().map(Bind::kind).toList());
  }

  @Test
  void dollarInsideLiteralIsNotAParam() {
    SqlStatement ss = SqlParamCompiler.compilePositional("SELECT '$1' AS lit, $1 AS v", List.of(7));
    assertEquals("SELECT '$1' AS lit, ? AS v", ss.sql());
    assertEquals(1, ss.binds().size());
  }

  @Test
  void missingPositionalValueIsValidationError() {
    assertThrows(ValidationException.class,
        () -> SqlParamCompiler.compilePositional("SELECT $3", List.of(1)));
  }
}
