package io.intellixity.tandem.persistence.jdbc.postgres;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.intellixity.tandem.persistence.jdbc.Bind;
import io.intellixity.tandem.persistence.jdbc.SqlStatement;
import io.intellixity.tandem.persistence.jdbc.SqlStatement.ExecKind;
import io.intellixity.tandem.persistence.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.tandem.persistence.query.OffsetPage;
import io.intellixity.tandem.persistence.query.Operator;
import io.intellixity.tandem.persistence.query.Page;
import io.intellixity.tandem.persistence.record.DataRecord;
import org.postgresql.util.PGobject;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.*;

/**
 * Postgres dialect implementation for JDBC.
 *
 * Keeps only Postgres-specific overrides and bind behavior.\n
 * Generic SQL rendering lives in {@link AbstractJdbcSqlDialect}.
 */
public final class PostgresDialect extends AbstractJdbcSqlDialect {
  public static final String ID = "postgres";

  private static final Set<Operator> ALL = Collections.unmodifiableSet(EnumSet.allOf(Operator.class));

  private static final Map<Class<?>, String> PG_ELEM_TYPES = Map.of(
      String.class, "text",
      Integer.class, "int4",
      Long.class, "int8",
      Double.class, "float8",
      Boolean.class, "bool",
      UUID.class, "uuid"
  );

  private static final Map<Operator, String> RANGE_OPS = Map.of(
      Operator.RANGE_GT, ">>",
      Operator.RANGE_LT, "<<",
      Operator.RANGE_GTE, "&>",
      Operator.RANGE_LTE, "&<",
      Operator.RANGE_ADJACENT, "-|-"
  );

  @Override public String id() { return ID; }

  @Override
  protected Set<Operator> supportedOperators() {
    return ALL;
  }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected String applyPage(String sql, Page page) {
    if (page instanceof OffsetPage op && op.offset() > 0) {
      return sql + " LIMIT " + page.limit() + " OFFSET " + op.offset();
    }
    return sql + " LIMIT " + page.limit();
  }

  @Override
  protected boolean supportsReturning() {
    return true;
  }

  @Override
  protected String applyReturning(String dmlSql) {
    return dmlSql + " RETURNING *";
  }

  @Override
  public SqlStatement renderUpsert(String table, DataRecord record) {
    SqlStatement insertBase = insertBase(table, record);
    StringBuilder sql = new StringBuilder(insertBase.sql());
    sql.append(" ON CONFLICT (").append(quoteIdent(DataRecord.ID)).append(") DO ");

    List<String> updateCols = new ArrayList<>();
    for (String c : record.fields().keySet()) {
      if (!DataRecord.ID.equals(c)) updateCols.add(quoteIdent(c) + " = EXCLUDED." + quoteIdent(c));
    }
    if (updateCols.isEmpty()) {
      // nothing to overwrite; touch id so RETURNING still yields the row
      sql.append("UPDATE SET ").append(quoteIdent(DataRecord.ID)).append(" = EXCLUDED.").append(quoteIdent(DataRecord.ID));
    } else {
      sql.append("UPDATE SET ").append(String.join(", ", updateCols));
    }
    sql.append(" RETURNING *");
    return new SqlStatement(sql.toString(), insertBase.binds(), ExecKind.QUERY);
  }

  // --- Postgres-only operators ---

  @Override
  protected String renderIlike(String expr, Object value, RenderCtx ctx) {
    return expr + " ILIKE " + ctx.add(Bind.scalar(value));
  }

  @Override
  protected String renderContains(String expr, List<Object> values, RenderCtx ctx) {
    return expr + " @> " + ctx.add(new Bind(List.copyOf(values), Bind.Kind.ARRAY));
  }

  @Override
  protected String renderContainedBy(String expr, List<Object> values, RenderCtx ctx) {
    return expr + " <@ " + ctx.add(new Bind(List.copyOf(values), Bind.Kind.ARRAY));
  }

  @Override
  protected String renderOverlaps(String expr, List<Object> values, RenderCtx ctx) {
    return expr + " && " + ctx.add(new Bind(List.copyOf(values), Bind.Kind.ARRAY));
  }

  @Override
  protected String renderTextSearch(String expr, String query, RenderCtx ctx) {
    return "to_tsvector(" + expr + ") @@ websearch_to_tsquery(" + ctx.add(Bind.scalar(query)) + ")";
  }

  @Override
  protected String renderRange(String expr, Operator op, String rangeLiteral, RenderCtx ctx) {
    return expr + " " + RANGE_OPS.get(op) + " " + ctx.add(new Bind(rangeLiteral, Bind.Kind.OTHER));
  }

  // --- Binding ---

  @Override
  protected void bindJson(PreparedStatement ps, int position, Object v) throws SQLException {
    if (v == null) {
      ps.setNull(position, Types.OTHER);
      return;
    }
    PGobject obj = new PGobject();
    obj.setType("jsonb");
    obj.setValue(v instanceof CharSequence cs ? cs.toString() : toJson(v));
    ps.setObject(position, obj);
  }

  @Override
  protected String arrayElementType(List<Object> values) {
    Object first = values.stream().filter(Objects::nonNull).findFirst().orElse(null);
    if (first == null) return "text";
    return PG_ELEM_TYPES.getOrDefault(first.getClass(), "text");
  }

  @Override
  public Object readValue(Object raw) {
    if (raw instanceof PGobject pg) {
      String type = pg.getType();
      String value = pg.getValue();
      if (value != null && ("json".equals(type) || "jsonb".equals(type))) {
        try {
          return JSON.readValue(value, Object.class);
        } catch (JsonProcessingException e) {
          throw new IllegalStateException("Invalid " + type + " value returned by Postgres", e);
        }
      }
      return value;
    }
    if (raw instanceof UUID u) return u.toString();
    return raw;
  }
}
