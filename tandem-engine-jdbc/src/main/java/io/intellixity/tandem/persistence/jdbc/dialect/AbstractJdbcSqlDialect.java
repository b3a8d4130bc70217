package io.intellixity.tandem.persistence.jdbc.dialect;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.tandem.persistence.error.UnsupportedOperatorException;
import io.intellixity.tandem.persistence.error.ValidationException;
import io.intellixity.tandem.persistence.exec.BackendKind;
import io.intellixity.tandem.persistence.jdbc.Bind;
import io.intellixity.tandem.persistence.jdbc.SqlStatement;
import io.intellixity.tandem.persistence.jdbc.SqlStatement.ExecKind;
import io.intellixity.tandem.persistence.query.*;
import io.intellixity.tandem.persistence.record.DataRecord;
import io.intellixity.tandem.persistence.spi.exec.DefaultQueryOptionsValidator;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.*;

/**
 * JDBC-generic SQL dialect base.\n
 *
 * Provides common rendering for:\n
 * - select/count: projection + include joins + filter + keyset predicate + sort + paging\n
 * - DML: get/insert/update/delete by id\n
 *
 * DB-specific dialects override hooks for quoting, paging, returning, upsert syntax and the
 * operators plain SQL has no spelling for (array containment, full-text search, ranges).\n
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {
  protected static final ObjectMapper JSON = new ObjectMapper();

  private static final Set<Operator> GENERIC = Collections.unmodifiableSet(EnumSet.of(
      Operator.EQ, Operator.NEQ, Operator.GT, Operator.GTE, Operator.LT, Operator.LTE,
      Operator.LIKE, Operator.ILIKE, Operator.IN, Operator.IS));

  protected static final class RenderCtx {
    private int n = 1;
    private final List<Bind> binds = new ArrayList<>();
    public String add(Bind b) {
      binds.add(b);
      return ":b" + (n++);
    }
    public List<Bind> binds() { return binds; }
  }

  @Override
  public boolean supports(Operator operator) {
    return supportedOperators().contains(operator);
  }

  /** Operators this dialect renders; must agree with the hooks it overrides. */
  protected Set<Operator> supportedOperators() {
    return GENERIC;
  }

  // --- Queries ---

  @Override
  public final SqlStatement translateList(String table, QueryOptions options) {
    RenderCtx ctx = new RenderCtx();
    boolean qualify = !options.include().isEmpty();
    Page page = options.page();

    StringBuilder sql = new StringBuilder("SELECT ")
        .append(projection(table, options.select(), options.include()))
        .append(fromClause(table, options.include()));

    List<String> where = predicates(table, options.filters(), qualify, ctx);
    List<SortField> sort = new ArrayList<>(options.sort());
    if (page instanceof CursorPage cp) {
      DefaultQueryOptionsValidator.requireCursorOrder(BackendKind.SECONDARY, options);
      if (cp.cursor() != null) where.add(column(table, DataRecord.ID, qualify) + " > " + ctx.add(Bind.scalar(cp.cursor())));
      sort.removeIf(sf -> DataRecord.ID.equals(sf.column()));
      sort.add(SortField.asc(DataRecord.ID));
    }
    if (!where.isEmpty()) sql.append(" WHERE ").append(String.join(" AND ", where));

    if (!sort.isEmpty()) {
      List<String> parts = new ArrayList<>(sort.size());
      for (SortField sf : sort) parts.add(column(table, sf.column(), qualify) + (sf.ascending() ? " ASC" : " DESC"));
      sql.append(" ORDER BY ").append(String.join(", ", parts));
    }

    String paged = (page == null) ? sql.toString() : applyPage(sql.toString(), page);
    return new SqlStatement(paged, ctx.binds(), ExecKind.QUERY);
  }

  @Override
  public final SqlStatement translateCount(String table, QueryOptions options) {
    RenderCtx ctx = new RenderCtx();
    boolean qualify = !options.include().isEmpty();
    StringBuilder inner = new StringBuilder("SELECT 1").append(fromClause(table, options.include()));
    List<String> where = predicates(table, options.filters(), qualify, ctx);
    if (!where.isEmpty()) inner.append(" WHERE ").append(String.join(" AND ", where));
    String sql = "SELECT COUNT(1) FROM (" + inner + ") tandem_count";
    return new SqlStatement(sql, ctx.binds(), ExecKind.QUERY);
  }

  private String fromClause(String table, List<Include> include) {
    StringBuilder sb = new StringBuilder(" FROM ").append(quoteIdent(table));
    for (Include inc : include) {
      sb.append(" LEFT JOIN ").append(quoteIdent(inc.table()))
          .append(" ON ").append(quoteIdent(inc.table())).append('.').append(quoteIdent(inc.primaryKey()))
          .append(" = ").append(quoteIdent(table)).append('.').append(quoteIdent(inc.foreignKey()));
    }
    return sb.toString();
  }

  private String projection(String table, List<String> select, List<Include> include) {
    boolean qualify = !include.isEmpty();
    List<String> items = new ArrayList<>();
    if (select.isEmpty()) {
      items.add(qualify ? quoteIdent(table) + ".*" : "*");
    } else {
      for (String s : select) items.add(column(table, s, qualify) + (s.contains(".") ? " AS " + quoteIdent(s) : ""));
    }
    for (Include inc : include) {
      if (inc.fields().isEmpty()) {
        throw new ValidationException(BackendKind.SECONDARY, "list",
            "include '" + inc.table() + "' must name its fields for relational backends", null);
      }
      for (String f : inc.fields()) {
        items.add(quoteIdent(inc.table()) + "." + quoteIdent(f) + " AS " + quoteIdent(inc.table() + "." + f));
      }
    }
    return String.join(", ", items);
  }

  private List<String> predicates(String table, List<FilterCondition> filters, boolean qualify, RenderCtx ctx) {
    List<String> out = new ArrayList<>(filters.size());
    for (FilterCondition c : filters) out.add(renderCondition(c, column(table, c.column(), qualify), ctx));
    return out;
  }

  /** Column reference; dotted names address an included table's column. */
  protected String column(String table, String name, boolean qualify) {
    int dot = name.indexOf('.');
    if (dot > 0) return quoteIdent(name.substring(0, dot)) + "." + quoteIdent(name.substring(dot + 1));
    return qualify ? quoteIdent(table) + "." + quoteIdent(name) : quoteIdent(name);
  }

  protected String renderCondition(FilterCondition c, String expr, RenderCtx ctx) {
    Object v = c.value();
    return switch (c.operator()) {
      case EQ -> (v == null) ? expr + " IS NULL" : binary(expr, "=", v, ctx);
      case NEQ -> (v == null) ? expr + " IS NOT NULL" : binary(expr, "<>", v, ctx);
      case GT -> binary(expr, ">", v, ctx);
      case GTE -> binary(expr, ">=", v, ctx);
      case LT -> binary(expr, "<", v, ctx);
      case LTE -> binary(expr, "<=", v, ctx);
      case LIKE -> binary(expr, "LIKE", v, ctx);
      case ILIKE -> renderIlike(expr, v, ctx);
      case IN -> {
        List<Object> vals = toList(v);
        if (vals.isEmpty()) yield "FALSE";
        List<String> ph = new ArrayList<>(vals.size());
        for (Object x : vals) ph.add(ctx.add(Bind.scalar(x)));
        yield expr + " IN (" + String.join(", ", ph) + ")";
      }
      case IS -> (v == null) ? expr + " IS NULL" : expr + (Boolean.TRUE.equals(v) ? " IS TRUE" : " IS FALSE");
      case CONTAINS -> renderContains(expr, toList(v), ctx);
      case CONTAINED_BY -> renderContainedBy(expr, toList(v), ctx);
      case OVERLAPS -> renderOverlaps(expr, toList(v), ctx);
      case TEXT_SEARCH -> renderTextSearch(expr, String.valueOf(v), ctx);
      case RANGE_GT, RANGE_LT, RANGE_GTE, RANGE_LTE, RANGE_ADJACENT -> renderRange(expr, c.operator(), String.valueOf(v), ctx);
    };
  }

  protected String renderIlike(String expr, Object value, RenderCtx ctx) {
    return "LOWER(" + expr + ") LIKE LOWER(" + ctx.add(Bind.scalar(value)) + ")";
  }

  /** Array column holds every value. Default throws; Postgres renders {@code @>}. */
  protected String renderContains(String expr, List<Object> values, RenderCtx ctx) {
    throw unsupported(Operator.CONTAINS, expr);
  }

  protected String renderContainedBy(String expr, List<Object> values, RenderCtx ctx) {
    throw unsupported(Operator.CONTAINED_BY, expr);
  }

  protected String renderOverlaps(String expr, List<Object> values, RenderCtx ctx) {
    throw unsupported(Operator.OVERLAPS, expr);
  }

  protected String renderTextSearch(String expr, String query, RenderCtx ctx) {
    throw unsupported(Operator.TEXT_SEARCH, expr);
  }

  protected String renderRange(String expr, Operator op, String rangeLiteral, RenderCtx ctx) {
    throw unsupported(op, expr);
  }

  protected final UnsupportedOperatorException unsupported(Operator op, String expr) {
    return new UnsupportedOperatorException(null, id(), op, expr);
  }

  /** Default is SQL:2008 OFFSET/FETCH; dialects override (Postgres LIMIT/OFFSET). */
  protected String applyPage(String sql, Page page) {
    int offset = (page instanceof OffsetPage op) ? op.offset() : 0;
    return sql + " OFFSET " + offset + " ROWS FETCH NEXT " + page.limit() + " ROWS ONLY";
  }

  private static String binary(String expr, String op, Object value, RenderCtx ctx) {
    return expr + " " + op + " " + ctx.add(Bind.scalar(value));
  }

  // --- DML ---

  @Override
  public SqlStatement renderGet(String table, Object id) {
    RenderCtx ctx = new RenderCtx();
    String sql = "SELECT * FROM " + quoteIdent(table) + " WHERE " + quoteIdent(DataRecord.ID) + " = " + ctx.add(Bind.scalar(id));
    return new SqlStatement(sql, ctx.binds(), ExecKind.QUERY);
  }

  @Override
  public SqlStatement renderInsert(String table, DataRecord record) {
    SqlStatement base = insertBase(table, record);
    if (!supportsReturning()) return base;
    return new SqlStatement(applyReturning(base.sql()), base.binds(), ExecKind.QUERY);
  }

  /** INSERT without any returning clause. */
  protected final SqlStatement insertBase(String table, DataRecord record) {
    if (record.fields().isEmpty()) throw new IllegalArgumentException("Insert has no columns");
    RenderCtx ctx = new RenderCtx();
    List<String> cols = new ArrayList<>();
    List<String> ph = new ArrayList<>();
    for (var e : record.fields().entrySet()) {
      cols.add(quoteIdent(e.getKey()));
      ph.add(ctx.add(Bind.infer(e.getValue())));
    }
    String sql = "INSERT INTO " + quoteIdent(table) +
        " (" + String.join(", ", cols) + ") VALUES (" + String.join(", ", ph) + ")";
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  @Override
  public SqlStatement renderUpdate(String table, Object id, Map<String, Object> partial) {
    Map<String, Object> sets = new LinkedHashMap<>(partial);
    sets.remove(DataRecord.ID);
    if (sets.isEmpty()) return renderGet(table, id);

    RenderCtx ctx = new RenderCtx();
    List<String> parts = new ArrayList<>();
    for (var e : sets.entrySet()) parts.add(quoteIdent(e.getKey()) + " = " + ctx.add(Bind.infer(e.getValue())));
    String sql = "UPDATE " + quoteIdent(table) + " SET " + String.join(", ", parts) +
        " WHERE " + quoteIdent(DataRecord.ID) + " = " + ctx.add(Bind.scalar(id));
    if (!supportsReturning()) return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
    return new SqlStatement(applyReturning(sql), ctx.binds(), ExecKind.QUERY);
  }

  @Override
  public SqlStatement renderDelete(String table, Object id) {
    RenderCtx ctx = new RenderCtx();
    String sql = "DELETE FROM " + quoteIdent(table) + " WHERE " + quoteIdent(DataRecord.ID) + " = " + ctx.add(Bind.scalar(id));
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  @Override
  public SqlStatement renderDeleteMany(String table, List<?> ids) {
    RenderCtx ctx = new RenderCtx();
    List<String> ph = new ArrayList<>(ids.size());
    for (Object id : ids) ph.add(ctx.add(Bind.scalar(id)));
    String sql = "DELETE FROM " + quoteIdent(table) + " WHERE " + quoteIdent(DataRecord.ID) + " IN (" + String.join(", ", ph) + ")";
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  /** DB-specific upsert keyed on {@code id}. */
  @Override
  public abstract SqlStatement renderUpsert(String table, DataRecord record);

  /** Whether DML can return the written row in the same statement. */
  protected boolean supportsReturning() {
    return false;
  }

  protected String applyReturning(String dmlSql) {
    return dmlSql;
  }

  protected abstract String quoteIdent(String ident);

  // --- Binding ---

  @Override
  public void bind(PreparedStatement ps, int position, Bind bind) throws SQLException {
    Object v = bind.value();
    switch (bind.kind()) {
      case SCALAR -> bindScalar(ps, position, v);
      case ARRAY -> {
        if (v == null) {
          ps.setNull(position, Types.ARRAY);
          return;
        }
        List<Object> vals = toList(v);
        ps.setArray(position, ps.getConnection().createArrayOf(arrayElementType(vals), vals.toArray()));
      }
      case JSON -> bindJson(ps, position, v);
      case OTHER -> {
        if (v == null) ps.setNull(position, Types.OTHER);
        else ps.setObject(position, v, Types.OTHER);
      }
    }
  }

  protected void bindScalar(PreparedStatement ps, int position, Object v) throws SQLException {
    if (v == null) ps.setObject(position, null);
    else if (v instanceof Instant i) ps.setTimestamp(position, Timestamp.from(i));
    else if (v instanceof Enum<?> e) ps.setString(position, e.name());
    else ps.setObject(position, v);
  }

  /** Default stores JSON as text; dialects with a native JSON type override. */
  protected void bindJson(PreparedStatement ps, int position, Object v) throws SQLException {
    if (v == null) ps.setNull(position, Types.VARCHAR);
    else ps.setString(position, toJson(v));
  }

  /** SQL element type name for {@link java.sql.Connection#createArrayOf}. */
  protected String arrayElementType(List<Object> values) {
    Object first = values.stream().filter(Objects::nonNull).findFirst().orElse(null);
    if (first instanceof Integer) return "INTEGER";
    if (first instanceof Long) return "BIGINT";
    if (first instanceof Double || first instanceof Float) return "DOUBLE";
    if (first instanceof Boolean) return "BOOLEAN";
    return "VARCHAR";
  }

  protected static String toJson(Object v) {
    try {
      return JSON.writeValueAsString(v);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Value is not JSON-serializable: " + e.getOriginalMessage(), e);
    }
  }

  @SuppressWarnings("unchecked")
  protected static List<Object> toList(Object v) {
    if (v == null) return List.of();
    if (v instanceof List<?> l) return (List<Object>) l;
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    return List.of(v);
  }
}
