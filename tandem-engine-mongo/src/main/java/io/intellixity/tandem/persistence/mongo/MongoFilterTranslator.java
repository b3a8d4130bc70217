package io.intellixity.tandem.persistence.mongo;

import io.intellixity.tandem.persistence.error.UnsupportedOperatorException;
import io.intellixity.tandem.persistence.exec.BackendKind;
import io.intellixity.tandem.persistence.query.*;
import io.intellixity.tandem.persistence.spi.exec.DefaultQueryOptionsValidator;
import io.intellixity.tandem.persistence.spi.sql.FilterTranslator;
import org.bson.Document;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Renders {@link QueryOptions} to MongoDB BSON ({@link Document}).\n
 *
 * - Conditions are AND-combined; a single condition renders without an {@code $and} wrapper.\n
 * - EQ/NEQ null keep Mongo's "missing or null" semantics.\n
 * - Record {@code id} is stored as {@code _id}.\n
 * - Full-text search and range-type operators have no Mongo counterpart and are rejected.\n
 */
public final class MongoFilterTranslator implements FilterTranslator<MongoStatement> {
  public static final String ID = "mongo";

  private static final Set<Operator> SUPPORTED = Collections.unmodifiableSet(EnumSet.of(
      Operator.EQ, Operator.NEQ, Operator.GT, Operator.GTE, Operator.LT, Operator.LTE,
      Operator.LIKE, Operator.ILIKE, Operator.IN, Operator.IS,
      Operator.CONTAINS, Operator.CONTAINED_BY, Operator.OVERLAPS));

  @Override public String id() { return ID; }

  @Override
  public boolean supports(Operator operator) {
    return SUPPORTED.contains(operator);
  }

  public static Set<Operator> supportedOperators() {
    return SUPPORTED;
  }

  @Override
  public MongoStatement translateList(String collection, QueryOptions options) {
    Document filter = toFilter(options.filters());
    Page page = options.page();
    List<SortField> sort = new ArrayList<>(options.sort());

    if (page instanceof CursorPage cp) {
      DefaultQueryOptionsValidator.requireCursorOrder(BackendKind.PRIMARY, options);
      if (cp.cursor() != null) filter = and(filter, new Document("_id", new Document("$gt", cp.cursor())));
      sort.removeIf(sf -> DataRecordDocuments.ID.equals(sf.column()));
      sort.add(SortField.asc(DataRecordDocuments.ID));
    }

    Document sortDoc = toSort(sort);
    Document projection = toProjection(options.select(), options.include());
    Integer skip = (page instanceof OffsetPage op && op.offset() > 0) ? op.offset() : null;
    Integer limit = (page == null) ? null : page.limit();

    if (options.include().isEmpty()) {
      return new MongoStatement(MongoStatement.Kind.FIND, collection, filter, null, sortDoc, projection, skip, limit);
    }

    List<Document> pipeline = new ArrayList<>();
    if (!filter.isEmpty()) pipeline.add(new Document("$match", filter));
    if (sortDoc != null) pipeline.add(new Document("$sort", sortDoc));
    if (skip != null) pipeline.add(new Document("$skip", skip));
    if (limit != null) pipeline.add(new Document("$limit", limit));
    for (Include inc : options.include()) {
      pipeline.add(new Document("$lookup", new Document("from", inc.table())
          .append("localField", path(inc.foreignKey()))
          .append("foreignField", path(inc.primaryKey()))
          .append("as", inc.table())));
      pipeline.add(new Document("$unwind", new Document("path", "$" + inc.table())
          .append("preserveNullAndEmptyArrays", true)));
    }
    if (projection != null) pipeline.add(new Document("$project", projection));
    return new MongoStatement(MongoStatement.Kind.AGGREGATE, collection, filter, pipeline, sortDoc, projection, skip, limit);
  }

  @Override
  public MongoStatement translateCount(String collection, QueryOptions options) {
    Document filter = toFilter(options.filters());
    return new MongoStatement(MongoStatement.Kind.COUNT, collection, filter, null, null, null, null, null);
  }

  Document toFilter(List<FilterCondition> filters) {
    if (filters == null || filters.isEmpty()) return new Document();
    List<Document> parts = new ArrayList<>(filters.size());
    for (FilterCondition c : filters) parts.add(render(c));
    if (parts.size() == 1) return parts.get(0);
    return new Document("$and", parts);
  }

  private Document render(FilterCondition c) {
    String path = path(c.column());
    Object v = c.value();
    return switch (c.operator()) {
      case EQ -> new Document(path, v);
      case NEQ -> new Document(path, new Document("$ne", v));
      case GT -> new Document(path, new Document("$gt", v));
      case GTE -> new Document(path, new Document("$gte", v));
      case LT -> new Document(path, new Document("$lt", v));
      case LTE -> new Document(path, new Document("$lte", v));
      case LIKE -> new Document(path, new Document("$regex", likeToRegex(String.valueOf(v))));
      case ILIKE -> new Document(path, new Document("$regex", likeToRegex(String.valueOf(v))).append("$options", "i"));
      case IN -> new Document(path, new Document("$in", toList(v)));
      // IS null matches null or missing; IS true/false matches the boolean exactly
      case IS -> new Document(path, v);
      case CONTAINS -> new Document(path, new Document("$all", toList(v)));
      // no element outside the given set
      case CONTAINED_BY -> new Document(path, new Document("$not",
          new Document("$elemMatch", new Document("$nin", toList(v)))));
      case OVERLAPS -> new Document(path, new Document("$in", toList(v)));
      case TEXT_SEARCH, RANGE_GT, RANGE_LT, RANGE_GTE, RANGE_LTE, RANGE_ADJACENT ->
          throw new UnsupportedOperatorException(null, ID, c.operator(), c.column());
    };
  }

  private static Document toSort(List<SortField> sort) {
    if (sort == null || sort.isEmpty()) return null;
    Document d = new Document();
    for (SortField sf : sort) d.append(path(sf.column()), sf.ascending() ? 1 : -1);
    return d;
  }

  private static Document toProjection(List<String> select, List<Include> include) {
    if (select == null || select.isEmpty()) return null;
    Document d = new Document();
    boolean withId = false;
    for (String s : select) {
      if (DataRecordDocuments.ID.equals(s)) withId = true;
      else d.append(s, 1);
    }
    for (Include inc : include) d.append(inc.table(), 1);
    if (!withId) d.append("_id", 0);
    return d;
  }

  static String path(String column) {
    return DataRecordDocuments.ID.equals(column) ? "_id" : column;
  }

  private static Document and(Document a, Document b) {
    if (a == null || a.isEmpty()) return b;
    return new Document("$and", List.of(a, b));
  }

  /** SQL LIKE to an anchored regex: '%' -> '.*', '_' -> '.', everything else literal. */
  static String likeToRegex(String likePattern) {
    StringBuilder re = new StringBuilder();
    re.append("^");
    for (int i = 0; i < likePattern.length(); i++) {
      char ch = likePattern.charAt(i);
      if (ch == '%') re.append(".*");
      else if (ch == '_') re.append(".");
      else re.append(Pattern.quote(String.valueOf(ch)));
    }
    re.append("$");
    return re.toString();
  }

  @SuppressWarnings("unchecked")
  private static List<Object> toList(Object v) {
    if (v == null) return List.of();
    if (v instanceof List<?> l) return (List<Object>) l;
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    return List.of(v);
  }
}
