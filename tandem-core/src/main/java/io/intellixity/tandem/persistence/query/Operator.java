package io.intellixity.tandem.persistence.query;

import java.util.Locale;

/**
 * Closed set of filter operators.\n
 *
 * Backends declare which of these they can execute; translation of an unsupported one fails with
 * {@link io.intellixity.tandem.persistence.error.UnsupportedOperatorException}.\n
 */
public enum Operator {
  EQ("eq"),
  NEQ("neq"),
  GT("gt"),
  GTE("gte"),
  LT("lt"),
  LTE("lte"),

  LIKE("like"),
  ILIKE("ilike"),
  IN("in"),
  IS("is"),

  // Collection operators
  CONTAINS("contains"),
  CONTAINED_BY("containedBy"),
  OVERLAPS("overlaps"),

  TEXT_SEARCH("textSearch"),

  // Range-type operators (relational backends with native range types)
  RANGE_GT("rangeGt"),
  RANGE_LT("rangeLt"),
  RANGE_GTE("rangeGte"),
  RANGE_LTE("rangeLte"),
  RANGE_ADJACENT("rangeAdjacent");

  private final String wireName;

  Operator(String wireName) {
    this.wireName = wireName;
  }

  /** Name used in serialized queries and cache keys. */
  public String wireName() {
    return wireName;
  }

  public boolean isRange() {
    return switch (this) {
      case RANGE_GT, RANGE_LT, RANGE_GTE, RANGE_LTE, RANGE_ADJACENT -> true;
      default -> false;
    };
  }

  /** Accepts the wire name ("containedBy") or the enum constant ("CONTAINED_BY"), case-insensitive. */
  public static Operator fromWireName(String name) {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("operator is required");
    String n = name.trim();
    for (Operator op : values()) {
      if (op.wireName.equalsIgnoreCase(n) || op.name().equalsIgnoreCase(n)) return op;
    }
    throw new IllegalArgumentException("Unknown operator: " + n.toLowerCase(Locale.ROOT));
  }
}
