package io.intellixity.tandem.persistence.query;

import java.util.Objects;

public record SortField(String column, boolean ascending) {
  public SortField {
    Objects.requireNonNull(column, "column");
  }

  public static SortField asc(String column) { return new SortField(column, true); }
  public static SortField desc(String column) { return new SortField(column, false); }
}
