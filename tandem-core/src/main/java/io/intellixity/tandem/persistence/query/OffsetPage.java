package io.intellixity.tandem.persistence.query;

public record OffsetPage(int offset, int limit) implements Page {
  public OffsetPage {
    if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
  }

  /** 1-based page number. */
  public static OffsetPage of(int page, int pageSize) {
    if (page < 1) throw new IllegalArgumentException("page must be >= 1");
    if (pageSize <= 0) throw new IllegalArgumentException("pageSize must be > 0");
    return new OffsetPage((page - 1) * pageSize, pageSize);
  }

  public int pageNumber() {
    return offset / limit + 1;
  }
}
