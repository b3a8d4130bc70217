package io.intellixity.tandem.persistence.query;

import io.intellixity.tandem.persistence.record.DataRecord;

import java.util.List;

/**
 * One page of records.\n
 *
 * {@code totalCount} and {@code pageCount} are -1 unless the query asked for a count.\n
 */
public record PageResult(List<DataRecord> items, long totalCount, int page, int pageSize, long pageCount) {
  public PageResult {
    items = (items == null) ? List.of() : List.copyOf(items);
  }

  public static PageResult of(List<DataRecord> items, Page page, Long totalCount) {
    if (items == null) items = List.of();
    int pageSize = (page == null) ? items.size() : page.limit();
    int pageNo = (page instanceof OffsetPage op) ? op.pageNumber() : 1;
    if (totalCount == null) return new PageResult(items, -1, pageNo, pageSize, -1);
    long pages = (pageSize <= 0) ? 0 : (totalCount + pageSize - 1) / pageSize;
    return new PageResult(items, totalCount, pageNo, pageSize, pages);
  }

  public boolean hasCount() {
    return totalCount >= 0;
  }
}
