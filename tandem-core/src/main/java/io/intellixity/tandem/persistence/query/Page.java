package io.intellixity.tandem.persistence.query;

/** Pagination: either {@link OffsetPage} or {@link CursorPage}. */
public interface Page {
  int limit();
}
