package io.intellixity.tandem.persistence.query;

/**
 * Keyset pagination over the record id.\n
 *
 * {@code cursor} is the id of the last record of the previous page, or null for the first page.\n
 */
public record CursorPage(Object cursor, int limit) implements Page {
  public CursorPage {
    if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
  }

  public static CursorPage first(int limit) {
    return new CursorPage(null, limit);
  }

  public CursorPage after(Object lastId) {
    return new CursorPage(lastId, limit);
  }
}
