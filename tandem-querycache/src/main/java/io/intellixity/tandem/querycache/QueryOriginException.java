package io.intellixity.tandem.querycache;

/** Failed origin request: transport error, non-2xx status, or GraphQL {@code errors}. */
public final class QueryOriginException extends RuntimeException {
  private final int status;

  public QueryOriginException(String message, int status, Throwable cause) {
    super(message, cause);
    this.status = status;
  }

  public QueryOriginException(String message, Throwable cause) {
    this(message, -1, cause);
  }

  /** HTTP status, or -1 when no response was received. */
  public int status() { return status; }
}
