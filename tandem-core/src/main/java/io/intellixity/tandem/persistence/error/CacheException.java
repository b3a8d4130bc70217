package io.intellixity.tandem.persistence.error;

/** Internal cache failure. Logged by the cache layer and never surfaced to callers. */
public final class CacheException extends DataAccessException {
  public CacheException(String operation, String message, Throwable cause) {
    super(null, operation, message, cause);
  }

  @Override public boolean isRecoverable() { return false; }
}
