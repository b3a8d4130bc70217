package io.intellixity.tandem.persistence.exec;

import java.util.Locale;

/** Role of a backend in this process. Declared by each client, never probed. */
public enum BackendKind {
  /** Low-latency key/document store. */
  PRIMARY,
  /** Relational store; the only one that supports transactions. */
  SECONDARY;

  public BackendKind other() {
    return this == PRIMARY ? SECONDARY : PRIMARY;
  }

  /** Accepts "primary"/"secondary" in any case; null or blank yields null. */
  public static BackendKind parse(String value) {
    if (value == null || value.isBlank()) return null;
    try {
      return BackendKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown backend '" + value + "' (expected PRIMARY or SECONDARY)", e);
    }
  }
}
