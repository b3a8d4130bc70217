package io.intellixity.tandem.persistence.query;

/** What a backend does with a filter whose operator it cannot execute. */
public enum UnsupportedOperatorPolicy {
  /** Fail the query with UnsupportedOperatorException. */
  ABORT,
  /** Drop the condition (logged) and run the rest of the query. */
  DROP
}
