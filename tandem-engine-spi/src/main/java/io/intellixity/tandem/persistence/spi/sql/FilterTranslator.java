package io.intellixity.tandem.persistence.spi.sql;

import io.intellixity.tandem.persistence.query.Operator;
import io.intellixity.tandem.persistence.query.QueryOptions;

/**
 * Backend-specific SPI: turns backend-neutral {@link QueryOptions} into a native statement.\n
 *
 * Implementations switch over the whole {@link Operator} enum and throw
 * {@link io.intellixity.tandem.persistence.error.UnsupportedOperatorException} for operators they
 * cannot express; {@link #supports(Operator)} must agree with that switch.\n
 */
public interface FilterTranslator<S extends NativeStatement> {
  /** Stable backend id used in errors and logs (e.g. "mongo", "postgres"). */
  String id();

  boolean supports(Operator operator);

  S translateList(String collection, QueryOptions options);

  S translateCount(String collection, QueryOptions options);
}
