package io.intellixity.tandem.persistence.exec;

/** Opaque backend transaction handle. */
public interface TxHandle {}
