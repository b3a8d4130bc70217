package io.intellixity.tandem.persistence.spi.sql;

/** Marker interface for backend-native statements (SQL + binds, BSON documents, etc.). */
public interface NativeStatement {}
