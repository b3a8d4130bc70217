package io.intellixity.tandem.persistence.access;

import io.intellixity.tandem.persistence.exec.BackendKind;

import java.time.Instant;

/** One fallback from the preferred backend to the other one. */
public record FallbackEvent(String operation, BackendKind fromBackend, BackendKind toBackend,
                            String errorClass, String errorMessage, Instant timestamp) {}
