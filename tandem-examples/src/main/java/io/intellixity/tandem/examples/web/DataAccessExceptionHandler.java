package io.intellixity.tandem.examples.web;

import io.intellixity.tandem.persistence.error.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/** Maps the data-access error taxonomy onto HTTP statuses. */
@RestControllerAdvice
public final class DataAccessExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(DataAccessExceptionHandler.class);

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<Map<String, Object>> handle(DataAccessException e) {
    HttpStatus status = status(e);
    if (status.is5xxServerError()) {
      log.error("tandem.http status={} backend={} op={} error={}", status.value(), e.backend(), e.operation(),
          e.getMessage(), e);
    } else {
      log.warn("tandem.http status={} backend={} op={} error={}", status.value(), e.backend(), e.operation(),
          e.getMessage());
    }
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", e.getMessage());
    body.put("type", e.getClass().getSimpleName());
    body.put("operation", e.operation());
    if (e.backend() != null) body.put("backend", e.backend().name());
    return ResponseEntity.status(status).body(body);
  }

  static HttpStatus status(DataAccessException e) {
    if (e instanceof NotFoundException) return HttpStatus.NOT_FOUND;
    if (e instanceof ValidationException || e instanceof UnsupportedOperatorException) return HttpStatus.BAD_REQUEST;
    if (e instanceof OperationCancelledException) return HttpStatus.GATEWAY_TIMEOUT;
    if (e instanceof ConnectionException) return HttpStatus.SERVICE_UNAVAILABLE;
    if (e instanceof OperationException) return HttpStatus.CONFLICT;
    return HttpStatus.INTERNAL_SERVER_ERROR;
  }
}
