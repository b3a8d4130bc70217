package io.intellixity.tandem.persistence.mongo;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.MongoInterruptedException;
import com.mongodb.MongoSecurityException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.MongoWriteException;
import io.intellixity.tandem.persistence.error.*;
import io.intellixity.tandem.persistence.exec.BackendKind;
import org.bson.json.JsonParseException;

/**
 * Classifies MongoDB driver failures.\n
 *
 * - socket, server selection timeout, authentication -> {@link ConnectionException}\n
 * - maxTime exceeded, interrupted -> {@link OperationCancelledException}\n
 * - duplicate key, write/command errors -> {@link OperationException}\n
 * - malformed commands or arguments -> {@link ValidationException}\n
 */
public final class MongoFailures {
  private MongoFailures() {}

  public static DataAccessException translate(BackendKind backend, String operation, RuntimeException e) {
    if (e instanceof MongoSocketException || e instanceof MongoTimeoutException || e instanceof MongoSecurityException) {
      return new ConnectionException(backend, operation, "MongoDB unavailable: " + e.getMessage(), e);
    }
    if (e instanceof MongoExecutionTimeoutException) {
      return new OperationCancelledException(backend, operation, "MongoDB operation exceeded its time limit", e);
    }
    if (e instanceof MongoInterruptedException) {
      return new OperationCancelledException(backend, operation, "MongoDB operation interrupted", e);
    }
    if (e instanceof MongoWriteException w && w.getError().getCategory() == ErrorCategory.DUPLICATE_KEY) {
      return new OperationException(backend, operation, "Duplicate key: " + w.getError().getMessage(), e);
    }
    if (e instanceof MongoException) {
      return new OperationException(backend, operation, "MongoDB rejected " + operation + ": " + e.getMessage(), e);
    }
    if (e instanceof JsonParseException || e instanceof IllegalArgumentException) {
      return new ValidationException(backend, operation, e.getMessage(), e);
    }
    return new OperationException(backend, operation, String.valueOf(e.getMessage()), e);
  }
}
