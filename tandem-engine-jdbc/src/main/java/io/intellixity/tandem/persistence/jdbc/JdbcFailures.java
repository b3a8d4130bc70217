package io.intellixity.tandem.persistence.jdbc;

import io.intellixity.tandem.persistence.error.*;
import io.intellixity.tandem.persistence.exec.BackendKind;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;

/**
 * Classifies JDBC failures by exception type and SQLState class.\n
 *
 * - 08xxx, 53xxx, 57P0x and connection exceptions -> {@link ConnectionException}\n
 * - 57014 and statement timeouts -> {@link OperationCancelledException}\n
 * - 22xxx, 42xxx -> {@link ValidationException}\n
 * - 23xxx (integrity) and everything else -> {@link OperationException}\n
 */
public final class JdbcFailures {
  private JdbcFailures() {}

  public static DataAccessException translate(BackendKind backend, String operation, SQLException e) {
    String state = rootState(e);

    if (e instanceof SQLTransientConnectionException || e instanceof SQLNonTransientConnectionException) {
      return new ConnectionException(backend, operation, "Database unavailable: " + e.getMessage(), e);
    }
    if (e instanceof SQLTimeoutException || "57014".equals(state)) {
      return new OperationCancelledException(backend, operation, "Statement cancelled or timed out", e);
    }
    if (state != null) {
      if (state.startsWith("08") || state.startsWith("53") || state.startsWith("57P")) {
        return new ConnectionException(backend, operation, "Database unavailable (" + state + "): " + e.getMessage(), e);
      }
      if (state.startsWith("23")) {
        return new OperationException(backend, operation, "Constraint violation (" + state + "): " + e.getMessage(), e);
      }
      if (state.startsWith("22") || state.startsWith("42")) {
        return new ValidationException(backend, operation, "Invalid statement or value (" + state + "): " + e.getMessage(), e);
      }
    }
    return new OperationException(backend, operation,
        "Database rejected " + operation + (state == null ? "" : " (" + state + ")") + ": " + e.getMessage(), e);
  }

  /** Runtime failures raised outside JDBC calls (pool, serialization). */
  public static DataAccessException translate(BackendKind backend, String operation, RuntimeException e) {
    if (e.getCause() instanceof SQLException se) return translate(backend, operation, se);
    if (e instanceof IllegalArgumentException) return new ValidationException(backend, operation, e.getMessage(), e);
    return new OperationException(backend, operation, String.valueOf(e.getMessage()), e);
  }

  private static String rootState(SQLException e) {
    SQLException cur = e;
    while (cur != null) {
      if (cur.getSQLState() != null) return cur.getSQLState();
      cur = cur.getNextException();
    }
    return null;
  }
}
