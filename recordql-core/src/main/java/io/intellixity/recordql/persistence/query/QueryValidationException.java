package io.intellixity.recordql.persistence.query;

import java.util.Objects;

/**
 * Raised when a well-formed query asks for something the backend does not support
 * (operator, function, sort order) or uses a feature outside its legal context.
 * <p>
 * Callers surface it as a query validation failure; compiling the same input again yields the same error.
 */
public final class QueryValidationException extends RuntimeException {
  public enum Reason {
    UNSUPPORTED_OPERATOR,
    UNSUPPORTED_FUNCTION,
    UNKNOWN_SORT_ORDER,
    INVALID_SORT,
    INVALID_CONTEXT
  }

  private final Reason reason;

  public QueryValidationException(Reason reason, String message) {
    super(message);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public Reason reason() { return reason; }
}
