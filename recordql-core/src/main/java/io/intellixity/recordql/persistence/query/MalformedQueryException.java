package io.intellixity.recordql.persistence.query;

/**
 * A query tree that cannot be completed into SQL (empty predicate, wrong arity, illegal operand
 * pairing, function used outside its context). Indicates a bug in query construction; not retried.
 */
public final class MalformedQueryException extends IllegalArgumentException {
  public MalformedQueryException(String message) {
    super(message);
  }

  public MalformedQueryException(String message, Throwable cause) {
    super(message, cause);
  }
}
