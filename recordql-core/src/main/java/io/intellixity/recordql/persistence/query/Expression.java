package io.intellixity.recordql.persistence.query;

/** Value-producing node: a column reference, a literal, or a function call. */
public sealed interface Expression permits KeyPath, Literal, FunctionCall {
  <R> R accept(ExpressionVisitor<R> visitor);
}
