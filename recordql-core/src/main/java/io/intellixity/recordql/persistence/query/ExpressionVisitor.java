package io.intellixity.recordql.persistence.query;

public interface ExpressionVisitor<R> {
  R visit(KeyPath keyPath);
  R visit(Literal literal);
  R visit(FunctionCall call);
}
