package io.intellixity.recordql.persistence.query;

import java.util.Objects;

public record FunctionCall(Func func) implements Expression {
  public FunctionCall {
    Objects.requireNonNull(func, "func");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
