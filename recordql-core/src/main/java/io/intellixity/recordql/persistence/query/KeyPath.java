package io.intellixity.recordql.persistence.query;

import java.util.Objects;

/** Column reference by name. */
public record KeyPath(String name) implements Expression {
  public KeyPath {
    Objects.requireNonNull(name, "name");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
